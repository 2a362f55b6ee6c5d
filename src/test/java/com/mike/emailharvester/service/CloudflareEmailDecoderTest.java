package com.mike.emailharvester.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CloudflareEmailDecoderTest {

    @Test
    @DisplayName("xor key + payload -> address")
    void decodes_payload() {
        assertEquals("info@example.com", CloudflareEmailDecoder.decode("422b2c242d02273a232f322e276c212d2f"));
    }

    @Test
    @DisplayName("malformed payloads -> null")
    void malformed_payload_returns_null() {
        assertNull(CloudflareEmailDecoder.decode(null));
        assertNull(CloudflareEmailDecoder.decode("42"));
        assertNull(CloudflareEmailDecoder.decode("422b2"));
        assertNull(CloudflareEmailDecoder.decode("zz2b2c24"));
    }
}
