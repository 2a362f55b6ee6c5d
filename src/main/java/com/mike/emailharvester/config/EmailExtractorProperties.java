package com.mike.emailharvester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "harvester.email")
public record EmailExtractorProperties(
        @DefaultValue("20") int base64MinTokenLength
) {
    public static EmailExtractorProperties defaults() {
        return new EmailExtractorProperties(20);
    }
}
