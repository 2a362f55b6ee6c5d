package com.mike.emailharvester.service.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AccessRouteTest {

    private static final String TARGET = "https://x.com/a?b=1";

    @Test
    @DisplayName("direct route requests the target itself")
    void direct_route() {
        assertEquals(TARGET, AccessRoute.direct().requestUrlFor(TARGET));
    }

    @Test
    @DisplayName("{url} is replaced by the encoded target")
    void encoded_placeholder() {
        //Arrange
        AccessRoute route = new AccessRoute("allorigins", "https://api.allorigins.win/raw?url={url}");
        //Act
        String requestUrl = route.requestUrlFor(TARGET);
        //Assert
        assertEquals("https://api.allorigins.win/raw?url=https%3A%2F%2Fx.com%2Fa%3Fb%3D1", requestUrl);
    }

    @Test
    @DisplayName("{rawUrl} is replaced verbatim")
    void raw_placeholder() {
        AccessRoute route = new AccessRoute("proxy", "https://proxy.test/{rawUrl}");
        assertEquals("https://proxy.test/https://x.com/a?b=1", route.requestUrlFor(TARGET));
    }

    @Test
    @DisplayName("template without placeholder is rejected")
    void template_without_placeholder() {
        assertThrows(IllegalArgumentException.class, () -> new AccessRoute("broken", "https://proxy.test/"));
        assertThrows(IllegalArgumentException.class, () -> new AccessRoute("empty", " "));
    }

    @Test
    @DisplayName("missing name falls back to the template")
    void name_defaults_to_template() {
        assertEquals("{rawUrl}", new AccessRoute(null, "{rawUrl}").name());
    }
}
