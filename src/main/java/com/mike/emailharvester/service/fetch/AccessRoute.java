package com.mike.emailharvester.service.fetch;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * One way of reaching a page. {@code {url}} is replaced by the URL-encoded target,
 * {@code {rawUrl}} by the target as is; "{rawUrl}" alone is a direct request.
 */
public record AccessRoute(String name, String template) {

    public static final String URL_PLACEHOLDER = "{url}";
    public static final String RAW_URL_PLACEHOLDER = "{rawUrl}";

    public AccessRoute {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Access route template is required (route '" + name + "')");
        }
        if (!template.contains(URL_PLACEHOLDER) && !template.contains(RAW_URL_PLACEHOLDER)) {
            throw new IllegalArgumentException("Access route template needs " + URL_PLACEHOLDER
                    + " or " + RAW_URL_PLACEHOLDER + ": '" + template + "'");
        }
        if (name == null || name.isBlank()) {
            name = template;
        }
    }

    public static AccessRoute direct() {
        return new AccessRoute("direct", RAW_URL_PLACEHOLDER);
    }

    public String requestUrlFor(String targetUrl) {
        return template
                .replace(URL_PLACEHOLDER, URLEncoder.encode(targetUrl, StandardCharsets.UTF_8))
                .replace(RAW_URL_PLACEHOLDER, targetUrl);
    }
}
