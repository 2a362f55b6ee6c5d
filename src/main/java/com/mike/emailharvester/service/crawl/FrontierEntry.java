package com.mike.emailharvester.service.crawl;

import java.util.Objects;

/**
 * A normalized URL waiting in the frontier, with its link-hop distance from the start page.
 * Two entries are equal when their URLs are.
 */
public record FrontierEntry(String url, int depth) {

    public FrontierEntry {
        Objects.requireNonNull(url, "url");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrontierEntry other)) return false;
        return url.equals(other.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
