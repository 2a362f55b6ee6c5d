package com.mike.emailharvester.service.crawl;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Raised by the caller, observed by the crawler before each batch.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
