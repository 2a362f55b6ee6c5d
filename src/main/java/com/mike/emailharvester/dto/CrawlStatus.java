package com.mike.emailharvester.dto;

public enum CrawlStatus {
    /** frontier empty or page budget used up */
    COMPLETED,
    /** stopped at a batch boundary on request */
    CANCELLED
}
