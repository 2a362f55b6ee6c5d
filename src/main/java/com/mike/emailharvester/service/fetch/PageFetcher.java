package com.mike.emailharvester.service.fetch;

import com.mike.emailharvester.exception.TransportExhaustedException;

public interface PageFetcher {

    /**
     * @return body of the page
     * @throws TransportExhaustedException when no access route delivered the page
     */
    String fetch(String targetUrl) throws TransportExhaustedException;
}
