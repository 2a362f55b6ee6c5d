package com.mike.emailharvester.service.fetch;

import com.mike.emailharvester.exception.TransportExhaustedException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;

/**
 * Tries the access routes in order and returns the first 2xx body. No retries within a route.
 */
@Slf4j
public class RoutedPageFetcher implements PageFetcher {

    private final List<AccessRoute> routes;
    private final HttpGetClient httpGetClient;

    public RoutedPageFetcher(List<AccessRoute> routes, HttpGetClient httpGetClient) {
        if (routes == null || routes.isEmpty()) {
            throw new IllegalArgumentException("At least one access route is required");
        }
        this.routes = List.copyOf(routes);
        this.httpGetClient = httpGetClient;
    }

    @Override
    public String fetch(String targetUrl) throws TransportExhaustedException {
        Exception lastFailure = null;

        for (AccessRoute route : routes) {
            String requestUrl = route.requestUrlFor(targetUrl);
            try {
                HttpGetResponse response = httpGetClient.get(requestUrl);
                if (response.isSuccess()) {
                    log.debug("RoutedPageFetcher: {} fetched via route '{}'", targetUrl, route.name());
                    return response.body() == null ? "" : response.body();
                }
                lastFailure = new IOException("HTTP " + response.statusCode() + " from route '" + route.name() + "'");
                log.warn("RoutedPageFetcher: route '{}' answered status={} for {}",
                        route.name(), response.statusCode(), targetUrl);
            } catch (IOException | RuntimeException e) {
                lastFailure = e;
                log.warn("RoutedPageFetcher: route '{}' failed for {}: {}", route.name(), targetUrl, e.toString());
            }
        }

        throw new TransportExhaustedException(targetUrl, routes.size(), lastFailure);
    }
}
