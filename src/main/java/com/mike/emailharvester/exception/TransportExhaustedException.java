package com.mike.emailharvester.exception;

/**
 * Every configured access route failed for one page. The cause is the failure of the last route tried.
 */
public class TransportExhaustedException extends Exception {

    private final String targetUrl;
    private final int routesTried;

    public TransportExhaustedException(String targetUrl, int routesTried, Throwable lastFailure) {
        super("All " + routesTried + " access routes failed for " + targetUrl
                + (lastFailure != null ? " (last: " + lastFailure.getMessage() + ")" : ""), lastFailure);
        this.targetUrl = targetUrl;
        this.routesTried = routesTried;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public int getRoutesTried() {
        return routesTried;
    }
}
