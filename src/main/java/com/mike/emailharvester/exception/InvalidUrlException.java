package com.mike.emailharvester.exception;

/**
 * Raised when a start URL or a discovered link is not an absolute http(s) URL.
 */
public class InvalidUrlException extends IllegalArgumentException {

    public InvalidUrlException(String url, String message) {
        super(message + ": '" + url + "'");
    }

    public InvalidUrlException(String url, Throwable cause) {
        super("Invalid URL: '" + url + "'", cause);
    }
}
