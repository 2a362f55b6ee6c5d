package com.mike.emailharvester.service.fetch;

import java.io.IOException;

/**
 * Plain HTTP GET. Error statuses are returned, not thrown; I/O problems are thrown.
 */
public interface HttpGetClient {
    HttpGetResponse get(String requestUrl) throws IOException;
}
