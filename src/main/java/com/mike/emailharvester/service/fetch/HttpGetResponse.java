package com.mike.emailharvester.service.fetch;

public record HttpGetResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
