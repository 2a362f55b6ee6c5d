package com.mike.emailharvester.service.fetch;

import com.mike.emailharvester.config.HarvesterProperties;
import lombok.RequiredArgsConstructor;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@RequiredArgsConstructor
public class JsoupHttpGetClient implements HttpGetClient {

    private final HarvesterProperties properties;

    @Override
    public HttpGetResponse get(String requestUrl) throws IOException {
        HarvesterProperties.Fetch fetch = properties.getFetch();

        Connection.Response response = Jsoup.connect(requestUrl)
                .userAgent(fetch.getUserAgent())
                .referrer(fetch.getReferrer())
                .timeout((int) fetch.getTimeout().toMillis())
                .maxBodySize(fetch.getMaxBodySizeBytes())
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .followRedirects(true)
                .method(Connection.Method.GET)
                .execute();

        return new HttpGetResponse(response.statusCode(), response.body());
    }
}
