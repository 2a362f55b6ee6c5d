package com.mike.emailharvester.config;

import com.mike.emailharvester.service.fetch.AccessRoute;
import com.mike.emailharvester.service.fetch.HttpGetClient;
import com.mike.emailharvester.service.fetch.PageFetcher;
import com.mike.emailharvester.service.fetch.RoutedPageFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Slf4j
@Configuration
public class FetchConfig {

    @Bean
    public PageFetcher pageFetcher(HarvesterProperties properties, HttpGetClient httpGetClient) {
        List<AccessRoute> routes = properties.getFetch().getRoutes().stream()
                .map(r -> new AccessRoute(r.getName(), r.getTemplate()))
                .toList();

        if (routes.isEmpty()) {
            throw new IllegalStateException("No access routes configured! Add harvester.fetch.routes[]");
        }

        log.info("FetchConfig: {} access routes configured: {}",
                routes.size(), routes.stream().map(AccessRoute::name).toList());
        return new RoutedPageFetcher(routes, httpGetClient);
    }
}
