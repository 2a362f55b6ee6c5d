package com.mike.emailharvester;

import com.mike.emailharvester.config.EmailExtractorProperties;
import com.mike.emailharvester.config.HarvesterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({HarvesterProperties.class, EmailExtractorProperties.class})
public class EmailHarvesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmailHarvesterApplication.class, args);
    }

}
