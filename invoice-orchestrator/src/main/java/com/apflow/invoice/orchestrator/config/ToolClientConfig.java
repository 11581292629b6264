package com.apflow.invoice.orchestrator.config;

import com.apflow.invoice.orchestrator.client.HttpToolTransport;
import com.apflow.invoice.orchestrator.client.JsonToolClient;
import com.apflow.invoice.orchestrator.client.ToolTransport;
import com.apflow.invoice.tools.ReferenceToolClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Client side of the reference tools service.
 */
@Configuration
public class ToolClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ToolClientConfig.class);

    @Value("${reference-tools.base-url:http://localhost:8081}")
    private String baseUrl;

    @Value("${reference-tools.connect-timeout-ms:1000}")
    private long connectTimeoutMillis;

    @Value("${reference-tools.read-timeout-ms:3000}")
    private long readTimeoutMillis;

    @Bean
    public RestTemplate referenceToolsRestTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(Duration.ofMillis(connectTimeoutMillis))
            .setReadTimeout(Duration.ofMillis(readTimeoutMillis))
            .build();
    }

    @Bean
    public ToolTransport toolTransport(RestTemplate referenceToolsRestTemplate) {
        log.info("Reference tools endpoint - baseUrl={}, connectTimeoutMs={}, readTimeoutMs={}",
            baseUrl, connectTimeoutMillis, readTimeoutMillis);
        return new HttpToolTransport(referenceToolsRestTemplate, baseUrl);
    }

    @Bean
    public ReferenceToolClient referenceToolClient(ToolTransport toolTransport, Clock clock) {
        return new JsonToolClient(toolTransport, clock);
    }
}
