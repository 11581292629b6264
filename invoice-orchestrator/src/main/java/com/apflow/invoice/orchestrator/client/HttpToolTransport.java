package com.apflow.invoice.orchestrator.client;

import com.apflow.invoice.tools.ToolProtocolException;
import com.apflow.invoice.tools.ToolTimeoutException;
import com.apflow.invoice.tools.ToolUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Collections;

/**
 * Tool transport over HTTP: POST {baseUrl}/api/tools/{toolName}.
 *
 * Connection failures and 5xx answers are UNAVAILABLE, read timeouts are
 * TIMEOUT, 4xx answers are PROTOCOL.
 */
public class HttpToolTransport implements ToolTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpToolTransport.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpToolTransport(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public String invoke(String toolName, String requestJson) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        String url = baseUrl + "/api/tools/" + toolName;

        try {
            return restTemplate.postForObject(url, new HttpEntity<>(requestJson, headers), String.class);
        } catch (HttpServerErrorException e) {
            throw new ToolUnavailableException(toolName, "tool answered " + e.getStatusCode().value(), e);
        } catch (HttpClientErrorException e) {
            throw new ToolProtocolException(toolName, "tool refused the call with " + e.getStatusCode().value()
                + ": " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new ToolTimeoutException(toolName, "no answer within the read timeout", e);
            }
            throw new ToolUnavailableException(toolName, "tool unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.debug("Unexpected transport failure - tool={}, url={}", toolName, url, e);
            throw new ToolUnavailableException(toolName, "transport failure: " + e.getMessage(), e);
        }
    }
}
