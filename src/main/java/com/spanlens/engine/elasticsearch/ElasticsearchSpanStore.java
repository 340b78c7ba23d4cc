package com.spanlens.engine.elasticsearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spanlens.config.ProxyProperties;
import com.spanlens.config.StoreProperties;
import com.spanlens.engine.SpanStore;
import com.spanlens.engine.StoreSession;
import com.spanlens.exception.StoreConnectionException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.util.EntityUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Elasticsearch implementation of SpanStore, talking to the REST API over Apache HttpClient.
 * Every {@link #connect()} builds a fresh client and pings the cluster; the session
 * closes the client when the run is over.
 * @author kiransahoo
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "store.type", havingValue = "elasticsearch", matchIfMissing = true)
public class ElasticsearchSpanStore implements SpanStore {

    private final StoreProperties storeProperties;
    private final ObjectMapper objectMapper;

    @Autowired(required = false)
    private ProxyProperties proxyProperties;

    public ElasticsearchSpanStore(StoreProperties storeProperties, ObjectMapper objectMapper) {
        this.storeProperties = storeProperties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        log.info("Will connect to Elasticsearch at {}", storeProperties.getBaseUrl());
    }

    @Override
    public String getEngineType() {
        return "Elasticsearch";
    }

    @Override
    public StoreSession connect() {
        String baseUrl = storeProperties.getBaseUrl();
        CloseableHttpClient httpClient = buildClient();

        HttpGet ping = new HttpGet(baseUrl + "/");
        String authorization = authorizationHeader();
        if (authorization != null) {
            ping.addHeader("Authorization", authorization);
        }

        try (CloseableHttpResponse response = httpClient.execute(ping)) {
            int statusCode = response.getStatusLine().getStatusCode();
            EntityUtils.consumeQuietly(response.getEntity());
            if (statusCode < 200 || statusCode >= 300) {
                closeQuietly(httpClient);
                throw new StoreConnectionException(String.format(
                        "Failed to connect to Elasticsearch at %s: HTTP %d", baseUrl, statusCode));
            }
        } catch (IOException e) {
            closeQuietly(httpClient);
            throw new StoreConnectionException("Error connecting to Elasticsearch at " + baseUrl + ": " + e.getMessage(), e);
        }

        log.info("Connected to Elasticsearch at {}", baseUrl);
        return new ElasticsearchSession(httpClient, baseUrl, authorization, objectMapper);
    }

    private CloseableHttpClient buildClient() {
        HttpClientBuilder clientBuilder = HttpClientBuilder.create()
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectTimeout(storeProperties.getConnectTimeoutMs())
                        .setSocketTimeout(storeProperties.getSocketTimeoutMs())
                        .build());

        if (proxyProperties != null && proxyProperties.isEnabled()) {
            if (proxyProperties.isUsable()) {
                clientBuilder.setProxy(proxyProperties.toHttpHost());
                log.info("Using proxy: {}:{}", proxyProperties.getHost(), proxyProperties.getPort());
            } else {
                log.warn("proxy.enabled is set but proxy.host is empty, connecting directly");
            }
        }

        return clientBuilder.build();
    }

    private String authorizationHeader() {
        String username = storeProperties.getUsername();
        if (username == null || username.isEmpty()) {
            return null;
        }
        String password = storeProperties.getPassword() == null ? "" : storeProperties.getPassword();
        String credentials = Base64.getEncoder()
                .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return "Basic " + credentials;
    }

    static void closeQuietly(CloseableHttpClient httpClient) {
        try {
            httpClient.close();
        } catch (IOException e) {
            log.debug("Error closing HTTP client: {}", e.getMessage());
        }
    }
}
