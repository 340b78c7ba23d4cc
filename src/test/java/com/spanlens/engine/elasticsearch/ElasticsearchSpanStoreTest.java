package com.spanlens.engine.elasticsearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spanlens.config.StoreProperties;
import com.spanlens.exception.StoreConnectionException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElasticsearchSpanStoreTest {

    @Test
    void unreachableClusterIsAConnectionFailure() throws IOException {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        StoreProperties properties = new StoreProperties();
        properties.setHost("127.0.0.1");
        properties.setPort(freePort);
        properties.setConnectTimeoutMs(500);
        ElasticsearchSpanStore store = new ElasticsearchSpanStore(properties, new ObjectMapper());

        assertThatThrownBy(store::connect)
                .isInstanceOf(StoreConnectionException.class)
                .hasMessageContaining("127.0.0.1:" + freePort);
    }

    @Test
    void explicitUrlWinsOverHostAndPort() {
        StoreProperties properties = new StoreProperties();
        properties.setHost("es.internal");
        properties.setUrl("https://search.example.com:9243/");

        assertThat(properties.getBaseUrl()).isEqualTo("https://search.example.com:9243");
    }

    @Test
    void hostAndPortFormTheDefaultUrl() {
        StoreProperties properties = new StoreProperties();
        properties.setHost("es.internal");
        properties.setPort(9201);

        assertThat(properties.getBaseUrl()).isEqualTo("http://es.internal:9201");
    }
}
