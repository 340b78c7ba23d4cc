package com.spanlens.config;

import lombok.Data;
import org.apache.http.HttpHost;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound proxy for store traffic. Ignored unless {@code proxy.enabled=true}.
 */
@Data
@ConfigurationProperties(prefix = "proxy")
public class ProxyProperties {
    private boolean enabled;
    private String host;
    private int port = 8080;
    private String scheme = "http";

    public boolean isUsable() {
        return enabled && host != null && !host.isBlank();
    }

    public HttpHost toHttpHost() {
        return new HttpHost(host, port, scheme);
    }
}
