package com.sociallink.smoke.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate used by the smoke run.
 *
 * 4xx and 5xx responses are returned to the caller instead of thrown: the run
 * asserts on status codes, so an error status is an ordinary result.
 */
@Slf4j
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate smokeRestTemplate(SmokeProperties properties) {
        // Timeouts live on the connection: the socket timeout is the read timeout
        ConnectionConfig.Builder connectionConfig = ConnectionConfig.custom();
        if (properties.getConnectTimeout() != null) {
            connectionConfig.setConnectTimeout(Timeout.ofMilliseconds(properties.getConnectTimeout().toMillis()));
        }
        if (properties.getReadTimeout() != null) {
            connectionConfig.setSocketTimeout(Timeout.ofMilliseconds(properties.getReadTimeout().toMillis()));
        }

        // Sequential run: a handful of connections is plenty
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(4)
                .setMaxConnPerRoute(4)
                .setDefaultConnectionConfig(connectionConfig.build())
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .evictIdleConnections(TimeValue.ofMinutes(1))
                .evictExpiredConnections()
                .disableAutomaticRetries()
                .build();

        RestTemplate restTemplate = new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
        restTemplate.setErrorHandler(new PassThroughErrorHandler());

        log.info("[HTTP_CLIENT_READY] Smoke client configured | apiBaseUrl={} | connectTimeout={} | readTimeout={}",
                properties.getApiBaseUrl(), properties.getConnectTimeout(), properties.getReadTimeout());
        return restTemplate;
    }

    /**
     * Treats every status code as a regular response.
     */
    static class PassThroughErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
            // never called, hasError is always false
        }
    }
}
