package com.dpp.audit.config;

import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class TimestampAuthorityConfig {

    /**
     * Client for the RFC 3161 authority. Both timeouts are hard limits so a slow
     * authority cannot hold an anchoring transaction open.
     */
    @Bean("tsaRestTemplate")
    public RestTemplate tsaRestTemplate(AuditProperties auditProperties) {
        AuditProperties.TsaProperties tsa = auditProperties.getTsa();
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(tsa.getConnectTimeout().toMillis()))
                .setResponseTimeout(Timeout.ofMilliseconds(tsa.getReadTimeout().toMillis()))
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(tsa.getConnectTimeout().toMillis()))
                .build();

        HttpClient httpClient = HttpClientBuilder.create()
                .setDefaultRequestConfig(requestConfig)
                .build();

        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
