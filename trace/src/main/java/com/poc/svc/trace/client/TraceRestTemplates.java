package com.poc.svc.trace.client;

import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * 建立會自動帶入 Trace ID 的 {@link RestTemplate}。
 */
public final class TraceRestTemplates {

    private TraceRestTemplates() {
    }

    public static RestTemplate create() {
        return create(null);
    }

    public static RestTemplate create(ClientHttpRequestFactory requestFactory) {
        ClientHttpRequestFactory transport = requestFactory != null
                ? requestFactory
                : new SimpleClientHttpRequestFactory();
        RestTemplate restTemplate = new RestTemplate(transport);
        restTemplate.getInterceptors().add(new TraceIdClientHttpRequestInterceptor());
        return restTemplate;
    }
}
