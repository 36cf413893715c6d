package com.poc.svc.trace.config;

import com.poc.svc.trace.client.TraceIdClientHttpRequestInterceptor;
import com.poc.svc.trace.web.TraceIdFilter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.boot.web.client.RestTemplateCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.web.client.RestTemplate;

@AutoConfiguration
@ConditionalOnProperty(prefix = "trace", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TraceProperties.class)
public class TraceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    public TraceIdFilter traceIdFilter(TraceProperties properties, ObjectProvider<MeterRegistry> meterRegistry) {
        TraceProperties.Filter filter = properties.getFilter();
        return new TraceIdFilter(
                meterRegistry.getIfAvailable(() -> Metrics.globalRegistry),
                filter.isTrustExistingHeader(),
                filter.getOrder()
        );
    }

    @Bean
    @ConditionalOnMissingBean(TaskDecorator.class)
    @ConditionalOnProperty(prefix = "trace.async", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TraceContextTaskDecorator traceContextTaskDecorator() {
        return new TraceContextTaskDecorator();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(RestTemplate.class)
    @ConditionalOnProperty(prefix = "trace.client", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class TraceClientConfiguration {

        @Bean
        @ConditionalOnMissingBean
        TraceIdClientHttpRequestInterceptor traceIdClientHttpRequestInterceptor() {
            return new TraceIdClientHttpRequestInterceptor();
        }

        @Bean
        RestTemplateCustomizer traceRestTemplateCustomizer(TraceIdClientHttpRequestInterceptor interceptor) {
            return restTemplate -> {
                if (!restTemplate.getInterceptors().contains(interceptor)) {
                    restTemplate.getInterceptors().add(interceptor);
                }
            };
        }

        @Bean
        RestClientCustomizer traceRestClientCustomizer(TraceIdClientHttpRequestInterceptor interceptor) {
            return builder -> builder.requestInterceptors(interceptors -> {
                if (!interceptors.contains(interceptor)) {
                    interceptors.add(interceptor);
                }
            });
        }
    }
}
