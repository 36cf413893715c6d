package com.poc.svc.trace.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.Ordered;

@ConfigurationProperties(prefix = "trace")
public class TraceProperties {

    private boolean enabled = true;

    private final Filter filter = new Filter();

    private final Client client = new Client();

    private final Async async = new Async();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Filter getFilter() {
        return filter;
    }

    public Client getClient() {
        return client;
    }

    public Async getAsync() {
        return async;
    }

    public static class Filter {

        private int order = Ordered.HIGHEST_PRECEDENCE;

        private boolean trustExistingHeader = false;

        public int getOrder() {
            return order;
        }

        public void setOrder(int order) {
            this.order = order;
        }

        public boolean isTrustExistingHeader() {
            return trustExistingHeader;
        }

        public void setTrustExistingHeader(boolean trustExistingHeader) {
            this.trustExistingHeader = trustExistingHeader;
        }
    }

    public static class Client {

        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Async {

        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
