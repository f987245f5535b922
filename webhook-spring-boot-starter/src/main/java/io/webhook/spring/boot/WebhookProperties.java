package io.webhook.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for webhook delivery.
 *
 * @see WebhookAutoConfiguration
 */
@ConfigurationProperties(prefix = "webhook")
public class WebhookProperties {

    /**
     * Database table holding delivery records.
     */
    private String tableName = "webhook_deliveries";

    private final Retry retry = new Retry();
    private final Http http = new Http();
    private final Validation validation = new Validation();
    private final Signing signing = new Signing();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Retry getRetry() {
        return retry;
    }

    public Http getHttp() {
        return http;
    }

    public Validation getValidation() {
        return validation;
    }

    public Signing getSigning() {
        return signing;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retry {
        private long baseDelayMs = 1000;
        private long maxDelayMs = 60000;
        private double jitterRatio = 0.0;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getJitterRatio() {
            return jitterRatio;
        }

        public void setJitterRatio(double jitterRatio) {
            this.jitterRatio = jitterRatio;
        }
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }
    }

    public static class Validation {
        /**
         * Accept loopback destinations. Only for local test receivers.
         */
        private boolean allowLocalhost = false;

        public boolean isAllowLocalhost() {
            return allowLocalhost;
        }

        public void setAllowLocalhost(boolean allowLocalhost) {
            this.allowLocalhost = allowLocalhost;
        }
    }

    public static class Signing {
        /**
         * Shared secret for verifying inbound signed requests. A verifier bean is
         * created only when this is set.
         */
        private String secret;
        private long toleranceSeconds = 300;

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public long getToleranceSeconds() {
            return toleranceSeconds;
        }

        public void setToleranceSeconds(long toleranceSeconds) {
            this.toleranceSeconds = toleranceSeconds;
        }
    }

    public static class CircuitBreaker {
        private boolean enabled = false;
        private int failureThreshold = 5;
        private int successThreshold = 2;
        private Duration openDuration = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Duration getOpenDuration() {
            return openDuration;
        }

        public void setOpenDuration(Duration openDuration) {
            this.openDuration = openDuration;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "webhook";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
