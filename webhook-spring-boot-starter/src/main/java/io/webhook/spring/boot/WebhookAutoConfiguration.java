package io.webhook.spring.boot;

import io.webhook.delivery.DeliveryEngine;
import io.webhook.delivery.EndpointCircuitBreakers;
import io.webhook.delivery.ExponentialBackoffRetryPolicy;
import io.webhook.delivery.RetryPolicy;
import io.webhook.jdbc.DataSourceConnectionProvider;
import io.webhook.jdbc.store.AbstractJdbcDeliveryRecordStore;
import io.webhook.jdbc.store.JdbcDeliveryRecordStores;
import io.webhook.record.DefaultDeliveryAttemptRecorder;
import io.webhook.record.DeliveryAttemptRecorder;
import io.webhook.record.DeliveryRecordManager;
import io.webhook.signing.RequestSigner;
import io.webhook.signing.SignatureVerifier;
import io.webhook.spi.ConnectionProvider;
import io.webhook.spi.DeliveryRecordStore;
import io.webhook.spi.HttpTransport;
import io.webhook.spi.MetricsExporter;
import io.webhook.transport.JdkHttpTransport;
import io.webhook.validation.AddressSafetyValidator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Auto-configuration for webhook delivery.
 *
 * <p>Always provides a {@link DeliveryEngine} with its transport, validator, signer and
 * retry policy. When a {@link DataSource} is present, delivery records are persisted to
 * the table named by {@code webhook.table-name} and a {@link DeliveryRecordManager} is
 * exposed for queries.
 *
 * @see WebhookProperties
 * @see WebhookMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(DeliveryEngine.class)
@EnableConfigurationProperties(WebhookProperties.class)
public class WebhookAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public HttpTransport webhookHttpTransport(WebhookProperties props) {
        return new JdkHttpTransport(props.getHttp().getConnectTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public AddressSafetyValidator addressSafetyValidator() {
        return new AddressSafetyValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestSigner requestSigner() {
        return new RequestSigner();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "webhook.signing", name = "secret")
    public SignatureVerifier signatureVerifier(WebhookProperties props, RequestSigner signer) {
        return new SignatureVerifier(props.getSigning().getSecret(),
                props.getSigning().getToleranceSeconds(), signer);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy webhookRetryPolicy(WebhookProperties props) {
        WebhookProperties.Retry retry = props.getRetry();
        return new ExponentialBackoffRetryPolicy(
                retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getJitterRatio());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "webhook.circuit-breaker", name = "enabled", havingValue = "true")
    public EndpointCircuitBreakers endpointCircuitBreakers(WebhookProperties props) {
        WebhookProperties.CircuitBreaker cb = props.getCircuitBreaker();
        return new EndpointCircuitBreakers(cb.getFailureThreshold(), cb.getSuccessThreshold(),
                cb.getOpenDuration());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryEngine deliveryEngine(WebhookProperties props,
                                         HttpTransport transport,
                                         AddressSafetyValidator validator,
                                         RequestSigner signer,
                                         RetryPolicy retryPolicy,
                                         ObjectProvider<DeliveryAttemptRecorder> recorderProvider,
                                         ObjectProvider<MetricsExporter> metricsProvider,
                                         ObjectProvider<EndpointCircuitBreakers> circuitBreakersProvider) {
        DeliveryEngine.Builder builder = DeliveryEngine.builder()
                .transport(transport)
                .addressValidator(validator)
                .allowLocalhost(props.getValidation().isAllowLocalhost())
                .signer(signer)
                .retryPolicy(retryPolicy);
        recorderProvider.ifAvailable(builder::recorder);
        metricsProvider.ifAvailable(builder::metrics);
        circuitBreakersProvider.ifAvailable(builder::circuitBreakers);
        return builder.build();
    }

    /**
     * Persistence beans, active only with a {@link DataSource}.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(DataSource.class)
    static class JdbcRecordingConfiguration {

        @Bean
        @ConditionalOnMissingBean(DeliveryRecordStore.class)
        public AbstractJdbcDeliveryRecordStore deliveryRecordStore(DataSource dataSource, WebhookProperties props) {
            AbstractJdbcDeliveryRecordStore detected = JdbcDeliveryRecordStores.detect(dataSource);
            return detected.withTableName(props.getTableName());
        }

        @Bean
        @ConditionalOnMissingBean(ConnectionProvider.class)
        public DataSourceConnectionProvider webhookConnectionProvider(DataSource dataSource) {
            return new DataSourceConnectionProvider(dataSource);
        }

        @Bean
        @ConditionalOnMissingBean
        public DeliveryAttemptRecorder deliveryAttemptRecorder(ConnectionProvider connectionProvider,
                                                               DeliveryRecordStore store) {
            return new DefaultDeliveryAttemptRecorder(connectionProvider, store);
        }

        @Bean
        @ConditionalOnMissingBean
        public DeliveryRecordManager deliveryRecordManager(ConnectionProvider connectionProvider,
                                                           DeliveryRecordStore store) {
            return new DeliveryRecordManager(connectionProvider, store);
        }
    }
}
