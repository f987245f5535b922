/**
 * Service Provider Interfaces (SPI) for plugging the delivery engine into an application.
 *
 * <p>These interfaces define the extension points integrators implement to supply
 * HTTP transport, connection provisioning, record persistence, and metrics.
 *
 * @see io.webhook.spi.HttpTransport
 * @see io.webhook.spi.ConnectionProvider
 * @see io.webhook.spi.DeliveryRecordStore
 * @see io.webhook.spi.MetricsExporter
 */
package io.webhook.spi;
