/**
 * Micrometer bridge for delivery metrics.
 *
 * @see io.webhook.micrometer.MicrometerMetricsExporter
 */
package io.webhook.micrometer;
