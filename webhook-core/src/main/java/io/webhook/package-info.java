/**
 * Reliable, signed webhook delivery.
 *
 * <p>Build a {@link io.webhook.DeliveryRequest}, hand it to
 * {@link io.webhook.delivery.DeliveryEngine#deliver(io.webhook.DeliveryRequest)} and inspect
 * the returned {@link io.webhook.DeliveryResult}.
 */
package io.webhook;
