/**
 * The delivery state machine: attempt classification, backoff and per-endpoint circuit breaking.
 *
 * @see io.webhook.delivery.DeliveryEngine
 */
package io.webhook.delivery;
