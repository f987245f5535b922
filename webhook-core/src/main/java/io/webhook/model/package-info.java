/**
 * Persistent delivery model: {@link io.webhook.model.DeliveryRecord} and its
 * {@link io.webhook.model.DeliveryStatus}.
 */
package io.webhook.model;
