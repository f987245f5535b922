/**
 * Spring Boot auto-configuration for webhook delivery.
 *
 * @see io.webhook.spring.boot.WebhookAutoConfiguration
 * @see io.webhook.spring.boot.WebhookProperties
 */
package io.webhook.spring.boot;
