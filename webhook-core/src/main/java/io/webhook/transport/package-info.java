/**
 * HTTP transport implementations.
 */
package io.webhook.transport;
