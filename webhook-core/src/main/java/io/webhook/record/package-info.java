/**
 * Persistence of delivery attempts and read access to the delivery history.
 */
package io.webhook.record;
