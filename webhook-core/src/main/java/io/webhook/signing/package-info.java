/**
 * HMAC-SHA256 webhook signing for senders and the reference verification for receivers.
 */
package io.webhook.signing;
