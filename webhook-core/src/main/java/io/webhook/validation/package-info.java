/**
 * Destination safety checks run before any network I/O or persistence.
 *
 * @see io.webhook.validation.AddressSafetyValidator
 */
package io.webhook.validation;
