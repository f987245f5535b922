package io.webhook.validation;

import java.util.Objects;

/**
 * Outcome of a destination check: either accepted, or rejected with a human-readable reason.
 *
 * @param ok     whether the destination may be contacted
 * @param reason empty when {@code ok}, otherwise why the destination was rejected
 */
public record ValidationResult(boolean ok, String reason) {

    private static final ValidationResult OK = new ValidationResult(true, "");

    public ValidationResult {
        Objects.requireNonNull(reason, "reason");
        if (!ok && reason.isEmpty()) {
            throw new IllegalArgumentException("A rejected result must carry a reason");
        }
    }

    public static ValidationResult accepted() {
        return OK;
    }

    public static ValidationResult rejected(String reason) {
        return new ValidationResult(false, reason);
    }
}
