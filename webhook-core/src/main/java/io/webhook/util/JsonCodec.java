package io.webhook.util;

import java.util.Map;

/**
 * Canonical JSON encoder for webhook payloads.
 *
 * <p>The canonical form is what gets signed and what goes on the wire, so two
 * runtimes that canonicalize the same payload must produce byte-identical output:
 * object keys sorted, no insignificant whitespace, non-ASCII characters escaped as
 * {@code &#92;uXXXX}.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no external
 * dependencies. Applications that already serialize with another JSON library can
 * implement this interface, provided the output keeps the canonical form.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a payload map in canonical form.
     *
     * <p>Supported values: {@code null}, {@link CharSequence}, {@link Boolean},
     * {@link Number}, {@link Character}, {@link Enum}, nested {@link Map} with string keys,
     * {@link Iterable} and arrays.
     *
     * @param payload the payload to encode
     * @return canonical JSON object text (never {@code null})
     * @throws IllegalArgumentException if the payload contains an unsupported value,
     *     a null key, or a non-finite number
     */
    String canonicalize(Map<String, ?> payload);
}
