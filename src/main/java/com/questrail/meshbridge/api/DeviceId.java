package com.questrail.meshbridge.api;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Strongly typed identity of a physical mesh device.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * Mesh devices name themselves with a human-readable, stable identifier of the
 * form {@code "{adjective}-{noun}-{hex}"} (for example
 * {@code "swift-falcon-a3f2"}). The full identifier is the device's identity;
 * the trailing hexadecimal group is the only part that carries entropy and is
 * therefore used as the persistence key.
 * </p>
 *
 * <p>
 * Treating the identifier as a raw {@code String} throughout the bridge would
 * let malformed identifiers leak into the registry and the device store, where
 * they cannot be keyed. A {@code DeviceId} is only constructible from an
 * identifier that yields a valid storage suffix.
 * </p>
 *
 * <h2>Identity constraints</h2>
 * <ul>
 *   <li>The suffix is the text after the last {@code '-'}</li>
 *   <li>It must be exactly {@link #DEFAULT_SUFFIX_LENGTH} hexadecimal characters
 *       unless a different length is requested explicitly</li>
 *   <li>The suffix is normalized to lower case; the full identifier is kept
 *       verbatim</li>
 * </ul>
 *
 * <p>
 * Equality is based on the full identifier. Two different identifiers may share
 * a suffix; detecting that collision is the registry's job, not this type's.
 * </p>
 */
public final class DeviceId
{
    /**
     * Number of trailing hexadecimal characters used as the storage key.
     */
    public static final int DEFAULT_SUFFIX_LENGTH = 4;

    private final String value;
    private final String suffix;

    private DeviceId(String value, String suffix) {
        this.value = value;
        this.suffix = suffix;
    }

    /**
     * Creates a {@code DeviceId} using the default suffix length.
     *
     * @throws IllegalArgumentException if the identifier has no valid suffix
     */
    public static DeviceId of(String value) {
        return of(value, DEFAULT_SUFFIX_LENGTH);
    }

    /**
     * Creates a {@code DeviceId} whose storage suffix is {@code suffixLength}
     * hexadecimal characters.
     *
     * @throws IllegalArgumentException if the identifier has no valid suffix
     */
    public static DeviceId of(String value, int suffixLength) {
        return tryParse(value, suffixLength).orElseThrow(() -> new IllegalArgumentException(
                "Device id must end in '-' followed by " + suffixLength
                        + " hex characters (was " + value + ")"));
    }

    /**
     * Parses an identifier, returning {@link Optional#empty()} instead of
     * throwing when it does not yield a valid storage suffix.
     */
    public static Optional<DeviceId> tryParse(String value, int suffixLength) {
        if (suffixLength < 1) {
            throw new IllegalArgumentException("suffixLength must be positive");
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        int dash = value.lastIndexOf('-');
        if (dash < 0) {
            return Optional.empty();
        }
        String tail = value.substring(dash + 1);
        if (tail.length() != suffixLength) {
            return Optional.empty();
        }
        for (int i = 0; i < tail.length(); i++) {
            if (Character.digit(tail.charAt(i), 16) < 0) {
                return Optional.empty();
            }
        }
        return Optional.of(new DeviceId(value, tail.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns the full, human-readable identifier.
     */
    public String value() {
        return value;
    }

    /**
     * Returns the normalized storage suffix (e.g. {@code "a3f2"}).
     */
    public String suffix() {
        return suffix;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceId that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
