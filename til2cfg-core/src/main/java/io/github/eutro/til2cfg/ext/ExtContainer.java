package io.github.eutro.til2cfg.ext;

import org.jetbrains.annotations.Nullable;

/**
 * Something {@link Ext}s can be attached to. See the {@link io.github.eutro.til2cfg.ext package-level documentation}.
 */
public interface ExtContainer {
    /**
     * Store {@code value} under {@code ext}, replacing any previous value.
     *
     * @param ext   The key.
     * @param value The value.
     * @param <T>   The value type.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Drop the value stored under {@code ext}, if there is one.
     *
     * @param ext The key.
     * @param <T> The value type.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Look up {@code ext}.
     *
     * @param ext The key.
     * @param <T> The value type.
     * @return The stored value, or null.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Look up {@code ext}, which must be present.
     *
     * @param ext The key.
     * @param <T> The value type.
     * @return The stored value.
     * @throws IllegalStateException If nothing is stored under the key.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException("missing ext " + ext + " on " + this);
        }
        return value;
    }
}
