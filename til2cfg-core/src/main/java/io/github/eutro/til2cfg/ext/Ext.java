package io.github.eutro.til2cfg.ext;

/**
 * A typed key for data hung off an {@link ExtContainer}.
 * <p>
 * Exts compare by identity. Create each one once, as a constant.
 *
 * @param <T> The type of the value stored under this key.
 */
public final class Ext<T> {
    private final String name;

    private Ext(String name) {
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class only guides inference, since a key for {@code List<BasicBlock>}
     * has to be made from {@code List.class}.
     *
     * @param type The erased type of the values.
     * @param name The name, shown when an ext is missing.
     * @param <T>  The erased type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(name + ": " + type.getSimpleName());
    }

    @Override
    public String toString() {
        return name;
    }
}
