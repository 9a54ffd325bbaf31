package io.github.eutro.til2cfg.ext;

import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;

/**
 * The default {@link ExtContainer}, backed by an identity map that is only allocated on first use.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private IdentityHashMap<Ext<?>, Object> exts;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (exts == null) {
            exts = new IdentityHashMap<>(4);
        }
        exts.put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (exts != null && exts.remove(ext) != null && exts.isEmpty()) {
            exts = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return exts == null ? null : (T) exts.get(ext);
    }
}
