package io.github.eutro.til2cfg.ext;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * An array list that tells its owner about every element entering or leaving it.
 * <p>
 * {@link io.github.eutro.til2cfg.ssa.BasicBlock}s use this to stamp their phis and instructions,
 * and {@link io.github.eutro.til2cfg.ssa.SCFG}s to claim their blocks.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> elements = new ArrayList<>();

    /**
     * Called before {@code elt} is stored.
     *
     * @param elt The element.
     */
    protected abstract void claim(E elt);

    /**
     * Called after {@code elt} has been taken out.
     *
     * @param elt The element.
     */
    protected abstract void release(E elt);

    @Override
    public E get(int index) {
        return elements.get(index);
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public void add(int index, E element) {
        claim(element);
        elements.add(index, element);
        modCount++;
    }

    @Override
    public E set(int index, E element) {
        claim(element);
        E old = elements.set(index, element);
        if (old != element) release(old);
        return old;
    }

    @Override
    public E remove(int index) {
        E old = elements.remove(index);
        modCount++;
        release(old);
        return old;
    }

    @Override
    protected void removeRange(int fromIndex, int toIndex) {
        List<E> range = elements.subList(fromIndex, toIndex);
        List<E> removed = new ArrayList<>(range);
        range.clear();
        modCount++;
        for (E e : removed) {
            release(e);
        }
    }
}
