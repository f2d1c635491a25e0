package com.usatiuk.fstreemap;

import org.apache.commons.lang3.function.TriFunction;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import java.util.ArrayList;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * A node holding an ordered list of children.
 * The list is persistent and replaced on every change, so a {@link #children()} snapshot stays the same
 * after the directory is modified.
 *
 * @param <V> the type of the values stored in files
 */
public final class Directory<V> extends Node<V> {
    private PVector<Node<V>> _children = TreePVector.empty();

    public Directory(String name) {
        super(name);
    }

    /**
     * Get the children of this directory, in insertion order.
     *
     * @return an immutable snapshot of the children
     */
    public PVector<Node<V>> children() {
        return _children;
    }

    @Override
    public boolean isDirectory() {
        return true;
    }

    @Override
    Optional<Node<V>> getChildW(String name) {
        for (var child : _children) {
            if (child.name().equals(name))
                return Optional.of(child);
        }
        return Optional.empty();
    }

    @Override
    Directory<V> makeDirectory(String name) {
        var dir = new Directory<V>(name);
        _children = _children.plus(dir);
        return dir;
    }

    void addChild(Node<V> child) {
        _children = _children.plus(child);
    }

    /**
     * Remove all children with the given name.
     *
     * @param name the name of the children to remove
     * @return the number of removed children
     */
    int removeChildren(String name) {
        var kept = new ArrayList<Node<V>>(_children.size());
        for (var child : _children) {
            if (!child.name().equals(name))
                kept.add(child);
        }
        int removed = _children.size() - kept.size();
        if (removed > 0)
            _children = TreePVector.from(kept);
        return removed;
    }

    @Override
    public <T> T valueReduce(T seed, BiFunction<T, ? super V, T> combine) {
        T acc = seed;
        for (var child : _children)
            acc = child.valueReduce(acc, combine);
        return acc;
    }

    @Override
    public <T> T reduce(T seed, TriFunction<T, String, ? super V, T> combine) {
        T acc = seed;
        for (var child : _children)
            acc = child.reduce(acc, combine);
        return acc;
    }

    @Override
    public V getValue(ValueAdder<V> adder) {
        V total = adder.zero();
        for (var child : _children)
            total = adder.add(total, child.getValue(adder));
        return total;
    }

    @Override
    public Directory<V> deepCopy() {
        var copy = new Directory<V>(name());
        for (var child : _children)
            copy.addChild(child.deepCopy());
        return copy;
    }

    @Override
    public String toString() {
        return "Directory{" + name() + ", " + _children.size() + " children}";
    }
}
