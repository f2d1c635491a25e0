package com.usatiuk.fstreemap;

import org.apache.commons.lang3.function.TriFunction;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * A node of the tree, either a {@link Directory} or a {@link File}.
 * <p>
 * Methods that change the tree are package-private, so nodes handed out by {@link FsTreeMap}
 * can only be read by outside code.
 *
 * @param <V> the type of the values stored in files
 */
public abstract sealed class Node<V> permits Directory, File {
    private final String _name;

    Node(String name) {
        _name = name;
    }

    /**
     * Get the name of the node.
     *
     * @return the name of the node
     */
    public String name() {
        return _name;
    }

    /**
     * Check whether the node is a directory.
     *
     * @return true for directories, false for files
     */
    public abstract boolean isDirectory();

    /**
     * Find a child by its name.
     * If several children have the same name, the first one inserted is returned.
     *
     * @param name the name of the child
     * @return the child, or empty if there is no such child or this node is a file
     */
    public Optional<Node<V>> getChild(String name) {
        return getChildW(name);
    }

    /**
     * Find a child by its name, for use by operations that are going to modify it.
     *
     * @param name the name of the child
     * @return the child, or empty if there is no such child or this node is a file
     */
    abstract Optional<Node<V>> getChildW(String name);

    /**
     * Append a new empty directory to the children of this node.
     *
     * @param name the name of the new directory
     * @return the new directory
     * @throws ShapeViolationException if this node is a file
     */
    abstract Directory<V> makeDirectory(String name);

    /**
     * Fold over the values of all files in this subtree.
     * Files are visited depth-first, in insertion order, a subdirectory is fully visited before its next sibling.
     *
     * @param seed    the initial accumulator
     * @param combine the function combining the accumulator with a file value
     * @param <T>     the type of the accumulator
     * @return the final accumulator
     */
    public abstract <T> T valueReduce(T seed, BiFunction<T, ? super V, T> combine);

    /**
     * Fold over the names and values of all files in this subtree,
     * in the same order as {@link #valueReduce(Object, BiFunction)}.
     *
     * @param seed    the initial accumulator
     * @param combine the function combining the accumulator with a file name and value
     * @param <T>     the type of the accumulator
     * @return the final accumulator
     */
    public abstract <T> T reduce(T seed, TriFunction<T, String, ? super V, T> combine);

    /**
     * Get the value of a file, or the total of all values under a directory.
     *
     * @param adder the addition to total the values with
     * @return the value of the node
     */
    public abstract V getValue(ValueAdder<V> adder);

    /**
     * Copy this node and everything under it.
     *
     * @return an independent copy
     */
    public abstract Node<V> deepCopy();
}
