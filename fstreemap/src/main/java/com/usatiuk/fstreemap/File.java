package com.usatiuk.fstreemap;

import org.apache.commons.lang3.function.TriFunction;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * A leaf of the tree holding a value.
 *
 * @param <V> the type of the value
 */
public final class File<V> extends Node<V> {
    private final V _value;

    public File(String name, V value) {
        super(name);
        _value = value;
    }

    public V value() {
        return _value;
    }

    @Override
    public boolean isDirectory() {
        return false;
    }

    @Override
    Optional<Node<V>> getChildW(String name) {
        return Optional.empty();
    }

    @Override
    Directory<V> makeDirectory(String name) {
        throw new ShapeViolationException(ShapeViolationException.Kind.NOT_A_DIRECTORY, name());
    }

    @Override
    public <T> T valueReduce(T seed, BiFunction<T, ? super V, T> combine) {
        return combine.apply(seed, _value);
    }

    @Override
    public <T> T reduce(T seed, TriFunction<T, String, ? super V, T> combine) {
        return combine.apply(seed, name(), _value);
    }

    @Override
    public V getValue(ValueAdder<V> adder) {
        return _value;
    }

    @Override
    public File<V> deepCopy() {
        return new File<>(name(), _value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof File<?> file)) return false;
        return name().equals(file.name()) && Objects.equals(_value, file._value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name(), _value);
    }

    @Override
    public String toString() {
        return "File{" + name() + ": " + _value + "}";
    }
}
