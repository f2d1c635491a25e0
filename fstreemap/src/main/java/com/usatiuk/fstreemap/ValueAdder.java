package com.usatiuk.fstreemap;

import java.math.BigInteger;
import java.util.function.BinaryOperator;

/**
 * Addition with an identity element, used to total up file values.
 *
 * @param <V> the type of the values
 */
public interface ValueAdder<V> {
    ValueAdder<Long> LONG = of(0L, Long::sum);
    ValueAdder<Integer> INTEGER = of(0, Integer::sum);
    ValueAdder<Double> DOUBLE = of(0.0, Double::sum);
    ValueAdder<BigInteger> BIG_INTEGER = of(BigInteger.ZERO, BigInteger::add);

    /**
     * The identity element of {@link #add(Object, Object)}.
     *
     * @return the zero value
     */
    V zero();

    /**
     * Adds two values.
     *
     * @param a the first value
     * @param b the second value
     * @return the sum
     */
    V add(V a, V b);

    /**
     * Creates an adder from a zero value and an addition function.
     *
     * @param zero the identity element
     * @param add  the addition function
     * @param <V>  the type of the values
     * @return the adder
     */
    static <V> ValueAdder<V> of(V zero, BinaryOperator<V> add) {
        return new ValueAdder<>() {
            @Override
            public V zero() {
                return zero;
            }

            @Override
            public V add(V a, V b) {
                return add.apply(a, b);
            }
        };
    }
}
