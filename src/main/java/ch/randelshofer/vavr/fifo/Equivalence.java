/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.fifo;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;

/**
 * A strategy for hashing and comparing the keys of a {@link FifoMap} or the
 * elements of a {@link FifoSet}.
 * <p>
 * Implementations must be consistent: if {@code equal(a, b)} holds, then
 * {@code hash(a) == hash(b)} must hold too.
 *
 * @param <T> the type of the compared objects
 */
public interface Equivalence<T> {

    /**
     * Computes the hash code of the given object.
     *
     * @param value an object, may be null if the strategy permits it
     * @return the hash code
     */
    int hash(T value);

    /**
     * Tests whether the two given objects are equivalent.
     *
     * @param a an object
     * @param b another object
     * @return true if {@code a} and {@code b} are equivalent
     */
    boolean equal(T a, T b);

    /**
     * Returns the equivalence that is given by {@link Object#hashCode()} and
     * {@link Object#equals(Object)}. Supports null.
     *
     * @param <T> the type of the compared objects
     * @return the standard equivalence
     */
    @SuppressWarnings("unchecked")
    static <T> Equivalence<T> standard() {
        return (Equivalence<T>) FifoCollections.StandardEquivalence.INSTANCE;
    }

    /**
     * Returns the equivalence that is given by object identity.
     *
     * @param <T> the type of the compared objects
     * @return the identity equivalence
     */
    @SuppressWarnings("unchecked")
    static <T> Equivalence<T> identity() {
        return (Equivalence<T>) FifoCollections.IdentityEquivalence.INSTANCE;
    }

    /**
     * Creates an equivalence from a hash function and an equality predicate.
     *
     * @param hashFunction   the hash function
     * @param equalsFunction the equality predicate
     * @param <T>            the type of the compared objects
     * @return a new equivalence
     * @throws NullPointerException if one of the functions is null
     */
    static <T> Equivalence<T> of(ToIntFunction<? super T> hashFunction, BiPredicate<? super T, ? super T> equalsFunction) {
        Objects.requireNonNull(hashFunction, "hashFunction is null");
        Objects.requireNonNull(equalsFunction, "equalsFunction is null");
        return new Equivalence<T>() {
            @Override
            public int hash(T value) {
                return hashFunction.applyAsInt(value);
            }

            @Override
            public boolean equal(T a, T b) {
                return equalsFunction.test(a, b);
            }
        };
    }
}
