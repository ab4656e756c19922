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

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collector;

/**
 * Implements a mutable set that iterates in the order in which elements were
 * inserted, using a singly-linked list of elements and a hash index.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null elements (with the standard equivalence)</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>iterates in the order, in which elements were inserted</li>
 *     <li>can insert elements at the end and at the start</li>
 *     <li>hashes and compares elements with a pluggable {@link Equivalence}</li>
 *     <li>can be copied and moved</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>insertLast, insertFirst: O(1) in an amortized sense</li>
 *     <li>contains, find: O(1)</li>
 *     <li>remove: O(1)</li>
 *     <li>copy: O(N)</li>
 *     <li>moveOf, moveFrom: O(1)</li>
 *     <li>iterator creation: O(1)</li>
 *     <li>iterator.next: O(1)</li>
 * </ul>
 *
 * @param <T> the element type
 */
public final class FifoSet<T> implements Iterable<T> {

    private final FifoIndex<T, T> index;

    /**
     * Creates an empty set with the standard equivalence.
     */
    public FifoSet() {
        this(Equivalence.standard());
    }

    /**
     * Creates an empty set with the given element equivalence.
     *
     * @param equivalence the element equivalence
     */
    public FifoSet(Equivalence<? super T> equivalence) {
        this.index = new FifoIndex<>(Function.identity(), equivalence);
    }

    /**
     * Creates a copy of the given set, with the same equivalence and
     * the same iteration order.
     *
     * @param other another set
     */
    public FifoSet(FifoSet<T> other) {
        this(Objects.requireNonNull(other, "other is null").index.equivalence());
        for (T element : other) {
            index.insertLast(element);
        }
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain a {@link FifoSet}.
     *
     * @param <T> Component type of the FifoSet.
     * @return A FifoSet Collector.
     */
    public static <T> Collector<T, ArrayList<T>, FifoSet<T>> collector() {
        return FifoCollections.toListAndThen(FifoSet::ofAll);
    }

    /**
     * Creates a FifoSet of the given elements.
     *
     * <pre><code>FifoSet.of(1, 2, 3, 4)</code></pre>
     *
     * @param <T>      Component type of the FifoSet.
     * @param elements Zero or more elements.
     * @return A set containing the given elements.
     * @throws NullPointerException if {@code elements} is null
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public static <T> FifoSet<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return ofAll(Arrays.asList(elements));
    }

    /**
     * Creates a FifoSet of the given elements.
     *
     * @param elements Set elements
     * @param <T>      The value type
     * @return A new FifoSet containing the given elements
     */
    public static <T> FifoSet<T> ofAll(Iterable<? extends T> elements) {
        Objects.requireNonNull(elements, "elements is null");
        FifoSet<T> set = new FifoSet<>();
        for (T element : elements) {
            set.insertLast(element);
        }
        return set;
    }

    /**
     * Creates a new set that takes over all elements and the equivalence of
     * the source set. The source set is left empty, and can be reused.
     *
     * @param source the source set
     * @param <T>    The element type
     * @return a new set
     */
    public static <T> FifoSet<T> moveOf(FifoSet<T> source) {
        Objects.requireNonNull(source, "source is null");
        FifoSet<T> set = new FifoSet<>(source.index.equivalence());
        set.moveFrom(source);
        return set;
    }

    /**
     * Discards all elements of this set, and takes over all elements and the
     * equivalence of the source set. The source set is left empty.
     *
     * @param source the source set
     * @throws IllegalArgumentException if source is this set
     */
    public void moveFrom(FifoSet<T> source) {
        Objects.requireNonNull(source, "source is null");
        index.moveFrom(source.index);
    }

    /**
     * Replaces the elements of this set by copies of the elements of the
     * other set, in the same order.
     *
     * @param other another set
     */
    public void copyFrom(FifoSet<? extends T> other) {
        Objects.requireNonNull(other, "other is null");
        if (other == this) {
            return;
        }
        index.clear();
        for (T element : other) {
            index.insertLast(element);
        }
    }

    /**
     * Same as {@link #insertLast(Object)}.
     *
     * @param element an element
     * @return the stored element, and true if the element was inserted
     */
    public Tuple2<T, Boolean> insert(T element) {
        return insertLast(element);
    }

    /**
     * Appends an element, unless an equivalent element is present.
     *
     * @param element an element
     * @return the stored element, and true if the element was inserted
     */
    public Tuple2<T, Boolean> insertLast(T element) {
        Tuple2<FifoIndex.Node<T>, Boolean> result = index.insertLast(element);
        return Tuple.of(result._1.entry, result._2);
    }

    /**
     * Prepends an element, unless an equivalent element is present.
     * An element that is present keeps its position.
     *
     * @param element an element
     * @return the stored element, and true if the element was inserted
     */
    public Tuple2<T, Boolean> insertFirst(T element) {
        Tuple2<FifoIndex.Node<T>, Boolean> result = index.insertFirst(element);
        return Tuple.of(result._1.entry, result._2);
    }

    /**
     * Looks up the stored element that is equivalent to the given one.
     *
     * @param element an element
     * @return the stored element, or none
     */
    public Option<T> find(T element) {
        FifoIndex.Node<T> node = index.find(element);
        return node == null ? Option.none() : Option.some(node.entry);
    }

    /**
     * Tests whether an equivalent element is present.
     *
     * @param element an element
     * @return true if the element is present
     */
    public boolean contains(T element) {
        return index.find(element) != null;
    }

    /**
     * Returns the number of equivalent elements.
     *
     * @param element an element
     * @return 0 or 1
     */
    public int count(T element) {
        return index.count(element);
    }

    /**
     * Removes an element. Does nothing if the element is absent.
     *
     * @param element an element
     * @return true if an element was removed
     */
    public boolean remove(T element) {
        return index.remove(element);
    }

    /**
     * Returns the number of elements.
     *
     * @return the size
     */
    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    public void clear() {
        index.clear();
    }

    /**
     * Returns an iterator over the elements, in insertion order.
     * The iterator supports {@link java.util.Iterator#remove()}.
     *
     * @return a fail-fast iterator
     */
    @Override
    public Iterator<T> iterator() {
        return index.iterator(Function.identity());
    }

    /**
     * Returns a snapshot of this set as a {@link java.util.LinkedHashSet}
     * with the same iteration order. Elements of the snapshot are compared
     * with {@link Object#equals(Object)}.
     *
     * @return a new java set
     */
    public java.util.LinkedHashSet<T> toJavaSet() {
        java.util.LinkedHashSet<T> set = new java.util.LinkedHashSet<>();
        for (T element : this) {
            set.add(element);
        }
        return set;
    }

    /**
     * Compares the elements of two sets, ignoring the iteration order.
     * Sets with different element equivalences are never equal.
     *
     * @param o another object
     * @return true if both sets have the same equivalence and the same elements
     */
    @SuppressWarnings("unchecked")
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FifoSet)) {
            return false;
        }
        FifoSet<T> that = (FifoSet<T>) o;
        if (size() != that.size() || !index.equivalence().equals(that.index.equivalence())) {
            return false;
        }
        for (T element : this) {
            if (!that.contains(element)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the sum of the element hash codes, where elements are hashed
     * with the element equivalence. With the standard equivalence this is the
     * same as {@link java.util.Set#hashCode()}.
     *
     * @return the hash code
     */
    @Override
    public int hashCode() {
        Equivalence<? super T> equivalence = index.equivalence();
        int hash = 0;
        for (T element : this) {
            hash += equivalence.hash(element);
        }
        return hash;
    }

    @Override
    public String toString() {
        return iterator().mkString("FifoSet(", ", ", ")");
    }
}
