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
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * Implements a mutable map that iterates in the order in which keys were
 * inserted, using a singly-linked list of entries and a hash index.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null keys and null values (with the standard equivalence)</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>iterates in the order, in which keys were inserted</li>
 *     <li>hashes and compares keys with a pluggable {@link Equivalence}</li>
 *     <li>can be moved, but not copied</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>insert, put, getOrInsert: O(1) in an amortized sense</li>
 *     <li>find, get, apply, containsKey: O(1)</li>
 *     <li>remove, removeEntry: O(1)</li>
 *     <li>moveOf, moveFrom: O(1)</li>
 *     <li>iterator creation: O(1)</li>
 *     <li>iterator.next: O(1)</li>
 * </ul>
 * <p>
 * Inserting a key that is already present does not change the map; the
 * existing entry is returned instead. Removing a key and inserting it again
 * moves it to the end of the iteration order.
 * <p>
 * Iterators are fail-fast. Entries returned by this map are live: their
 * {@link FifoEntry#setValue(Object)} writes through to the map.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class FifoMap<K, V> implements Iterable<FifoEntry<K, V>> {

    private final FifoIndex<K, FifoEntry<K, V>> index;
    private Supplier<? extends V> defaultValue;

    /**
     * Creates an empty map with the standard equivalence, and {@code null}
     * as default value.
     */
    public FifoMap() {
        this(Equivalence.standard());
    }

    /**
     * Creates an empty map with the given key equivalence, and {@code null}
     * as default value.
     *
     * @param equivalence the key equivalence
     */
    public FifoMap(Equivalence<? super K> equivalence) {
        this(equivalence, () -> null);
    }

    /**
     * Creates an empty map.
     *
     * @param equivalence  the key equivalence
     * @param defaultValue supplies the value of entries created by {@link #getOrInsert(Object)}
     */
    public FifoMap(Equivalence<? super K> equivalence, Supplier<? extends V> defaultValue) {
        this.index = new FifoIndex<>(FifoEntry::getKey, equivalence);
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue is null");
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain a {@link FifoMap}.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return A {@link FifoMap} Collector.
     */
    public static <K, V> Collector<Tuple2<K, V>, ArrayList<Tuple2<K, V>>, FifoMap<K, V>> collector() {
        return FifoCollections.toListAndThen(FifoMap::ofEntries);
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain a {@link FifoMap}.
     *
     * @param keyMapper   The key mapper
     * @param valueMapper The value mapper
     * @param <K>         The key type
     * @param <V>         The value type
     * @param <T>         Initial {@link java.util.stream.Stream} elements type
     * @return A {@link FifoMap} Collector.
     */
    public static <K, V, T> Collector<T, ArrayList<T>, FifoMap<K, V>> collector(
            Function<? super T, ? extends K> keyMapper, Function<? super T, ? extends V> valueMapper) {
        Objects.requireNonNull(keyMapper, "keyMapper is null");
        Objects.requireNonNull(valueMapper, "valueMapper is null");
        return FifoCollections.toListAndThen(arr -> FifoMap.ofEntries(Iterator.ofAll(arr)
                .map(t -> Tuple.of(keyMapper.apply(t), valueMapper.apply(t)))));
    }

    /**
     * Returns a singleton {@code FifoMap}, i.e. a {@code FifoMap} of one entry.
     *
     * @param key   A singleton map key.
     * @param value A singleton map value.
     * @param <K>   The key type
     * @param <V>   The value type
     * @return A new Map containing the given entry
     */
    public static <K, V> FifoMap<K, V> of(K key, V value) {
        FifoMap<K, V> map = new FifoMap<>();
        map.put(key, value);
        return map;
    }

    /**
     * Creates a FifoMap of the given list of key-value pairs.
     * If a key occurs twice, the later value replaces the earlier one, and the
     * key keeps its first position.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> FifoMap<K, V> of(K k1, V v1, K k2, V v2) {
        FifoMap<K, V> map = of(k1, v1);
        map.put(k2, v2);
        return map;
    }

    /**
     * Creates a FifoMap of the given list of key-value pairs.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param k3  a key for the map
     * @param v3  the value for k3
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> FifoMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        FifoMap<K, V> map = of(k1, v1, k2, v2);
        map.put(k3, v3);
        return map;
    }

    /**
     * Creates a FifoMap of the given tuples, in the given order.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public static <K, V> FifoMap<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return ofEntries(Arrays.asList(entries));
    }

    /**
     * Creates a FifoMap of the given tuples, in iteration order.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> FifoMap<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        FifoMap<K, V> map = new FifoMap<>();
        for (Tuple2<? extends K, ? extends V> entry : entries) {
            map.put(entry._1, entry._2);
        }
        return map;
    }

    /**
     * Creates a FifoMap from a {@link java.util.Map}, in the iteration order
     * of the given map.
     *
     * @param map A map
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given map
     */
    public static <K, V> FifoMap<K, V> ofAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        FifoMap<K, V> result = new FifoMap<>();
        for (Map.Entry<? extends K, ? extends V> entry : map.entrySet()) {
            result.put(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Creates a new map that takes over all entries, the equivalence and the
     * default value of the source map. The source map is left empty, and can
     * be reused.
     *
     * @param source the source map
     * @param <K>    The key type
     * @param <V>    The value type
     * @return a new map
     */
    public static <K, V> FifoMap<K, V> moveOf(FifoMap<K, V> source) {
        Objects.requireNonNull(source, "source is null");
        FifoMap<K, V> map = new FifoMap<>(source.index.equivalence(), source.defaultValue);
        map.moveFrom(source);
        return map;
    }

    /**
     * Discards all entries of this map, and takes over all entries, the
     * equivalence and the default value of the source map. The source map is
     * left empty, and can be reused.
     *
     * @param source the source map
     * @throws IllegalArgumentException if source is this map
     */
    public void moveFrom(FifoMap<K, V> source) {
        Objects.requireNonNull(source, "source is null");
        index.moveFrom(source.index);
        defaultValue = source.defaultValue;
    }

    /**
     * Inserts a new entry at the end of this map, unless the key is already
     * present. Same as {@link #insertLast(Object, Object)}.
     *
     * @param key   a key
     * @param value a value
     * @return the entry of the key, and true if the entry was inserted
     */
    public Tuple2<FifoEntry<K, V>, Boolean> insert(K key, V value) {
        return insertLast(key, value);
    }

    /**
     * Inserts a new entry at the end of this map, unless the key is already
     * present.
     * <p>
     * If the key is present, the map is not changed, and the existing entry
     * is returned with its value untouched.
     *
     * @param key   a key
     * @param value a value
     * @return the entry of the key, and true if the entry was inserted
     */
    public Tuple2<FifoEntry<K, V>, Boolean> insertLast(K key, V value) {
        Tuple2<FifoIndex.Node<FifoEntry<K, V>>, Boolean> result = index.insertLast(new FifoEntry<>(key, value));
        return Tuple.of(result._1.entry, result._2);
    }

    /**
     * Looks up the entry of a key.
     *
     * @param key a key
     * @return the live entry, or none
     */
    public Option<FifoEntry<K, V>> find(K key) {
        FifoIndex.Node<FifoEntry<K, V>> node = index.find(key);
        return node == null ? Option.none() : Option.some(node.entry);
    }

    /**
     * Returns the value of a key.
     *
     * @param key a key
     * @return the value, or none if the key is absent
     */
    public Option<V> get(K key) {
        return find(key).map(FifoEntry::getValue);
    }

    /**
     * Returns the value of a key, or the given value if the key is absent.
     * Does not insert the key.
     *
     * @param key          a key
     * @param defaultValue the value to return if the key is absent
     * @return the value
     */
    public V getOrElse(K key, V defaultValue) {
        return get(key).getOrElse(defaultValue);
    }

    /**
     * Tests whether the key is present.
     *
     * @param key a key
     * @return true if the key is present
     */
    public boolean containsKey(K key) {
        return index.find(key) != null;
    }

    /**
     * Returns the number of entries with the given key.
     *
     * @param key a key
     * @return 0 or 1
     */
    public int count(K key) {
        return index.count(key);
    }

    /**
     * Returns the value of a key that must be present.
     *
     * @param key a key
     * @return the value
     * @throws NoSuchElementException if the key is not present
     */
    public V apply(K key) {
        FifoIndex.Node<FifoEntry<K, V>> node = index.find(key);
        if (node == null) {
            throw new NoSuchElementException(String.valueOf(key));
        }
        return node.entry.getValue();
    }

    /**
     * Returns the entry of a key. If the key is absent, appends an entry
     * with the default value of this map.
     *
     * @param key a key
     * @return the live entry of the key
     */
    public FifoEntry<K, V> getOrInsert(K key) {
        return getOrInsert(key, defaultValue);
    }

    /**
     * Returns the entry of a key. If the key is absent, appends an entry
     * with a value obtained from the given supplier.
     *
     * @param key          a key
     * @param defaultValue supplies the value if the key is absent
     * @return the live entry of the key
     */
    public FifoEntry<K, V> getOrInsert(K key, Supplier<? extends V> defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue is null");
        FifoIndex.Node<FifoEntry<K, V>> node = index.find(key);
        if (node != null) {
            return node.entry;
        }
        return index.insertLast(new FifoEntry<>(key, defaultValue.get()))._1.entry;
    }

    /**
     * Associates a value with a key. A key that is already present keeps its
     * position; a new key is appended.
     *
     * @param key   a key
     * @param value a value
     * @return the previous value, or none if the key was absent
     */
    public Option<V> put(K key, V value) {
        FifoIndex.Node<FifoEntry<K, V>> node = index.find(key);
        if (node != null) {
            return Option.some(node.entry.setValue(value));
        }
        index.insertLast(new FifoEntry<>(key, value));
        return Option.none();
    }

    /**
     * Removes the entry of a key. Does nothing if the key is absent.
     *
     * @param key a key
     * @return true if an entry was removed
     */
    public boolean remove(K key) {
        return index.remove(key);
    }

    /**
     * Removes an entry that was obtained from this map, without looking
     * up its key again.
     *
     * @param entry a live entry of this map
     * @throws IllegalArgumentException if the entry is not live in this map
     */
    public void removeEntry(FifoEntry<K, V> entry) {
        Objects.requireNonNull(entry, "entry is null");
        FifoIndex.Node<FifoEntry<K, V>> node = index.find(entry.getKey());
        if (node == null || node.entry != entry) {
            throw new IllegalArgumentException("entry is not live in this map: " + entry);
        }
        index.removeNode(node);
    }

    /**
     * Returns the number of entries.
     *
     * @return the size
     */
    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    /**
     * Removes all entries. Entries and iterators obtained before become stale.
     */
    public void clear() {
        index.clear();
    }

    /**
     * Returns an iterator over the live entries, in insertion order.
     * The iterator supports {@link java.util.Iterator#remove()}.
     *
     * @return a fail-fast iterator
     */
    @Override
    public Iterator<FifoEntry<K, V>> iterator() {
        return index.iterator(Function.identity());
    }

    /**
     * Returns an iterator over the keys, in insertion order.
     * The iterator supports {@link java.util.Iterator#remove()}.
     *
     * @return a fail-fast iterator
     */
    public Iterator<K> keys() {
        return index.iterator(FifoEntry::getKey);
    }

    /**
     * Returns an iterator over the values, in the insertion order of their keys.
     * The iterator supports {@link java.util.Iterator#remove()}.
     *
     * @return a fail-fast iterator
     */
    public Iterator<V> values() {
        return index.iterator(FifoEntry::getValue);
    }

    /**
     * Returns a snapshot of this map as a {@link java.util.LinkedHashMap}
     * with the same iteration order. Keys of the snapshot are compared
     * with {@link Object#equals(Object)}.
     *
     * @return a new java map
     */
    public java.util.LinkedHashMap<K, V> toJavaMap() {
        java.util.LinkedHashMap<K, V> map = new java.util.LinkedHashMap<>();
        for (FifoEntry<K, V> entry : this) {
            map.put(entry.getKey(), entry.getValue());
        }
        return map;
    }

    /**
     * Compares the mappings of two maps, ignoring the iteration order.
     * Maps with different key equivalences are never equal.
     *
     * @param o another object
     * @return true if both maps have the same equivalence and the same mappings
     */
    @SuppressWarnings("unchecked")
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FifoMap)) {
            return false;
        }
        FifoMap<K, ?> that = (FifoMap<K, ?>) o;
        if (size() != that.size() || !index.equivalence().equals(that.index.equivalence())) {
            return false;
        }
        for (FifoEntry<K, V> entry : this) {
            FifoIndex.Node<? extends FifoEntry<K, ?>> node = that.index.find(entry.getKey());
            if (node == null || !Objects.equals(entry.getValue(), node.entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the sum of the entry hash codes, where keys are hashed with
     * the key equivalence. With the standard equivalence this is the same as
     * {@link java.util.Map#hashCode()}.
     *
     * @return the hash code
     */
    @Override
    public int hashCode() {
        Equivalence<? super K> equivalence = index.equivalence();
        int hash = 0;
        for (FifoEntry<K, V> entry : this) {
            hash += equivalence.hash(entry.getKey()) ^ Objects.hashCode(entry.getValue());
        }
        return hash;
    }

    @Override
    public String toString() {
        return iterator().mkString("FifoMap(", ", ", ")");
    }
}
