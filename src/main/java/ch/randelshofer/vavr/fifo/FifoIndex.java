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

import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * An insertion-ordered hash index: a singly-linked list of entries plus a
 * hash table that maps the key of each entry to the list node that
 * <i>precedes</i> the entry.
 * <p>
 * The list can only be changed "after" a node that we hold. Storing the
 * predecessor in the hash table turns every insert and every remove into a
 * constant number of such changes:
 * <ul>
 *     <li>find: one hash lookup, one step forward</li>
 *     <li>insertLast, insertFirst: one hash lookup, one link, at most two hash updates</li>
 *     <li>remove: one hash removal, one unlink, at most one hash update</li>
 * </ul>
 * <p>
 * The list starts with a sentinel node that never holds an entry.
 * Field {@code back} references the last node of the list, or the sentinel if
 * the index is empty.
 * <p>
 * This class is not thread-safe.
 *
 * @param <K> the key type
 * @param <E> the entry type
 */
final class FifoIndex<K, E> {

    private final Function<? super E, ? extends K> keyFunction;
    private final Node<E> sentinel = new Node<>(null);
    private Equivalence<? super K> equivalence;
    private HashMap<KeyRef<K>, Node<E>> index = new HashMap<>();
    private Node<E> back = sentinel;
    /**
     * Counts structural changes, for fail-fast iterators.
     */
    private int modCount;

    FifoIndex(Function<? super E, ? extends K> keyFunction, Equivalence<? super K> equivalence) {
        this.keyFunction = Objects.requireNonNull(keyFunction, "keyFunction is null");
        this.equivalence = Objects.requireNonNull(equivalence, "equivalence is null");
    }

    Equivalence<? super K> equivalence() {
        return equivalence;
    }

    int size() {
        return index.size();
    }

    boolean isEmpty() {
        return index.isEmpty();
    }

    int count(K key) {
        return index.containsKey(keyRef(key)) ? 1 : 0;
    }

    /**
     * Returns the live node of the given key.
     *
     * @param key a key
     * @return the node or null
     */
    Node<E> find(K key) {
        Node<E> before = index.get(keyRef(key));
        return before == null ? null : before.next;
    }

    /**
     * Appends the entry, unless an entry with an equivalent key is present.
     *
     * @param entry an entry
     * @return the live node of the key, and true if the node was created
     */
    Tuple2<Node<E>, Boolean> insertLast(E entry) {
        KeyRef<K> ref = keyRef(keyFunction.apply(entry));
        Node<E> existing = index.get(ref);
        if (existing != null) {
            return Tuple.of(existing.next, false);
        }
        Node<E> before = back;
        Node<E> node = new Node<>(entry);
        before.next = node;
        back = node;
        index.put(ref, before);
        modCount++;
        return Tuple.of(node, true);
    }

    /**
     * Prepends the entry, unless an entry with an equivalent key is present.
     *
     * @param entry an entry
     * @return the live node of the key, and true if the node was created
     */
    Tuple2<Node<E>, Boolean> insertFirst(E entry) {
        KeyRef<K> ref = keyRef(keyFunction.apply(entry));
        Node<E> existing = index.get(ref);
        if (existing != null) {
            return Tuple.of(existing.next, false);
        }
        Node<E> first = sentinel.next;
        Node<E> node = new Node<>(entry);
        node.next = first;
        sentinel.next = node;
        if (first == null) {
            back = node;
        } else {
            index.put(keyRef(keyFunction.apply(first.entry)), node);
        }
        index.put(ref, sentinel);
        modCount++;
        return Tuple.of(node, true);
    }

    /**
     * Removes the entry of the given key.
     *
     * @param key a key
     * @return true if an entry was removed
     */
    boolean remove(K key) {
        Node<E> before = index.remove(keyRef(key));
        if (before == null) {
            return false;
        }
        unlinkAfter(before);
        return true;
    }

    /**
     * Removes a node that we handed out before.
     *
     * @param node a live node of this index
     * @throws IllegalArgumentException if the node has been removed, or
     *                                  belongs to another index
     */
    void removeNode(Node<E> node) {
        Objects.requireNonNull(node, "node is null");
        if (node == sentinel) {
            throw new IllegalArgumentException("node is the sentinel");
        }
        KeyRef<K> ref = keyRef(keyFunction.apply(node.entry));
        Node<E> before = index.get(ref);
        if (before == null || before.next != node) {
            throw new IllegalArgumentException("node is not live in this container: " + node.entry);
        }
        index.remove(ref);
        unlinkAfter(before);
    }

    private void unlinkAfter(Node<E> before) {
        Node<E> node = before.next;
        Node<E> after = node.next;
        before.next = after;
        node.next = null;
        if (after == null) {
            back = before;
        } else {
            index.put(keyRef(keyFunction.apply(after.entry)), before);
        }
        modCount++;
    }

    void clear() {
        index.clear();
        sentinel.next = null;
        back = sentinel;
        modCount++;
    }

    /**
     * Takes over all entries and the equivalence of the source index.
     * The entries of this index are discarded. The source is left empty.
     * <p>
     * The sentinel belongs to the index instance, so the first node is
     * relinked to our sentinel and its key is repointed to it.
     *
     * @param source another index
     */
    void moveFrom(FifoIndex<K, E> source) {
        Objects.requireNonNull(source, "source is null");
        if (source == this) {
            throw new IllegalArgumentException("cannot move a container into itself");
        }
        equivalence = source.equivalence;
        index = source.index;
        sentinel.next = source.sentinel.next;
        back = source.back == source.sentinel ? sentinel : source.back;
        if (sentinel.next != null) {
            index.put(keyRef(keyFunction.apply(sentinel.next.entry)), sentinel);
        }
        modCount++;

        source.index = new HashMap<>();
        source.sentinel.next = null;
        source.back = source.sentinel;
        source.modCount++;
    }

    <T> io.vavr.collection.Iterator<T> iterator(Function<? super E, ? extends T> mapper) {
        return new NodeIterator<>(mapper);
    }

    private KeyRef<K> keyRef(K key) {
        return new KeyRef<>(key, equivalence);
    }

    static final class Node<E> {
        final E entry;
        Node<E> next;

        Node(E entry) {
            this.entry = entry;
        }
    }

    /**
     * Makes {@link HashMap} hash and compare a key with an {@link Equivalence}.
     */
    static final class KeyRef<K> {
        private final K key;
        private final Equivalence<? super K> equivalence;
        private final int hash;

        KeyRef(K key, Equivalence<? super K> equivalence) {
            this.key = key;
            this.equivalence = equivalence;
            this.hash = equivalence.hash(key);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @SuppressWarnings("unchecked")
        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof KeyRef)) {
                return false;
            }
            KeyRef<?> that = (KeyRef<?>) o;
            return hash == that.hash && equivalence.equal(key, (K) that.key);
        }
    }

    private final class NodeIterator<T> implements io.vavr.collection.Iterator<T> {
        private final Function<? super E, ? extends T> mapper;
        private Node<E> next = sentinel.next;
        private Node<E> lastReturned;
        private int expectedModCount = modCount;

        NodeIterator(Function<? super E, ? extends T> mapper) {
            this.mapper = mapper;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            if (next == null) {
                throw new NoSuchElementException("next() on empty iterator");
            }
            checkForComodification();
            lastReturned = next;
            next = next.next;
            return mapper.apply(lastReturned.entry);
        }

        @Override
        public void remove() {
            if (lastReturned == null) {
                throw new IllegalStateException("remove() without next()");
            }
            checkForComodification();
            removeNode(lastReturned);
            lastReturned = null;
            expectedModCount = modCount;
        }

        private void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }
    }
}
