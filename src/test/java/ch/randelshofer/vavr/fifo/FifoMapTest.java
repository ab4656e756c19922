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
import io.vavr.control.Option;
import org.junit.jupiter.api.Test;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FifoMapTest {

    private static <K, V> List<Tuple2<K, V>> toList(FifoMap<K, V> map) {
        return map.iterator().map(FifoEntry::toTuple).toJavaList();
    }

    // -- insert

    @Test
    public void shouldNotOverwriteValueOnDuplicateInsert() {
        FifoMap<String, Integer> map = new FifoMap<>();
        map.insert("A", 1);
        map.insert("B", 2);
        Tuple2<FifoEntry<String, Integer>, Boolean> result = map.insert("A", 99);

        assertThat(result._2).isFalse();
        assertThat(result._1.getValue()).isEqualTo(1);
        assertThat(map.size()).isEqualTo(2);
        assertThat(toList(map)).containsExactly(Tuple.of("A", 1), Tuple.of("B", 2));
    }

    @Test
    public void shouldReturnInsertedEntry() {
        FifoMap<String, Integer> map = new FifoMap<>();
        Tuple2<FifoEntry<String, Integer>, Boolean> result = map.insertLast("A", 1);
        assertThat(result._2).isTrue();
        assertThat(result._1.getKey()).isEqualTo("A");
        assertThat(map.find("A").get()).isSameAs(result._1);
    }

    @Test
    public void shouldKeepInsertionOrder() {
        FifoMap<Integer, String> map = new FifoMap<>();
        for (int i = 100; i > 0; i--) {
            map.insert(i, "v" + i);
        }
        assertThat(map.keys().toJavaList()).isEqualTo(io.vavr.collection.List.rangeClosedBy(100, 1, -1).toJavaList());
    }

    // -- remove

    @Test
    public void shouldRemoveFromTheMiddle() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2, "C", 3);
        assertThat(map.remove("B")).isTrue();
        assertThat(map.keys().toJavaList()).containsExactly("A", "C");
        map.insert("D", 4);
        assertThat(map.keys().toJavaList()).containsExactly("A", "C", "D");
    }

    @Test
    public void shouldMoveReinsertedKeyToTheEnd() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2, "C", 3);
        map.remove("A");
        map.insert("A", 10);
        assertThat(toList(map)).containsExactly(Tuple.of("B", 2), Tuple.of("C", 3), Tuple.of("A", 10));
    }

    @Test
    public void shouldIgnoreRemovalOfAbsentKey() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1);
        assertThat(map.remove("Z")).isFalse();
        assertThat(map.size()).isEqualTo(1);
    }

    @Test
    public void shouldRemoveEntry() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2, "C", 3);
        map.removeEntry(map.find("C").get());
        assertThat(map.keys().toJavaList()).containsExactly("A", "B");
        map.insert("D", 4);
        assertThat(map.keys().toJavaList()).containsExactly("A", "B", "D");
    }

    @Test
    public void shouldRejectStaleEntry() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2);
        FifoEntry<String, Integer> stale = map.find("A").get();
        map.remove("A");
        map.insert("A", 3);
        assertThatThrownBy(() -> map.removeEntry(stale)).isInstanceOf(IllegalArgumentException.class);
        assertThat(map.size()).isEqualTo(2);
    }

    @Test
    public void shouldRejectEntryOfAnotherMap() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1);
        FifoMap<String, Integer> other = FifoMap.of("A", 1);
        assertThatThrownBy(() -> map.removeEntry(other.find("A").get())).isInstanceOf(IllegalArgumentException.class);
        assertThat(map.containsKey("A")).isTrue();
    }

    @Test
    public void shouldRemoveWithIterator() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2, "C", 3);
        Iterator<FifoEntry<String, Integer>> it = map.iterator();
        while (it.hasNext()) {
            if (it.next().getValue() % 2 == 1) {
                it.remove();
            }
        }
        assertThat(toList(map)).containsExactly(Tuple.of("B", 2));
    }

    @Test
    public void shouldFailFastAfterRemoval() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2);
        Iterator<FifoEntry<String, Integer>> it = map.iterator();
        it.next();
        map.remove("B");
        assertThatThrownBy(it::next).isInstanceOf(ConcurrentModificationException.class);
    }

    // -- lookup

    @Test
    public void shouldFindPresentAndAbsentKeys() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1);
        assertThat(map.get("A")).isEqualTo(Option.some(1));
        assertThat(map.get("B")).isEqualTo(Option.none());
        assertThat(map.find("B").isEmpty()).isTrue();
        assertThat(map.getOrElse("B", 7)).isEqualTo(7);
        assertThat(map.count("A")).isEqualTo(1);
        assertThat(map.count("B")).isZero();
    }

    @Test
    public void shouldApplyPresentKey() {
        assertThat(FifoMap.of("A", 1).apply("A")).isEqualTo(1);
    }

    @Test
    public void shouldThrowOnApplyOfAbsentKey() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1);
        assertThatThrownBy(() -> map.apply("B"))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessage("B");
        assertThat(map.size()).isEqualTo(1);
    }

    // -- getOrInsert, put

    @Test
    public void shouldCreateDefaultEntryOnlyOnce() {
        AtomicInteger created = new AtomicInteger();
        FifoMap<String, List<String>> map = new FifoMap<>(Equivalence.standard(), () -> {
            created.incrementAndGet();
            return new java.util.ArrayList<String>();
        });
        FifoEntry<String, List<String>> first = map.getOrInsert("A");
        first.getValue().add("x");
        FifoEntry<String, List<String>> second = map.getOrInsert("A");

        assertThat(second).isSameAs(first);
        assertThat(created.get()).isEqualTo(1);
        assertThat(map.size()).isEqualTo(1);
        assertThat(map.apply("A")).containsExactly("x");
    }

    @Test
    public void shouldUseNullAsDefaultValue() {
        FifoMap<String, Integer> map = new FifoMap<>();
        assertThat(map.getOrInsert("A").getValue()).isNull();
        assertThat(map.containsKey("A")).isTrue();
        assertThat(map.getOrInsert("B", () -> 5).getValue()).isEqualTo(5);
        assertThat(map.keys().toJavaList()).containsExactly("A", "B");
    }

    @Test
    public void shouldWriteThroughEntry() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2);
        map.getOrInsert("A").setValue(10);
        assertThat(map.apply("A")).isEqualTo(10);
        assertThat(map.keys().toJavaList()).containsExactly("A", "B");
    }

    @Test
    public void shouldPutAndKeepPosition() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2);
        assertThat(map.put("A", 3)).isEqualTo(Option.some(1));
        assertThat(map.put("C", 4)).isEqualTo(Option.none());
        assertThat(toList(map)).containsExactly(Tuple.of("A", 3), Tuple.of("B", 2), Tuple.of("C", 4));
    }

    // -- clear, move

    @Test
    public void shouldClear() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2);
        map.clear();
        assertThat(map.isEmpty()).isTrue();
        assertThat(map.iterator().hasNext()).isFalse();
        map.insert("A", 5);
        assertThat(toList(map)).containsExactly(Tuple.of("A", 5));
    }

    @Test
    public void shouldMoveEntriesToNewMap() {
        FifoMap<String, Integer> source = FifoMap.of("A", 1, "B", 2, "C", 3);
        FifoMap<String, Integer> moved = FifoMap.moveOf(source);

        assertThat(source.isEmpty()).isTrue();
        assertThat(toList(moved)).containsExactly(Tuple.of("A", 1), Tuple.of("B", 2), Tuple.of("C", 3));

        moved.remove("A");
        assertThat(moved.keys().toJavaList()).containsExactly("B", "C");
        source.insert("Z", 26);
        assertThat(toList(source)).containsExactly(Tuple.of("Z", 26));
    }

    @Test
    public void shouldDiscardEntriesOnMoveAssignment() {
        FifoMap<String, Integer> source = new FifoMap<>(Equivalence.standard(), () -> 42);
        source.insert("A", 1);
        FifoMap<String, Integer> target = FifoMap.of("X", 0);
        target.moveFrom(source);

        assertThat(toList(target)).containsExactly(Tuple.of("A", 1));
        assertThat(target.getOrInsert("B").getValue()).isEqualTo(42);
    }

    @Test
    public void shouldUseCaseInsensitiveEquivalence() {
        FifoMap<String, Integer> map = new FifoMap<>(
                Equivalence.<String>of(s -> s.toLowerCase().hashCode(), String::equalsIgnoreCase));
        map.insert("Content-Type", 1);
        assertThat(map.insert("content-type", 2)._2).isFalse();
        assertThat(map.apply("CONTENT-TYPE")).isEqualTo(1);

        FifoMap<String, Integer> moved = FifoMap.moveOf(map);
        assertThat(moved.containsKey("content-TYPE")).isTrue();
    }

    @Test
    public void shouldSupportNullKeyAndValue() {
        FifoMap<String, Integer> map = new FifoMap<>();
        map.insert(null, null);
        map.insert("A", 1);
        assertThat(map.containsKey(null)).isTrue();
        assertThat(map.get(null)).isEqualTo(Option.some(null));
        map.remove(null);
        assertThat(map.keys().toJavaList()).containsExactly("A");
    }

    // -- conversions

    @Test
    public void shouldConvertToJavaMapInOrder() {
        FifoMap<String, Integer> map = FifoMap.of("C", 3, "A", 1, "B", 2);
        assertThat(map.toJavaMap().keySet()).containsExactly("C", "A", "B");
    }

    @Test
    public void shouldCreateFromJavaMapAndEntries() {
        java.util.LinkedHashMap<String, Integer> source = new java.util.LinkedHashMap<>();
        source.put("B", 2);
        source.put("A", 1);
        assertThat(FifoMap.ofAll(source).keys().toJavaList()).containsExactly("B", "A");
        assertThat(FifoMap.ofEntries(Tuple.of("X", 1), Tuple.of("Y", 2), Tuple.of("X", 3)).toString())
                .isEqualTo("FifoMap((X, 3), (Y, 2))");
    }

    @Test
    public void shouldCollect() {
        FifoMap<Integer, String> map = Stream.of("ccc", "a", "bb")
                .collect(FifoMap.collector(String::length, s -> s));
        assertThat(map.keys().toJavaList()).containsExactly(3, 1, 2);

        FifoMap<String, Integer> fromTuples = Stream.of(Tuple.of("x", 1), Tuple.of("y", 2))
                .collect(FifoMap.collector());
        assertThat(fromTuples.apply("y")).isEqualTo(2);
    }

    @Test
    public void shouldIterateValues() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2);
        assertThat(map.values().toJavaStream().collect(Collectors.toList())).containsExactly(1, 2);
    }

    @Test
    public void shouldEqualIgnoringOrder() {
        FifoMap<String, Integer> map = FifoMap.of("A", 1, "B", 2);
        FifoMap<String, Integer> map2 = FifoMap.of("B", 2, "A", 1);
        assertThat(map).isEqualTo(map2);
        assertThat(map.hashCode()).isEqualTo(map2.hashCode());
        assertThat(map.hashCode()).isEqualTo(map.toJavaMap().hashCode());
        assertThat(map).isNotEqualTo(FifoMap.of("A", 1, "B", 3));
        assertThat(map).isNotEqualTo(FifoMap.of("A", 1));
    }

    @Test
    public void shouldHashKeysWithEquivalence() {
        Equivalence<String> caseInsensitive = Equivalence.of(s -> s.toLowerCase().hashCode(), String::equalsIgnoreCase);
        FifoMap<String, Integer> lower = new FifoMap<>(caseInsensitive);
        lower.insert("a", 1);
        FifoMap<String, Integer> upper = new FifoMap<>(caseInsensitive);
        upper.insert("A", 1);

        assertThat(lower).isEqualTo(upper);
        assertThat(upper).isEqualTo(lower);
        assertThat(lower.hashCode()).isEqualTo(upper.hashCode());
    }

    @Test
    public void shouldNotEqualMapWithOtherEquivalence() {
        FifoMap<String, Integer> standard = FifoMap.of("A", 1);
        FifoMap<String, Integer> caseInsensitive = new FifoMap<>(
                Equivalence.<String>of(s -> s.toLowerCase().hashCode(), String::equalsIgnoreCase));
        caseInsensitive.insert("A", 1);

        assertThat(standard).isNotEqualTo(caseInsensitive);
        assertThat(caseInsensitive).isNotEqualTo(standard);
    }

    @Test
    public void shouldConvertToString() {
        assertThat(new FifoMap<String, Integer>().toString()).isEqualTo("FifoMap()");
        assertThat(FifoMap.of("A", 1, "B", 2).toString()).isEqualTo("FifoMap((A, 1), (B, 2))");
    }
}
