/*
 * CompositeIndexTest.java
 *
 * This source file is part of the Composix open source project
 *
 * Copyright 2026 the Composix project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.composix.collection.index;

import io.composix.collection.Collection;
import io.composix.collection.Key;
import io.composix.collection.RecordingIndex;
import io.composix.collection.aggregate.CountIndex;
import io.composix.collection.aggregate.MeanIndex;
import io.composix.collection.aggregate.SumIndex;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CompositeIndex} and its positional forms {@link Zip2} to {@link Zip5} and {@link IndexList}.
 */
public class CompositeIndexTest {

    @Test
    public void zip2FansOutInOrder() {
        final Collection<Integer, Zip2<Integer, RecordingIndex<Integer>, RecordingIndex<Integer>>> numbers =
                Collection.create(Zip.of(new RecordingIndex<Integer>(), new RecordingIndex<Integer>()));
        final Key key = numbers.insert(1);
        numbers.adjustByKey(key, value -> 2);
        numbers.deleteByKey(key);
        final List<String> expected = List.of("insert 0 1", "update 0 1 -> 2", "remove 0 2");
        assertEquals(expected, numbers.queryValue(ix -> ix.first().getEvents()));
        assertEquals(expected, numbers.queryValue(ix -> ix.second().getEvents()));
    }

    @Test
    public void zip3And4And5() {
        final Collection<Integer, Zip3<Integer, CountIndex<Integer>, SumIndex<Integer>, BTreeIndex<Integer>>> three =
                Collection.create(Zip.of(CountIndex.<Integer>create(), SumIndex.ofIntegers(), BTreeIndex.<Integer>create()));
        three.insertAll(List.of(3, 4, 5));
        assertEquals(3L, three.<Long>queryValue(ix -> ix.first().get()));
        assertEquals(12, three.<Integer>queryValue(ix -> ix.second().get()));
        assertEquals(Optional.of(5), three.<Optional<Integer>>queryValue(ix -> ix.third().maxValue()));

        final Collection<Integer, Zip4<Integer, CountIndex<Integer>, SumIndex<Integer>, MeanIndex<Integer>, HashTableIndex<Integer>>> four =
                Collection.create(Zip.of(CountIndex.<Integer>create(), SumIndex.ofIntegers(), MeanIndex.<Integer>create(), HashTableIndex.<Integer>create()));
        four.insertAll(List.of(2, 4));
        assertEquals(3.0, four.<Double>queryValue(ix -> ix.third().get()));
        assertTrue(four.<Boolean>queryValue(ix -> ix.fourth().contains(4)));

        final Collection<Integer, Zip5<Integer, CountIndex<Integer>, CountIndex<Integer>, CountIndex<Integer>, CountIndex<Integer>, KeysIndex<Integer>>> five =
                Collection.create(Zip.of(CountIndex.<Integer>create(), CountIndex.<Integer>create(), CountIndex.<Integer>create(),
                        CountIndex.<Integer>create(), KeysIndex.<Integer>create()));
        final Key key = five.insert(1);
        assertEquals(1L, five.<Long>queryValue(ix -> ix.fourth().get()));
        assertEquals(List.of(key), five.queryKeys(ix -> ix.fifth().all()));

        final Collection<Integer, Zip5<Integer, CountIndex<Integer>, CountIndex<Integer>, CountIndex<Integer>, CountIndex<Integer>, KeysIndex<Integer>>> copy = five.copy();
        copy.deleteByKey(key);
        assertEquals(0L, copy.<Long>queryValue(ix -> ix.first().get()));
        assertEquals(1L, five.<Long>queryValue(ix -> ix.first().get()));
    }

    @Test
    public void shallowCloneableOnlyWhenEveryMemberIs() {
        assertTrue(Zip.of(CountIndex.<String>create(), KeysIndex.<String>persistent()).isShallowCloneable());
        assertFalse(Zip.of(CountIndex.<String>create(), KeysIndex.<String>create()).isShallowCloneable());
    }

    @Test
    public void indexListAddressesByPosition() {
        final Collection<String, IndexList<String, PremapIndex<String, Character, HashTableIndex<Character>>>> words =
                Collection.create(IndexList.of(
                        PremapIndex.of((String word) -> word.charAt(0), HashTableIndex.<Character>create()),
                        PremapIndex.of((String word) -> word.charAt(word.length() - 1), HashTableIndex.<Character>create())));
        words.insertAll(List.of("tent", "toast", "bat"));
        assertEquals(2, words.<Integer>queryValue(IndexList::size));
        assertEquals(2, words.queryAll(ix -> ix.get(0).inner().getAll('t')).size());
        assertEquals(3, words.queryAll(ix -> ix.get(1).inner().getAll('t')).size());

        final Collection<String, IndexList<String, PremapIndex<String, Character, HashTableIndex<Character>>>> copy = words.copy();
        copy.delete(ix -> ix.get(0).inner().getAll('b'));
        assertEquals(3, words.queryAll(ix -> ix.get(1).inner().getAll('t')).size());
        assertEquals(2, copy.queryAll(ix -> ix.get(1).inner().getAll('t')).size());
    }

    @Test
    public void optionalIndex() {
        final Collection<Integer, OptionalIndex<Integer, CountIndex<Integer>>> present = Collection.create(OptionalIndex.of(CountIndex.<Integer>create()));
        final Collection<Integer, OptionalIndex<Integer, CountIndex<Integer>>> absent = Collection.create(OptionalIndex.<Integer, CountIndex<Integer>>absent());
        present.insertAll(List.of(1, 2));
        absent.insertAll(List.of(1, 2));
        assertEquals(Optional.of(2L), present.queryValue(ix -> ix.get().map(CountIndex::get)));
        assertEquals(Optional.empty(), absent.queryValue(ix -> ix.get().map(CountIndex::get)));
        assertTrue(absent.<Boolean>queryValue(OptionalIndex::isShallowCloneable));
        assertEquals(2, absent.size());
    }

    @Test
    public void trivialIndexIsItsOwnCopy() {
        final TrivialIndex<String> trivial = TrivialIndex.create();
        assertSame(trivial, trivial.copy());
        assertTrue(trivial.isShallowCloneable());
        final Collection<String, TrivialIndex<String>> words = Collection.create(trivial);
        final Key key = words.insert("a");
        words.adjustByKey(key, word -> "b");
        assertEquals(Optional.of("b"), words.deleteByKey(key));
        assertTrue(words.isEmpty());
    }
}
