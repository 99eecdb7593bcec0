/*
 * QueryResultTest.java
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

package io.composix.collection.query;

import io.composix.collection.Key;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DistinctKeys}, {@link KeyList} and {@link Resolver}.
 */
public class QueryResultTest {
    private static final Key ONE = Key.unsafeOf(1L);
    private static final Key TWO = Key.unsafeOf(2L);
    private static final Key THREE = Key.unsafeOf(3L);

    @Test
    public void distinctKeysDropRepeats() {
        final DistinctKeys keys = DistinctKeys.builder().add(ONE).add(TWO).add(ONE).build();
        assertThat(keys.size()).isEqualTo(2);
        assertThat(keys.keys()).containsExactly(ONE, TWO);
        assertThat(keys.first()).contains(ONE);
        assertThat(keys.contains(TWO)).isTrue();
        assertThat(DistinctKeys.empty().first()).isEmpty();
        assertThat(DistinctKeys.of()).isSameAs(DistinctKeys.empty());
        assertThat(keys.union(DistinctKeys.of(TWO, THREE)).keys()).containsExactly(ONE, TWO, THREE);
        assertThat(keys.union(DistinctKeys.empty())).isSameAs(keys);
        assertThat(keys).isEqualTo(DistinctKeys.of(TWO, ONE));
    }

    @Test
    public void keyListKeepsRepeats() {
        final KeyList list = KeyList.of(DistinctKeys.of(ONE, TWO), TWO, QueryResult.of(Optional.of(THREE)), QueryResult.of(Optional.empty()));
        assertThat(list.keys()).containsExactly(ONE, TWO, TWO, THREE);
        assertThat(list.size()).isEqualTo(4);
        assertThat(list.distinct().keys()).containsExactly(ONE, TWO, THREE);
        assertThat(KeyList.copyOf(List.of(THREE, THREE)).distinct().size()).isEqualTo(1);
        assertThat(KeyList.of().isEmpty()).isTrue();
    }

    @Test
    public void singleKeyIsADistinctResult() {
        final DistinctQueryResult result = ONE;
        final List<Key> visited = new ArrayList<>();
        result.forEachKey(visited::add);
        assertThat(visited).containsExactly(ONE);
        assertThat(result.keys()).containsExactly(ONE);
    }

    @Test
    public void resolverDefaults() {
        final Map<Key, String> records = Map.of(ONE, "one", TWO, "two");
        final Resolver<String> resolver = records::get;
        assertThat(resolver.get(Optional.of(TWO))).contains("two");
        assertThat(resolver.get(Optional.<Key>empty())).isEmpty();
        assertThat(resolver.getAll(KeyList.of(ONE, TWO, ONE))).containsExactly("one", "two", "one");
        assertThat(resolver.getWithKeys(DistinctKeys.of(TWO))).containsExactly(Map.entry(TWO, "two"));
    }
}
