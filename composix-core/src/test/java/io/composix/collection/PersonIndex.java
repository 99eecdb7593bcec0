/*
 * PersonIndex.java
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

package io.composix.collection;

import com.google.common.collect.ImmutableList;
import io.composix.collection.aggregate.CountIndex;
import io.composix.collection.index.BTreeIndex;
import io.composix.collection.index.CompositeIndex;
import io.composix.collection.index.FilteredIndex;
import io.composix.collection.index.GroupedIndex;
import io.composix.collection.index.HashTableIndex;
import io.composix.collection.index.Index;
import io.composix.collection.index.KeysIndex;
import io.composix.collection.index.PremapIndex;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A named composite index over {@link Person}s, in either mutable or persistent form.
 */
public class PersonIndex extends CompositeIndex<Person> {
    final PremapIndex<Person, String, HashTableIndex<String>> byName;
    final PremapIndex<Person, Integer, BTreeIndex<Integer>> byAge;
    final GroupedIndex<Person, String, KeysIndex<Person>> byCity;
    final FilteredIndex<Person, Person, KeysIndex<Person>> active;
    final CountIndex<Person> count;
    @Nonnull
    private final List<Index<Person>> members;

    private PersonIndex(@Nonnull PremapIndex<Person, String, HashTableIndex<String>> byName,
                        @Nonnull PremapIndex<Person, Integer, BTreeIndex<Integer>> byAge,
                        @Nonnull GroupedIndex<Person, String, KeysIndex<Person>> byCity,
                        @Nonnull FilteredIndex<Person, Person, KeysIndex<Person>> active,
                        @Nonnull CountIndex<Person> count) {
        this.byName = byName;
        this.byAge = byAge;
        this.byCity = byCity;
        this.active = active;
        this.count = count;
        this.members = ImmutableList.of(byName, byAge, byCity, active, count);
    }

    @Nonnull
    public static PersonIndex create() {
        return new PersonIndex(
                PremapIndex.of(Person::getName, HashTableIndex.<String>create()),
                PremapIndex.of(Person::getAge, BTreeIndex.<Integer>create()),
                GroupedIndex.create(Person::getCity, KeysIndex::<Person>create),
                FilteredIndex.where(Person::isActive, KeysIndex.<Person>create()),
                CountIndex.create());
    }

    @Nonnull
    public static PersonIndex persistent() {
        return new PersonIndex(
                PremapIndex.of(Person::getName, HashTableIndex.<String>persistent()),
                PremapIndex.of(Person::getAge, BTreeIndex.<Integer>persistent()),
                GroupedIndex.persistent(Person::getCity, KeysIndex::<Person>persistent),
                FilteredIndex.where(Person::isActive, KeysIndex.<Person>persistent()),
                CountIndex.create());
    }

    @Nonnull
    public static PersonIndex create(boolean persistent) {
        return persistent ? persistent() : create();
    }

    @Nonnull
    @Override
    protected List<Index<Person>> members() {
        return members;
    }

    @Nonnull
    @Override
    public PersonIndex copy() {
        return new PersonIndex(byName.copy(), byAge.copy(), byCity.copy(), active.copy(), count.copy());
    }
}
