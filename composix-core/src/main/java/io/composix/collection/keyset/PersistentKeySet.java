/*
 * PersistentKeySet.java
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

package io.composix.collection.keyset;

import clojure.lang.APersistentSet;
import clojure.lang.PersistentHashSet;
import io.composix.annotation.API;
import io.composix.collection.ClojureRuntime;
import io.composix.collection.Key;
import io.composix.collection.ShallowClone;

import javax.annotation.Nonnull;
import java.util.Iterator;

/**
 * {@link KeySet} over a Clojure {@link PersistentHashSet}. Every mutation produces a new version of the set that
 * shares structure with the previous one, so {@link #copy()} takes constant time.
 */
@API(API.Status.UNSTABLE)
public class PersistentKeySet implements KeySet, ShallowClone {
    static {
        ClojureRuntime.load();
    }

    @Nonnull
    private APersistentSet keys;

    public PersistentKeySet() {
        this(PersistentHashSet.EMPTY);
    }

    private PersistentKeySet(@Nonnull APersistentSet keys) {
        this.keys = keys;
    }

    @Override
    public boolean add(@Nonnull Key key) {
        if (keys.contains(key)) {
            return false;
        }
        keys = (APersistentSet)keys.cons(key);
        return true;
    }

    @Override
    public boolean remove(@Nonnull Key key) {
        if (!keys.contains(key)) {
            return false;
        }
        keys = (APersistentSet)keys.disjoin(key);
        return true;
    }

    @Override
    public boolean contains(@Nonnull Key key) {
        return keys.contains(key);
    }

    @Override
    public int count() {
        return keys.count();
    }

    @Nonnull
    @Override
    @SuppressWarnings("unchecked")
    public Iterator<Key> iterator() {
        return (Iterator<Key>)keys.iterator();
    }

    @Nonnull
    @Override
    public PersistentKeySet copy() {
        return new PersistentKeySet(keys);
    }

    @Override
    public String toString() {
        return keys.toString();
    }
}
