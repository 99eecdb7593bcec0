/*
 * RecordingIndex.java
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

import io.composix.collection.index.Index;
import io.composix.collection.index.Insert;
import io.composix.collection.index.Remove;
import io.composix.collection.index.Update;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Index that writes down every operation it receives. When given the store of its collection it also writes down
 * what the store held for the key at the time of the call.
 *
 * @param <T> value type
 */
public class RecordingIndex<T> implements Index<T> {
    @Nonnull
    private final List<String> events;
    @Nullable
    private final Store<?> store;

    public RecordingIndex() {
        this(null);
    }

    public RecordingIndex(@Nullable Store<?> store) {
        this(new ArrayList<>(), store);
    }

    private RecordingIndex(@Nonnull List<String> events, @Nullable Store<?> store) {
        this.events = events;
        this.store = store;
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<T> op) {
        events.add("insert " + op.getKey().getId() + " " + op.getNewValue() + stored(op.getKey()));
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<T> op) {
        events.add("remove " + op.getKey().getId() + " " + op.getExistingValue() + stored(op.getKey()));
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        events.add("update " + op.getKey().getId() + " " + op.getExistingValue() + " -> " + op.getNewValue() + stored(op.getKey()));
    }

    @Nonnull
    private String stored(@Nonnull Key key) {
        if (store == null) {
            return "";
        }
        final Object record = store.get(key);
        return record == null ? " [absent]" : " [stored " + record + "]";
    }

    @Nonnull
    public List<String> getEvents() {
        return events;
    }

    public void clear() {
        events.clear();
    }

    @Nonnull
    @Override
    public RecordingIndex<T> copy() {
        return new RecordingIndex<>(new ArrayList<>(events), null);
    }
}
