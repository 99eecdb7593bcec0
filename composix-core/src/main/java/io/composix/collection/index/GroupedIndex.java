/*
 * GroupedIndex.java
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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.composix.annotation.API;
import io.composix.collection.IndexConsistencyException;
import io.composix.collection.Seal;
import io.composix.collection.backing.BackingMap;
import io.composix.collection.backing.HashBackingMap;
import io.composix.collection.backing.PersistentHashBackingMap;
import io.composix.collection.logging.KeyValueLogMessage;
import io.composix.collection.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Partitions records by a group key and keeps a separate inner index for each group.
 *
 * <p>
 * A group is created, from the supplied factory, when its first record arrives and is dropped as soon as its last
 * record leaves, so {@link #groups()} only ever lists groups with at least one record. An update that keeps the group
 * key is forwarded to the group as an update. An update that changes it becomes a removal from the old group followed
 * by an insertion into the new one.
 * </p>
 *
 * <p>
 * The persistent variant shares groups between copies. A shared group is copied the first time either side changes
 * it, so the cost of a copy is paid per touched group.
 * </p>
 *
 * @param <T> record type
 * @param <G> group key type
 * @param <I> inner index type
 */
@API(API.Status.STABLE)
public class GroupedIndex<T, G, I extends Index<T>> implements Index<T> {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(GroupedIndex.class);

    @Nonnull
    private final Function<? super T, ? extends G> groupFunction;
    @Nonnull
    private final Supplier<? extends I> factory;
    @Nonnull
    private final BackingMap<G, Group<I>> groups;
    @Nonnull
    private final I empty;
    @Nonnull
    private Object owner;

    protected GroupedIndex(@Nonnull Function<? super T, ? extends G> groupFunction,
                           @Nonnull Supplier<? extends I> factory,
                           @Nonnull BackingMap<G, Group<I>> groups) {
        this.groupFunction = groupFunction;
        this.factory = factory;
        this.groups = groups;
        this.empty = factory.get();
        this.owner = new Object();
    }

    /**
     * Create a grouped index.
     * @param groupFunction computes the group key of a record; must be pure
     * @param factory creates the inner index of a new group
     * @param <T> record type
     * @param <G> group key type
     * @param <I> inner index type
     * @return a new, empty index
     */
    @Nonnull
    public static <T, G, I extends Index<T>> GroupedIndex<T, G, I> create(@Nonnull Function<? super T, ? extends G> groupFunction,
                                                                           @Nonnull Supplier<? extends I> factory) {
        return new GroupedIndex<>(groupFunction, factory, new HashBackingMap<>());
    }

    /**
     * Create a grouped index whose copies share groups.
     * @param groupFunction computes the group key of a record; must be pure
     * @param factory creates the inner index of a new group, preferably a persistent one
     * @param <T> record type
     * @param <G> group key type
     * @param <I> inner index type
     * @return a new, empty index
     */
    @Nonnull
    public static <T, G, I extends Index<T>> GroupedIndex<T, G, I> persistent(@Nonnull Function<? super T, ? extends G> groupFunction,
                                                                               @Nonnull Supplier<? extends I> factory) {
        return new GroupedIndex<>(groupFunction, factory, new PersistentHashBackingMap<>());
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<T> op) {
        final G groupKey = groupFunction.apply(op.getNewValue());
        Group<I> group = writableGroup(groupKey);
        if (group == null) {
            group = new Group<>(factory.get(), owner);
            groups.put(groupKey, group);
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace(KeyValueLogMessage.of("created group",
                        LogMessageKeys.GROUP, groupKey,
                        LogMessageKeys.GROUP_COUNT, groups.size()));
            }
        }
        group.index.insert(seal, op);
        group.count++;
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<T> op) {
        final G groupKey = groupFunction.apply(op.getExistingValue());
        final Group<I> group = writableGroup(groupKey);
        if (group == null) {
            throw IndexConsistencyException.unknownRemoval(this, op.getKey());
        }
        group.index.remove(seal, op);
        group.count--;
        if (group.count == 0) {
            groups.remove(groupKey);
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace(KeyValueLogMessage.of("dropped empty group",
                        LogMessageKeys.GROUP, groupKey,
                        LogMessageKeys.GROUP_COUNT, groups.size()));
            }
        }
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        final G newGroupKey = groupFunction.apply(op.getNewValue());
        final G existingGroupKey = groupFunction.apply(op.getExistingValue());
        if (!Objects.equals(newGroupKey, existingGroupKey)) {
            remove(seal, op.asRemove());
            insert(seal, op.asInsert());
            return;
        }
        final Group<I> group = writableGroup(existingGroupKey);
        if (group == null) {
            throw IndexConsistencyException.unknownRemoval(this, op.getKey());
        }
        group.index.update(seal, op);
    }

    /**
     * Get the inner index of a group. A group without records has an empty index.
     * @param groupKey the group key
     * @return the index of the group
     */
    @Nonnull
    public I get(@Nonnull G groupKey) {
        final Group<I> group = groups.get(groupKey);
        return group == null ? empty : group.index;
    }

    public boolean contains(@Nonnull G groupKey) {
        return groups.containsKey(groupKey);
    }

    /**
     * Count the records in a group.
     * @param groupKey the group key
     * @return the number of records in the group, zero if it does not exist
     */
    public long groupSize(@Nonnull G groupKey) {
        final Group<I> group = groups.get(groupKey);
        return group == null ? 0L : group.count;
    }

    public int groupCount() {
        return groups.size();
    }

    /**
     * Get every non-empty group and its index. The order of the groups is unspecified.
     * @return a snapshot of the groups
     */
    @Nonnull
    public Map<G, I> groups() {
        final ImmutableMap.Builder<G, I> builder = ImmutableMap.builderWithExpectedSize(groups.size());
        for (Map.Entry<G, Group<I>> entry : groups) {
            builder.put(entry.getKey(), entry.getValue().index);
        }
        return builder.build();
    }

    @Nonnull
    public Set<G> groupKeys() {
        final ImmutableSet.Builder<G> builder = ImmutableSet.builderWithExpectedSize(groups.size());
        for (Map.Entry<G, Group<I>> entry : groups) {
            builder.add(entry.getKey());
        }
        return builder.build();
    }

    @Nonnull
    @Override
    public GroupedIndex<T, G, I> copy() {
        if (groups.isPersistent()) {
            // both sides must now copy shared groups before changing them
            owner = new Object();
            return new GroupedIndex<>(groupFunction, factory, groups.copy());
        }
        final GroupedIndex<T, G, I> copy = new GroupedIndex<>(groupFunction, factory, groups.copy());
        for (Map.Entry<G, Group<I>> entry : groups) {
            copy.groups.put(entry.getKey(), entry.getValue().copyFor(copy.owner));
        }
        return copy;
    }

    @Override
    public boolean isShallowCloneable() {
        return groups.isPersistent() && empty.isShallowCloneable();
    }

    @Nullable
    private Group<I> writableGroup(@Nonnull G groupKey) {
        final Group<I> group = groups.get(groupKey);
        if (group == null || group.owner == owner) {
            return group;
        }
        final Group<I> copy = group.copyFor(owner);
        groups.put(groupKey, copy);
        return copy;
    }

    /**
     * The index of one group and the number of records in it.
     * @param <I> inner index type
     */
    protected static final class Group<I extends Index<?>> {
        @Nonnull
        private final I index;
        @Nonnull
        private final Object owner;
        private long count;

        private Group(@Nonnull I index, @Nonnull Object owner) {
            this.index = index;
            this.owner = owner;
        }

        @Nonnull
        private Group<I> copyFor(@Nonnull Object newOwner) {
            final Group<I> copy = new Group<>(Index.copyOf(index), newOwner);
            copy.count = count;
            return copy;
        }
    }
}
