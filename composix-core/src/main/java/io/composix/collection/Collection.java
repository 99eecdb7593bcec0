/*
 * Collection.java
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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import io.composix.annotation.API;
import io.composix.collection.index.Index;
import io.composix.collection.index.Insert;
import io.composix.collection.index.Remove;
import io.composix.collection.index.Update;
import io.composix.collection.logging.KeyValueLogMessage;
import io.composix.collection.logging.LogMessageKeys;
import io.composix.collection.query.DistinctQueryResult;
import io.composix.collection.query.QueryResult;
import io.composix.collection.query.Resolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.Spliterator;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A set of records with a secondary index that is kept up to date on every change.
 *
 * <p>
 * Every record gets a {@link Key} when it is inserted. The collection passes every insertion, update and removal to
 * its index, which is usually a tree of combinators built for the queries the application needs:
 * </p>
 *
 * <pre>{@code
 * Collection<Session, Zip2<Session, ...>> sessions = Collection.create(Zip.of(
 *         PremapIndex.of(Session::getId, HashTableIndex.create()),
 *         PremapIndex.of(Session::getExpiresAt, BTreeIndex.create())));
 * sessions.insert(session);
 * Optional<Session> found = sessions.queryOne(ix -> ix.first().inner().getOne("abc"));
 * int expired = sessions.delete(ix -> ix.second().inner().rangeTo(now));
 * }</pre>
 *
 * <p>
 * The index is told about an insertion after the record is stored, and about an update or a removal before the
 * stored record is replaced or dropped, so an index always sees the record as it was stored. Indexes cannot be
 * changed from outside, because their mutating methods need a {@link Seal} that only the collection holds.
 * </p>
 *
 * <p>
 * Records must not be {@code null}, and must not change in ways that matter to the index except through
 * {@link #updateByKey}, {@link #adjustByKey}, {@link #adjustByKeyMut} and the other mutating methods here.
 * A collection is not thread safe.
 * </p>
 *
 * <p>
 * Copies made with {@link #copy()} or {@link #shallowClone()} share their records. Once a collection has been
 * copied, {@link #adjustByKeyMut} and {@link #updateByKeyMut} hand out a copy of the record made by the
 * {@linkplain #setRecordCopier record copier} instead of the stored record, so changing it in place does not
 * reach the other collection. Without a record copier they are rejected on a copied collection.
 * </p>
 *
 * @param <T> record type
 * @param <I> index type
 */
@API(API.Status.STABLE)
public class Collection<T, I extends Index<T>> {
    /**
     * The default configuration: a {@link StoreType#HASH} store, keys starting at zero and no mutation tracing.
     */
    public static final Config DEFAULT_CONFIG = new Config();

    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(Collection.class);

    @Nonnull
    private final Config config;
    @Nonnull
    private final Store<T> store;
    @Nonnull
    private final I index;
    private long nextKeyId;
    @Nullable
    private UnaryOperator<T> recordCopier;
    private boolean recordsShared;

    protected Collection(@Nonnull Config config, @Nonnull Store<T> store, @Nonnull I index, long nextKeyId) {
        this.config = config;
        this.store = store;
        this.index = index;
        this.nextKeyId = nextKeyId;
    }

    /**
     * Create an empty collection with the default configuration.
     * @param index a new, empty index
     * @param <T> record type
     * @param <I> index type
     * @return the collection
     */
    @Nonnull
    public static <T, I extends Index<T>> Collection<T, I> create(@Nonnull I index) {
        return create(index, DEFAULT_CONFIG);
    }

    @Nonnull
    public static <T, I extends Index<T>> Collection<T, I> create(@Nonnull I index, @Nonnull Config config) {
        return withStore(config.getStoreType().newStore(), index, config);
    }

    /**
     * Create a collection over a custom store.
     * @param store an empty store
     * @param index a new, empty index
     * @param config the configuration; its store type is ignored
     * @param <T> record type
     * @param <I> index type
     * @return the collection
     */
    @Nonnull
    public static <T, I extends Index<T>> Collection<T, I> withStore(@Nonnull Store<T> store, @Nonnull I index,
                                                                     @Nonnull Config config) {
        Preconditions.checkArgument(store.isEmpty(), "store must be empty");
        final Collection<T, I> collection = new Collection<>(config, store, index, config.getFirstKeyId());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("created collection",
                    LogMessageKeys.STORE_TYPE, store.getType(),
                    LogMessageKeys.INDEX_TYPE, index.getClass().getSimpleName(),
                    LogMessageKeys.FIRST_KEY, config.getFirstKeyId(),
                    LogMessageKeys.SHALLOW_CLONEABLE, collection.isShallowCloneable()));
        }
        return collection;
    }

    /**
     * Set the function that copies a record before it is changed in place on a collection that shares its records
     * with a copy. Copies of this collection inherit it.
     * @param recordCopier returns a record equal to its argument that shares no mutable state with it
     * @return this collection
     */
    @Nonnull
    public Collection<T, I> setRecordCopier(@Nullable UnaryOperator<T> recordCopier) {
        this.recordCopier = recordCopier;
        return this;
    }

    @Nonnull
    public Config getConfig() {
        return config;
    }

    // ----- mutation -----

    /**
     * Add a record under a new key.
     * @param record the record
     * @return the key of the record
     */
    @Nonnull
    public Key insert(@Nonnull T record) {
        Preconditions.checkNotNull(record, "record must not be null");
        final Key key = nextKey();
        store.put(key, record);
        index.insert(Seal.INSTANCE, new Insert<>(key, record));
        trace("insert", key);
        return key;
    }

    /**
     * Add several records, each under a new key.
     * @param records the records
     * @return the keys of the records, in order
     */
    @Nonnull
    public List<Key> insertAll(@Nonnull Iterable<? extends T> records) {
        final ImmutableList.Builder<Key> keys = ImmutableList.builder();
        for (T record : records) {
            keys.add(insert(record));
        }
        return keys.build();
    }

    /**
     * Replace the record under a key with one computed from the current record, or store a computed record under the
     * key if there is none.
     * @param key a key issued by this collection
     * @param function computes the new record from the current one, if any
     */
    public void updateByKey(@Nonnull Key key, @Nonnull Function<Optional<T>, ? extends T> function) {
        checkIssued(key);
        final T existing = store.get(key);
        final T record = Preconditions.checkNotNull(function.apply(Optional.ofNullable(existing)), "record must not be null");
        if (existing == null) {
            store.put(key, record);
            index.insert(Seal.INSTANCE, new Insert<>(key, record));
            trace("insert", key);
        } else {
            index.update(Seal.INSTANCE, new Update<>(key, record, existing));
            store.put(key, record);
            trace("update", key);
        }
    }

    /**
     * Run a function that may change, replace, create or drop the record under a key. The current record is taken out
     * of the index before the function runs, so the function may mutate it in place. If the function throws, the
     * record is put back into the index as it is stored.
     * @param key a key issued by this collection
     * @param function given the current record, if any, returns the record to keep, if any
     * @throws CollectionArgumentException if there is a record, this collection shares its records with a copy and
     * no record copier is set
     */
    public void updateByKeyMut(@Nonnull Key key, @Nonnull Function<Optional<T>, Optional<? extends T>> function) {
        checkIssued(key);
        final T existing = store.get(key);
        final T target = existing == null ? null : writable(key, existing);
        if (existing != null) {
            index.remove(Seal.INSTANCE, new Remove<>(key, existing));
        }
        final Optional<? extends T> result;
        try {
            result = function.apply(Optional.ofNullable(target));
        } catch (RuntimeException | Error e) {
            if (existing != null) {
                reindex(key, existing);
            }
            throw e;
        }
        if (result.isPresent()) {
            final T record = result.get();
            store.put(key, record);
            index.insert(Seal.INSTANCE, new Insert<>(key, record));
            trace(existing == null ? "insert" : "update", key);
        } else if (existing != null) {
            store.remove(key);
            trace("delete", key);
        }
    }

    /**
     * Replace the record under a key with one computed from it. Does nothing if there is no such record.
     * @param key the key
     * @param function computes the new record
     * @return {@code true} if there was a record to replace
     */
    public boolean adjustByKey(@Nonnull Key key, @Nonnull UnaryOperator<T> function) {
        final T existing = store.get(key);
        if (existing == null) {
            return false;
        }
        final T record = Preconditions.checkNotNull(function.apply(existing), "record must not be null");
        index.update(Seal.INSTANCE, new Update<>(key, record, existing));
        store.put(key, record);
        trace("update", key);
        return true;
    }

    /**
     * Change the record under a key in place. Does nothing if there is no such record. The record is taken out of
     * the index before the change and put back after it, also when the change throws.
     * @param key the key
     * @param mutation changes the record
     * @return {@code true} if there was a record to change
     * @throws CollectionArgumentException if this collection shares its records with a copy and no record copier
     * is set
     */
    public boolean adjustByKeyMut(@Nonnull Key key, @Nonnull Consumer<? super T> mutation) {
        final T existing = store.get(key);
        if (existing == null) {
            return false;
        }
        final T target = writable(key, existing);
        index.remove(Seal.INSTANCE, new Remove<>(key, existing));
        try {
            mutation.accept(target);
        } catch (RuntimeException | Error e) {
            reindex(key, existing);
            throw e;
        }
        store.put(key, target);
        index.insert(Seal.INSTANCE, new Insert<>(key, target));
        trace("update", key);
        return true;
    }

    /**
     * Remove the record under a key.
     * @param key the key
     * @return the removed record, or empty if there was none
     */
    @Nonnull
    public Optional<T> deleteByKey(@Nonnull Key key) {
        final T existing = store.get(key);
        if (existing == null) {
            return Optional.empty();
        }
        index.remove(Seal.INSTANCE, new Remove<>(key, existing));
        store.remove(key);
        trace("delete", key);
        return Optional.of(existing);
    }

    // ----- queries -----

    /**
     * Look up a record by key.
     * @param key the key
     * @return the record, or empty if there is none
     */
    @Nonnull
    public Optional<T> get(@Nonnull Key key) {
        return Optional.ofNullable(store.get(key));
    }

    public boolean containsKey(@Nonnull Key key) {
        return store.containsKey(key);
    }

    /**
     * Ask the index a question whose answer is not made of keys, such as an aggregate.
     * @param query asks the index
     * @param <R> answer type
     * @return the answer
     */
    public <R> R queryValue(@Nonnull Function<? super I, R> query) {
        return query.apply(index);
    }

    /**
     * Look up at most one record through the index.
     * @param query asks the index for a key
     * @return the record, or empty if the index found none
     */
    @Nonnull
    public Optional<T> queryOne(@Nonnull Function<? super I, Optional<Key>> query) {
        return query.apply(index).map(store::getExisting);
    }

    /**
     * Look up records through the index.
     * @param query asks the index for keys
     * @return the records, in the order of the keys, repeats included
     */
    @Nonnull
    public List<T> queryAll(@Nonnull Function<? super I, ? extends QueryResult> query) {
        return resolver().getAll(query.apply(index));
    }

    /**
     * Ask the index a question and resolve any keys in the answer, keeping the shape of the answer.
     * @param query asks the index and resolves keys with the given resolver
     * @param <R> answer type
     * @return the answer
     */
    public <R> R query(@Nonnull BiFunction<? super I, Resolver<T>, R> query) {
        return query.apply(index, resolver());
    }

    @Nonnull
    public List<Key> queryKeys(@Nonnull Function<? super I, ? extends QueryResult> query) {
        return query.apply(index).keys();
    }

    @Nonnull
    public List<Map.Entry<Key, T>> queryWithKeys(@Nonnull Function<? super I, ? extends QueryResult> query) {
        return resolver().getWithKeys(query.apply(index));
    }

    // ----- query, then mutate -----

    /**
     * Remove every record found by a query. Keys found more than once are removed once.
     * @param query asks the index for keys
     * @return the number of records removed
     */
    public int delete(@Nonnull Function<? super I, ? extends QueryResult> query) {
        int deleted = 0;
        for (Key key : distinctKeys(query.apply(index))) {
            if (deleteByKey(key).isPresent()) {
                deleted++;
            }
        }
        traceBulk("delete", LogMessageKeys.DELETED_COUNT, deleted);
        return deleted;
    }

    /**
     * Replace every record found by a query with one computed from it.
     * @param query asks the index for distinct keys
     * @param function computes each new record
     * @return the number of records replaced
     */
    public int update(@Nonnull Function<? super I, ? extends DistinctQueryResult> query, @Nonnull UnaryOperator<T> function) {
        int updated = 0;
        for (Key key : query.apply(index).keys()) {
            if (adjustByKey(key, function)) {
                updated++;
            }
        }
        traceBulk("update", LogMessageKeys.UPDATED_COUNT, updated);
        return updated;
    }

    /**
     * Remove and return every record found by a query.
     * @param query asks the index for distinct keys
     * @return the removed records, in the order of the keys
     */
    @Nonnull
    public List<T> take(@Nonnull Function<? super I, ? extends DistinctQueryResult> query) {
        final ImmutableList.Builder<T> taken = ImmutableList.builder();
        for (Key key : query.apply(index).keys()) {
            deleteByKey(key).ifPresent(taken::add);
        }
        return taken.build();
    }

    // ----- size and iteration -----

    public int size() {
        return store.size();
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    public void forEach(@Nonnull BiConsumer<? super Key, ? super T> action) {
        store.forEach(action);
    }

    /**
     * Iterate over the keys and records. The order depends on the {@link StoreType}.
     * @return the entries of the collection
     */
    @Nonnull
    public Iterable<Map.Entry<Key, T>> entries() {
        return store;
    }

    @Nonnull
    public Stream<T> values() {
        return StreamSupport.stream(store.spliterator(), false).map(Map.Entry::getValue);
    }

    @Nonnull
    public Stream<Key> keys() {
        return StreamSupport.stream(store.spliterator(), false).map(Map.Entry::getKey);
    }

    // ----- copies -----

    /**
     * Create an independent copy of this collection. Records are shared between the copies; from now on both
     * copy a record before changing it in place.
     * @return the copy
     */
    @Nonnull
    public Collection<T, I> copy() {
        final Collection<T, I> copy = new Collection<>(config, store.copy(), Index.copyOf(index), nextKeyId);
        copy.recordCopier = recordCopier;
        copy.recordsShared = true;
        recordsShared = true;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("copied collection",
                    LogMessageKeys.RECORD_COUNT, size(),
                    LogMessageKeys.SHALLOW_CLONEABLE, isShallowCloneable()));
        }
        return copy;
    }

    /**
     * Create a copy that shares structure with this collection, in constant or amortized constant time.
     * @return the copy
     * @throws CollectionArgumentException if the store or the index does not support cheap copies
     * @see ShallowClone
     */
    @Nonnull
    public Collection<T, I> shallowClone() {
        if (!isShallowCloneable()) {
            throw new CollectionArgumentException("collection cannot be shallow cloned",
                    LogMessageKeys.STORE_TYPE, store.getType(),
                    LogMessageKeys.INDEX_TYPE, index.getClass().getSimpleName());
        }
        return copy();
    }

    public boolean isShallowCloneable() {
        return store.isShallowCloneable() && index.isShallowCloneable();
    }

    @VisibleForTesting
    long getNextKeyId() {
        return nextKeyId;
    }

    @Nonnull
    private Key nextKey() {
        if (nextKeyId == Long.MAX_VALUE) {
            throw new CollectionCoreException("key space exhausted", LogMessageKeys.NEXT_KEY, nextKeyId);
        }
        return Key.unsafeOf(nextKeyId++);
    }

    @Nonnull
    private T writable(@Nonnull Key key, @Nonnull T existing) {
        if (!recordsShared) {
            return existing;
        }
        if (recordCopier == null) {
            throw new CollectionArgumentException("records are shared with a copy and no record copier is set",
                    LogMessageKeys.KEY, key.getId());
        }
        return Preconditions.checkNotNull(recordCopier.apply(existing), "copied record must not be null");
    }

    // puts back a record that was taken out of the index for a change that failed
    private void reindex(@Nonnull Key key, @Nonnull T existing) {
        index.insert(Seal.INSTANCE, new Insert<>(key, existing));
    }

    private void checkIssued(@Nonnull Key key) {
        if (key.getId() < config.getFirstKeyId() || key.getId() >= nextKeyId) {
            throw new CollectionArgumentException("key was not issued by this collection",
                    LogMessageKeys.KEY, key.getId(),
                    LogMessageKeys.NEXT_KEY, nextKeyId);
        }
    }

    @Nonnull
    private Set<Key> distinctKeys(@Nonnull QueryResult result) {
        final Set<Key> keys = new LinkedHashSet<>();
        result.forEachKey(keys::add);
        return keys;
    }

    @Nonnull
    private Resolver<T> resolver() {
        return store::getExisting;
    }

    private void trace(@Nonnull String operation, @Nonnull Key key) {
        if (config.isTraceMutations() && LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("collection mutation",
                    LogMessageKeys.OPERATION, operation,
                    LogMessageKeys.KEY, key.getId(),
                    LogMessageKeys.RECORD_COUNT, store.size()));
        }
    }

    private void traceBulk(@Nonnull String operation, @Nonnull LogMessageKeys countKey, int count) {
        if (config.isTraceMutations() && LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("collection bulk mutation",
                    LogMessageKeys.OPERATION, operation,
                    countKey, count,
                    LogMessageKeys.RECORD_COUNT, store.size()));
        }
    }

    /**
     * Start building a {@link Config}.
     * @return a builder starting from the default configuration
     * @see ConfigBuilder#build
     */
    @Nonnull
    public static ConfigBuilder newConfigBuilder() {
        return new ConfigBuilder();
    }

    /**
     * Configuration settings for a {@link Collection}.
     */
    public static class Config {
        /** Property naming the {@link StoreType}. */
        public static final String STORE_TYPE_PROPERTY = "composix.store.type";
        /** Property giving the first key identifier. */
        public static final String FIRST_KEY_PROPERTY = "composix.key.first";
        /** Property turning mutation tracing on. */
        public static final String TRACE_MUTATIONS_PROPERTY = "composix.trace.mutations";

        @Nonnull
        private final StoreType storeType;
        private final long firstKeyId;
        private final boolean traceMutations;

        protected Config() {
            this(StoreType.HASH, 0L, false);
        }

        protected Config(@Nonnull StoreType storeType, long firstKeyId, boolean traceMutations) {
            this.storeType = storeType;
            this.firstKeyId = firstKeyId;
            this.traceMutations = traceMutations;
        }

        /**
         * Read a configuration from properties. Missing properties keep their default values.
         * @param properties the properties
         * @return the configuration
         * @throws CollectionArgumentException if a property has an invalid value
         */
        @Nonnull
        public static Config fromProperties(@Nonnull Properties properties) {
            final ConfigBuilder builder = newConfigBuilder();
            final String storeType = properties.getProperty(STORE_TYPE_PROPERTY);
            if (storeType != null) {
                try {
                    builder.setStoreType(StoreType.valueOf(storeType.trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw invalidProperty(STORE_TYPE_PROPERTY, storeType);
                }
            }
            final String firstKey = properties.getProperty(FIRST_KEY_PROPERTY);
            if (firstKey != null) {
                try {
                    builder.setFirstKeyId(Long.parseLong(firstKey.trim()));
                } catch (NumberFormatException e) {
                    throw invalidProperty(FIRST_KEY_PROPERTY, firstKey);
                }
            }
            final String traceMutations = properties.getProperty(TRACE_MUTATIONS_PROPERTY);
            if (traceMutations != null) {
                builder.setTraceMutations(Boolean.parseBoolean(traceMutations.trim()));
            }
            return builder.build();
        }

        @Nonnull
        public static Config fromSystemProperties() {
            return fromProperties(System.getProperties());
        }

        @Nonnull
        private static CollectionArgumentException invalidProperty(@Nonnull String name, @Nullable String value) {
            return new CollectionArgumentException("invalid collection property",
                    LogMessageKeys.PROPERTY_NAME, name,
                    LogMessageKeys.PROPERTY_VALUE, value);
        }

        /**
         * Get the kind of store new collections use.
         * @return the store type
         */
        @Nonnull
        public StoreType getStoreType() {
            return storeType;
        }

        /**
         * Get the identifier of the first key a new collection issues.
         * @return the first key identifier
         */
        public long getFirstKeyId() {
            return firstKeyId;
        }

        /**
         * Get whether every mutation is logged at debug level.
         * @return {@code true} if mutations are traced
         */
        public boolean isTraceMutations() {
            return traceMutations;
        }

        @Nonnull
        public ConfigBuilder toBuilder() {
            return new ConfigBuilder(storeType, firstKeyId, traceMutations);
        }

        @Override
        public String toString() {
            return "Config{storeType=" + storeType + ", firstKeyId=" + firstKeyId + ", traceMutations=" + traceMutations + "}";
        }
    }

    /**
     * Builder for {@link Config}.
     *
     * @see #newConfigBuilder
     */
    public static class ConfigBuilder {
        @Nonnull
        private StoreType storeType = StoreType.HASH;
        private long firstKeyId = 0L;
        private boolean traceMutations = false;

        protected ConfigBuilder() {
        }

        protected ConfigBuilder(@Nonnull StoreType storeType, long firstKeyId, boolean traceMutations) {
            this.storeType = storeType;
            this.firstKeyId = firstKeyId;
            this.traceMutations = traceMutations;
        }

        @Nonnull
        public StoreType getStoreType() {
            return storeType;
        }

        /**
         * Set the kind of store to use. Use {@link StoreType#PERSISTENT} together with persistent indexes to allow
         * {@link Collection#shallowClone()}.
         * @param storeType the store type
         * @return this builder
         */
        @Nonnull
        public ConfigBuilder setStoreType(@Nonnull StoreType storeType) {
            this.storeType = storeType;
            return this;
        }

        public long getFirstKeyId() {
            return firstKeyId;
        }

        /**
         * Set the identifier of the first key.
         * @param firstKeyId a non-negative identifier
         * @return this builder
         */
        @Nonnull
        public ConfigBuilder setFirstKeyId(long firstKeyId) {
            if (firstKeyId < 0L) {
                throw new CollectionArgumentException("first key identifier must not be negative",
                        LogMessageKeys.FIRST_KEY, firstKeyId);
            }
            this.firstKeyId = firstKeyId;
            return this;
        }

        public boolean isTraceMutations() {
            return traceMutations;
        }

        @Nonnull
        public ConfigBuilder setTraceMutations(boolean traceMutations) {
            this.traceMutations = traceMutations;
            return this;
        }

        @Nonnull
        public Config build() {
            return new Config(storeType, firstKeyId, traceMutations);
        }
    }
}
