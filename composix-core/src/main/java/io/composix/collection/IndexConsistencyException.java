/*
 * IndexConsistencyException.java
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

import io.composix.annotation.API;
import io.composix.collection.logging.KeyValueLogMessage;
import io.composix.collection.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Thrown when an index and the record store disagree, for example when an index answers a query with a key the store
 * does not hold, or is asked to forget a value it never saw.
 *
 * <p>
 * This always indicates a bug (in Composix, in a custom index, or in a key or value with unstable
 * {@code equals}/{@code hashCode}/{@code compareTo}). The collection cannot be trusted afterwards, so this exception is
 * not meant to be caught and handled.
 * </p>
 */
@API(API.Status.STABLE)
public class IndexConsistencyException extends CollectionCoreException {
    private static final long serialVersionUID = 1;
    private static final Logger LOGGER = LoggerFactory.getLogger(IndexConsistencyException.class);

    public IndexConsistencyException(@Nonnull String msg, @Nonnull Object... keyValues) {
        super(msg, keyValues);
    }

    /**
     * Create the exception for a key that an index knows about but the store does not hold.
     * The problem is logged at error level before the exception is returned.
     *
     * @param key the key that could not be resolved
     * @return an exception to throw
     */
    @Nonnull
    public static IndexConsistencyException missingRecord(@Nonnull Key key) {
        final IndexConsistencyException e = new IndexConsistencyException("index returned a key that is not in the store",
                LogMessageKeys.KEY, key.getId());
        if (LOGGER.isErrorEnabled()) {
            LOGGER.error(KeyValueLogMessage.of(e.getMessage(), e.exportLogInfo()));
        }
        return e;
    }

    /**
     * Create the exception for an index asked to remove something it does not hold.
     * The problem is logged at error level before the exception is returned.
     *
     * @param index the index that detected the problem
     * @param key the key being removed
     * @return an exception to throw
     */
    @Nonnull
    public static IndexConsistencyException unknownRemoval(@Nonnull Object index, @Nonnull Key key) {
        final IndexConsistencyException e = new IndexConsistencyException("index asked to remove an entry it does not hold",
                LogMessageKeys.INDEX_TYPE, index.getClass().getSimpleName(),
                LogMessageKeys.KEY, key.getId());
        if (LOGGER.isErrorEnabled()) {
            LOGGER.error(KeyValueLogMessage.of(e.getMessage(), e.exportLogInfo()));
        }
        return e;
    }
}
