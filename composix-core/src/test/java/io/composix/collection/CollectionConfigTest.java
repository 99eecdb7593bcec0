/*
 * CollectionConfigTest.java
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

import io.composix.collection.index.KeysIndex;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Collection.Config} and {@link Collection.ConfigBuilder}.
 */
public class CollectionConfigTest {

    @Test
    public void defaults() {
        final Collection.Config config = Collection.DEFAULT_CONFIG;
        assertThat(config.getStoreType()).isEqualTo(StoreType.HASH);
        assertThat(config.getFirstKeyId()).isZero();
        assertThat(config.isTraceMutations()).isFalse();
        assertThat(Collection.create(KeysIndex.create()).getConfig()).isSameAs(Collection.DEFAULT_CONFIG);
    }

    @Test
    public void builderRoundTrip() {
        final Collection.Config config = Collection.newConfigBuilder()
                .setStoreType(StoreType.ORDERED)
                .setFirstKeyId(7L)
                .setTraceMutations(true)
                .build();
        assertThat(config.getStoreType()).isEqualTo(StoreType.ORDERED);
        assertThat(config.getFirstKeyId()).isEqualTo(7L);
        assertThat(config.isTraceMutations()).isTrue();

        final Collection.Config changed = config.toBuilder().setStoreType(StoreType.PERSISTENT).build();
        assertThat(changed.getStoreType()).isEqualTo(StoreType.PERSISTENT);
        assertThat(changed.getFirstKeyId()).isEqualTo(7L);
        assertThat(changed.isTraceMutations()).isTrue();
        assertThat(config.getStoreType()).isEqualTo(StoreType.ORDERED);
    }

    @Test
    public void negativeFirstKeyIsRejected() {
        assertThatThrownBy(() -> Collection.newConfigBuilder().setFirstKeyId(-1L))
                .isInstanceOf(CollectionArgumentException.class)
                .hasMessageContaining("first key");
    }

    @Test
    public void fromProperties() {
        final Properties properties = new Properties();
        properties.setProperty(Collection.Config.STORE_TYPE_PROPERTY, " persistent ");
        properties.setProperty(Collection.Config.FIRST_KEY_PROPERTY, "100");
        properties.setProperty(Collection.Config.TRACE_MUTATIONS_PROPERTY, "true");
        final Collection.Config config = Collection.Config.fromProperties(properties);
        assertThat(config.getStoreType()).isEqualTo(StoreType.PERSISTENT);
        assertThat(config.getFirstKeyId()).isEqualTo(100L);
        assertThat(config.isTraceMutations()).isTrue();

        final Collection<String, KeysIndex<String>> collection = Collection.create(KeysIndex.persistent(), config);
        assertThat(collection.insert("x").getId()).isEqualTo(100L);
        assertThat(collection.isShallowCloneable()).isTrue();
    }

    @Test
    public void missingPropertiesKeepDefaults() {
        final Collection.Config config = Collection.Config.fromProperties(new Properties());
        assertThat(config.getStoreType()).isEqualTo(StoreType.HASH);
        assertThat(config.getFirstKeyId()).isZero();
        assertThat(config.isTraceMutations()).isFalse();
    }

    @Test
    public void invalidProperties() {
        final Properties badStore = new Properties();
        badStore.setProperty(Collection.Config.STORE_TYPE_PROPERTY, "skiplist");
        assertThatThrownBy(() -> Collection.Config.fromProperties(badStore))
                .isInstanceOf(CollectionArgumentException.class)
                .satisfies(e -> assertThat(((CollectionArgumentException)e).getLogInfo())
                        .containsEntry("property_name", Collection.Config.STORE_TYPE_PROPERTY)
                        .containsEntry("property_value", "skiplist"));

        final Properties badKey = new Properties();
        badKey.setProperty(Collection.Config.FIRST_KEY_PROPERTY, "ten");
        assertThatThrownBy(() -> Collection.Config.fromProperties(badKey))
                .isInstanceOf(CollectionArgumentException.class);

        final Properties negativeKey = new Properties();
        negativeKey.setProperty(Collection.Config.FIRST_KEY_PROPERTY, "-5");
        assertThatThrownBy(() -> Collection.Config.fromProperties(negativeKey))
                .isInstanceOf(CollectionArgumentException.class);
    }
}
