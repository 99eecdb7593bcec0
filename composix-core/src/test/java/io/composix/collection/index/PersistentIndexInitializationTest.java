/*
 * PersistentIndexInitializationTest.java
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
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Persistent indexes create Clojure maps and sets from their static state, which only works once the Clojure
 * runtime is loaded. These tests make a persistent index the first thing a class loader sees.
 */
public class PersistentIndexInitializationTest {

    @Test
    public void persistentIndexesInFreshClassLoader() throws Exception {
        try (URLClassLoader loader = new URLClassLoader(classPath(), ClassLoader.getPlatformClassLoader())) {
            for (String name : List.of("io.composix.collection.index.BTreeIndex", "io.composix.collection.index.SuffixTreeIndex")) {
                final Class<?> indexClass = Class.forName(name, true, loader);
                final Object index = indexClass.getMethod("persistent").invoke(null);
                assertThat(indexClass.getMethod("isShallowCloneable").invoke(index)).isEqualTo(true);
            }
        }
    }

    @Test
    public void persistentIndexesBeforeAnyCollection() {
        final BTreeIndex<Integer> numbers = BTreeIndex.persistent();
        final SuffixTreeIndex words = SuffixTreeIndex.persistent();
        final Collection<Integer, BTreeIndex<Integer>> numberCollection = Collection.create(numbers);
        final Collection<String, SuffixTreeIndex> wordCollection = Collection.create(words);
        numberCollection.insertAll(List.of(3, 1, 2));
        wordCollection.insertAll(List.of("banana", "bandana"));
        assertThat(numberCollection.queryAll(ix -> ix.rangeFrom(2))).containsExactly(2, 3);
        assertThat(wordCollection.queryAll(ix -> ix.containsGetAll("ana"))).containsExactlyInAnyOrder("banana", "bandana");
    }

    private static URL[] classPath() throws MalformedURLException {
        final String[] entries = System.getProperty("java.class.path").split(File.pathSeparator);
        final URL[] urls = new URL[entries.length];
        for (int i = 0; i < entries.length; i++) {
            urls[i] = Paths.get(entries[i]).toUri().toURL();
        }
        return urls;
    }
}
