/*
 * ClojureRuntime.java
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

import clojure.java.api.Clojure;
import io.composix.annotation.API;

/**
 * Loads the Clojure runtime. The persistent map and set classes of {@code clojure.lang} may only be initialized once
 * {@code clojure.core} is loaded, so every class that creates one calls {@link #load()} from its static initializer.
 */
@API(API.Status.INTERNAL)
public final class ClojureRuntime {
    static {
        Clojure.var("clojure.core", "identity");
    }

    private ClojureRuntime() {
    }

    /**
     * Make sure {@code clojure.core} has been loaded. Cheap after the first call.
     */
    public static void load() {
        // loading happens in the static initializer
    }
}
