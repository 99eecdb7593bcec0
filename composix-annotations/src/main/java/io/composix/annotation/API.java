/*
 * API.java
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

package io.composix.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * How far code outside of Composix can rely on a public type or member. A member without its own annotation has the
 * status of its enclosing type.
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    Status value();

    /**
     * Statuses in order of increasing stability.
     */
    enum Status {
        /** Public only for use between Composix packages. */
        INTERNAL,
        /** May change or be removed in any release. */
        EXPERIMENTAL,
        /** Kept within a minor release line. */
        UNSTABLE,
        /** Kept within a major release line. */
        STABLE
    }
}
