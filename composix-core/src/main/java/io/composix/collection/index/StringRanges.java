/*
 * StringRanges.java
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

import com.google.common.collect.Range;

import javax.annotation.Nonnull;

/**
 * Ranges of strings.
 */
final class StringRanges {
    private StringRanges() {
    }

    /**
     * The smallest range holding exactly the strings that start with a prefix. Strings compare by UTF-16 code
     * unit, so the range ends just before the prefix with its last code unit incremented. Trailing
     * U+FFFF code units cannot be incremented and are dropped first; a prefix made only of them, like the
     * empty prefix, has no upper end.
     *
     * @param prefix the common prefix
     * @return the range of strings with that prefix
     */
    @Nonnull
    static Range<String> startingWith(@Nonnull String prefix) {
        if (prefix.isEmpty()) {
            return Range.all();
        }
        int end = prefix.length();
        while (end > 0 && prefix.charAt(end - 1) == Character.MAX_VALUE) {
            end--;
        }
        if (end == 0) {
            return Range.atLeast(prefix);
        }
        final String upper = prefix.substring(0, end - 1) + (char)(prefix.charAt(end - 1) + 1);
        return Range.closedOpen(prefix, upper);
    }
}
