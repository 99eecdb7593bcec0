/*
 * RandomSeedProvider.java
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

package io.composix.test;

import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.support.AnnotationConsumer;
import org.junit.jupiter.params.support.ParameterDeclarations;

import java.security.SecureRandom;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Backs {@link RandomSeedSource}.
 */
class RandomSeedProvider implements ArgumentsProvider, AnnotationConsumer<RandomSeedSource> {
    static final String ITERATIONS_PROPERTY = "tests.iterations";
    static final String SEED_PROPERTY = "tests.seed";

    private long[] fixedSeeds;

    @Override
    public void accept(final RandomSeedSource annotation) {
        this.fixedSeeds = annotation.value();
    }

    @Override
    public Stream<? extends Arguments> provideArguments(final ParameterDeclarations parameterDeclarations,
                                                        final ExtensionContext extensionContext) {
        return seeds().mapToObj(Arguments::of);
    }

    LongStream seeds() {
        final String replay = System.getProperty(SEED_PROPERTY);
        if (replay != null && !replay.isBlank()) {
            return LongStream.of(Long.decode(replay.trim()));
        }
        final int iterations = Integer.getInteger(ITERATIONS_PROPERTY, 0);
        if (iterations < 0) {
            throw new IllegalArgumentException(ITERATIONS_PROPERTY + " must not be negative: " + iterations);
        }
        final SecureRandom random = new SecureRandom();
        return LongStream.concat(LongStream.of(fixedSeeds), LongStream.generate(random::nextLong).limit(iterations));
    }
}
