/*
 * BooleanArgumentsProvider.java
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

import org.junit.jupiter.api.Named;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.support.AnnotationConsumer;
import org.junit.jupiter.params.support.ParameterDeclarations;

import java.util.stream.Stream;

/**
 * Backs {@link BooleanSource}.
 */
class BooleanArgumentsProvider implements ArgumentsProvider, AnnotationConsumer<BooleanSource> {
    private String name = "";

    @Override
    public void accept(BooleanSource booleanSource) {
        this.name = booleanSource.value();
    }

    @Override
    public Stream<? extends Arguments> provideArguments(final ParameterDeclarations parameterDeclarations,
                                                        final ExtensionContext extensionContext) {
        final boolean named = !name.isBlank();
        return Stream.of(false, true)
                .map(value -> Arguments.of(Named.of(named ? (value ? name : "!" + name) : value.toString(), value)));
    }
}
