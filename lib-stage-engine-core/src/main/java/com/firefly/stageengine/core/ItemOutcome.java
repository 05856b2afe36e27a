/*
 * Copyright 2025 Firefly Software Solutions Inc
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

package com.firefly.stageengine.core;

import java.util.Optional;

/**
 * Result of one item of a settled batch: either a value (possibly {@code null} for an
 * absent result) or the error that item failed with.
 */
public record ItemOutcome<T>(int index, T value, Throwable error) {

    public static <T> ItemOutcome<T> success(int index, T value) {
        return new ItemOutcome<>(index, value, null);
    }

    public static <T> ItemOutcome<T> failure(int index, Throwable error) {
        return new ItemOutcome<>(index, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> valueOptional() {
        return Optional.ofNullable(value);
    }
}
