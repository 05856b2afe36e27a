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

package com.firefly.stageengine.stage;

import com.firefly.stageengine.condition.Condition;
import com.firefly.stageengine.core.Stage;

import java.util.Objects;

/**
 * One routing option: when {@code condition} holds, the input goes to {@code target}.
 */
public record BranchDefinition<I, O>(String name, Condition<? super I> condition, Stage<? super I, ? extends O> target) {

    public BranchDefinition {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(target, "target");
    }

    public static <I, O> BranchDefinition<I, O> of(Condition<? super I> condition, Stage<? super I, ? extends O> target) {
        return new BranchDefinition<>(null, condition, target);
    }

    /** Branch name, falling back to the target's name. */
    public String displayName() {
        return name != null ? name : target.name();
    }
}
