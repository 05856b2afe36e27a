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
import com.firefly.stageengine.condition.ConditionEvaluator;
import com.firefly.stageengine.condition.PathResolver;
import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import com.firefly.stageengine.errors.NoMatchingBranchException;
import com.firefly.stageengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sends each input to the first branch whose condition holds.
 * <p>
 * Conditions are evaluated one at a time in registration order. When none holds the default
 * target is used; without a default the invocation fails with {@link NoMatchingBranchException}.
 * A condition that errors counts as not matched.
 */
public final class Router<I, O> implements Stage<I, O> {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final String name;
    private final List<BranchDefinition<I, O>> branches;
    private final Stage<? super I, ? extends O> defaultTarget;

    private Router(String name, List<BranchDefinition<I, O>> branches, Stage<? super I, ? extends O> defaultTarget) {
        this.name = name != null && !name.isBlank() ? name : "router";
        this.branches = List.copyOf(Objects.requireNonNull(branches, "branches"));
        this.defaultTarget = defaultTarget;
    }

    public static <I, O> Router<I, O> empty() {
        return new Router<>(null, List.of(), null);
    }

    /**
     * Router over {@code branches} in the given order. Unnamed branches are named
     * {@code branch_<index>}.
     */
    public static <I, O> Router<I, O> create(List<BranchDefinition<I, O>> branches,
                                             Stage<? super I, ? extends O> defaultTarget) {
        List<BranchDefinition<I, O>> defs = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            BranchDefinition<I, O> b = branches.get(i);
            defs.add(b.name() != null ? b : new BranchDefinition<>("branch_" + i, b.condition(), b.target()));
        }
        return new Router<>(null, defs, defaultTarget);
    }

    /**
     * Switch on the value at {@code path}: the case whose key equals the value's string form
     * wins. Branches are named {@code case_<value>}.
     */
    public static <I, O> Router<I, O> switchOn(String path,
                                               Map<String, ? extends Stage<? super I, ? extends O>> cases,
                                               Stage<? super I, ? extends O> defaultTarget) {
        List<BranchDefinition<I, O>> defs = new ArrayList<>();
        cases.forEach((value, target) -> {
            Condition<I> matches = input -> Mono.fromCallable(() -> {
                Object resolved = PathResolver.resolve(input, path);
                return resolved != null && String.valueOf(resolved).equals(value);
            });
            defs.add(new BranchDefinition<>("case_" + value, matches, target));
        });
        return new Router<>("switch(" + path + ")", defs, defaultTarget);
    }

    public Router<I, O> addBranch(Condition<? super I> condition, Stage<? super I, ? extends O> target) {
        return addBranch(null, condition, target);
    }

    /** Copy of this router with one more branch at the end. */
    public Router<I, O> addBranch(String branchName, Condition<? super I> condition, Stage<? super I, ? extends O> target) {
        List<BranchDefinition<I, O>> copy = new ArrayList<>(branches);
        copy.add(new BranchDefinition<>(branchName, condition, target));
        return new Router<>(name, copy, defaultTarget);
    }

    /** Copy of this router with {@code target} as the fallback. */
    public Router<I, O> withDefault(Stage<? super I, ? extends O> target) {
        return new Router<>(name, branches, target);
    }

    public Router<I, O> named(String newName) {
        return new Router<>(newName, branches, defaultTarget);
    }

    public List<BranchDefinition<I, O>> branches() {
        return branches;
    }

    public Optional<Stage<? super I, ? extends O>> defaultTarget() {
        return Optional.ofNullable(defaultTarget);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<O> invoke(I input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        return select(input, cfg).flatMap(branch -> {
            @SuppressWarnings("unchecked")
            Stage<I, O> target = (Stage<I, O>) branch.target();
            return target.invoke(input, cfg);
        });
    }

    /** Streams the selected target's output. */
    @Override
    public Flux<O> stream(I input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        return select(input, cfg).flatMapMany(branch -> {
            @SuppressWarnings("unchecked")
            Stage<I, O> target = (Stage<I, O>) branch.target();
            return target.stream(input, cfg);
        });
    }

    private Mono<BranchDefinition<I, O>> select(I input, StageConfig cfg) {
        return Flux.fromIterable(branches)
                .concatMap(b -> ConditionEvaluator.evaluate(input, b.condition())
                        .filter(Boolean::booleanValue)
                        .map(ok -> b))
                .next()
                .switchIfEmpty(Mono.defer(() -> {
                    if (defaultTarget == null) {
                        return Mono.error(new NoMatchingBranchException(name, branches.size()));
                    }
                    return Mono.just(new BranchDefinition<I, O>("default", Condition.always(), defaultTarget));
                }))
                .doOnNext(b -> {
                    cfg.events().onBranchSelected(name, cfg.runId(), b.displayName());
                    if (log.isDebugEnabled()) {
                        log.debug(JsonUtils.json(
                                "stage_event", "route",
                                "stage", name,
                                "runId", cfg.runId(),
                                "branch", b.displayName(),
                                "input_preview", JsonUtils.summarize(input, 200)
                        ));
                    }
                });
    }

    @Override
    public String toString() {
        return "Router[" + name + ", branches=" + branches.size() + ", default=" + (defaultTarget != null) + "]";
    }
}
