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

package com.firefly.stageengine.errors;

/**
 * A router found no satisfied condition and has no default target.
 */
public class NoMatchingBranchException extends StageEngineException {

    private final String routerName;

    public NoMatchingBranchException(String routerName, int branchCount) {
        super("Router '" + routerName + "' found no matching branch among " + branchCount
                + " and no default branch specified");
        this.routerName = routerName;
    }

    public String getRouterName() {
        return routerName;
    }
}
