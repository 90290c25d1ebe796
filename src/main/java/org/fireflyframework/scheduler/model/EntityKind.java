/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.scheduler.model;

/**
 * The three entity dimensions a timer can be scoped to.
 */
public enum EntityKind {

    PAGE("page"),
    PROFILE("profile"),
    ENVIRONMENT("environment");

    private final String tableName;

    EntityKind(String tableName) {
        this.tableName = tableName;
    }

    /**
     * Name of the table holding entities of this kind.
     */
    public String tableName() {
        return tableName;
    }
}
