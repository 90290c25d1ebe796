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

package org.fireflyframework.scheduler.core;

/**
 * What a scan did with one candidate timer.
 */
public enum ScanDecision {

    /**
     * Timer was already due; dispatch launched right away.
     */
    IMMEDIATE,

    /**
     * Lease claimed and a deferred dispatch scheduled in this process.
     */
    DEFERRED,

    /**
     * Another process (or this one) already scheduled the firing.
     */
    SKIPPED,

    /**
     * Lease store error; the timer is retried on the next scan.
     */
    FAILED;

    public String tag() {
        return name().toLowerCase();
    }
}
