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

import java.util.Collection;

/**
 * Summary of one scan cycle.
 *
 * @param candidates timers returned by the due query
 * @param immediate  dispatches launched right away
 * @param deferred   dispatches scheduled for later in this process
 * @param skipped    timers already claimed
 * @param failed     timers abandoned because of lease store errors
 */
public record ScanReport(int candidates, int immediate, int deferred, int skipped, int failed) {

    public static ScanReport of(Collection<ScanDecision> decisions) {
        int immediate = 0;
        int deferred = 0;
        int skipped = 0;
        int failed = 0;
        for (ScanDecision decision : decisions) {
            switch (decision) {
                case IMMEDIATE -> immediate++;
                case DEFERRED -> deferred++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        return new ScanReport(decisions.size(), immediate, deferred, skipped, failed);
    }
}
