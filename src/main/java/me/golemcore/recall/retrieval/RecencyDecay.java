/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.recall.retrieval;

import java.time.Duration;
import java.time.Instant;

/**
 * Piecewise recency factor in {@code [0.1, 1.0]} for an indexed chunk.
 *
 * <ul>
 * <li>up to 24 hours: 1.0</li>
 * <li>up to 7 days: linear from 1.0 to 0.85</li>
 * <li>up to 30 days: linear from 0.85 to 0.6</li>
 * <li>up to 90 days: linear from 0.6 to 0.3</li>
 * <li>older: {@code 0.3 * exp(-(age - 90d) / 180d)}, floored at 0.1</li>
 * </ul>
 *
 * An unknown timestamp is neutral (0.5). Timestamps in the future count as
 * age zero.
 */
public final class RecencyDecay {

    public static final double UNKNOWN_AGE = 0.5;

    private static final double DAY_HOURS = 24.0;
    private static final double FLOOR = 0.1;

    private RecencyDecay() {
    }

    public static double decay(Instant updatedAt, Instant now) {
        if (updatedAt == null || updatedAt.toEpochMilli() <= 0) {
            return UNKNOWN_AGE;
        }
        long ageMs = Math.max(0L, Duration.between(updatedAt, now).toMillis());
        return decayHours(ageMs / 3_600_000.0);
    }

    static double decayHours(double ageHours) {
        if (ageHours <= DAY_HOURS) {
            return 1.0;
        }
        if (ageHours <= DAY_HOURS * 7) {
            return 0.85 + 0.15 * (1 - (ageHours - DAY_HOURS) / (DAY_HOURS * 6));
        }
        if (ageHours <= DAY_HOURS * 30) {
            return 0.6 + 0.25 * (1 - (ageHours - DAY_HOURS * 7) / (DAY_HOURS * 23));
        }
        if (ageHours <= DAY_HOURS * 90) {
            return 0.3 + 0.3 * (1 - (ageHours - DAY_HOURS * 30) / (DAY_HOURS * 60));
        }
        return Math.max(FLOOR, 0.3 * Math.exp(-(ageHours - DAY_HOURS * 90) / (DAY_HOURS * 180)));
    }
}
