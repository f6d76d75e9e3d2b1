// Copyright (C) 2026 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.ratemeter.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.ratemeter.MeterArbiter;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.eclipse.jgit.lib.Config;

/**
 * Meter settings read from a git-style config file.
 *
 * <pre>
 * [metrics]
 *   enabled = true
 * [meter]
 *   tickInterval = 5 s
 * </pre>
 */
public class MeterConfig {
  static final String METRICS_SECTION = "metrics";
  static final String METER_SECTION = "meter";
  static final String KEY_ENABLED = "enabled";
  static final String KEY_TICK_INTERVAL = "tickInterval";

  private static final Duration MIN_TICK_INTERVAL = Duration.ofSeconds(1);

  public static MeterConfig fromConfig(Config cfg) {
    boolean enabled = cfg.getBoolean(METRICS_SECTION, KEY_ENABLED, true);
    Duration tickInterval =
        Duration.ofMillis(
            cfg.getTimeUnit(
                METER_SECTION,
                null,
                KEY_TICK_INTERVAL,
                MeterArbiter.DEFAULT_TICK_INTERVAL.toMillis(),
                TimeUnit.MILLISECONDS));
    return new MeterConfig(enabled, tickInterval);
  }

  private final boolean enabled;
  private final Duration tickInterval;

  public MeterConfig(boolean enabled, Duration tickInterval) {
    checkArgument(
        tickInterval.compareTo(MIN_TICK_INTERVAL) >= 0,
        "%s.%s must be at least %s: %s",
        METER_SECTION,
        KEY_TICK_INTERVAL,
        MIN_TICK_INTERVAL,
        tickInterval);
    this.enabled = enabled;
    this.tickInterval = tickInterval;
  }

  /** @return whether meters record anything; if false every meter is a no-op. */
  public boolean enabled() {
    return enabled;
  }

  /** @return interval at which the arbiter ticks meters. */
  public Duration tickInterval() {
    return tickInterval;
  }
}
