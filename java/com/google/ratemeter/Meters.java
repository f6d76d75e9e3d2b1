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

package com.google.ratemeter;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import java.time.Duration;

/**
 * Process-wide meter construction.
 *
 * <p>Owns the one {@link MeterArbiter} of the process. It is created lazily by the first caller of
 * {@link #arbiter()} or {@link #arbiter(Duration)}; {@link com.google.ratemeter.config.MeterModule}
 * binds the same instance, so meters created here and meters created through injection are ticked
 * by a single task.
 */
public final class Meters {
  private static final MeterMaker DISABLED = new DisabledMeterMaker();

  private static volatile boolean enabled = true;

  // Guarded by Meters.class.
  private static MeterArbiter arbiter;
  private static ArbitratedMeterMaker maker;

  /**
   * Create a meter, or a {@link DisabledMeter} while meters are disabled.
   *
   * @return new meter.
   */
  public static Meter newMeter() {
    return maker().newMeter();
  }

  /** @return maker matching the current enabled state. */
  public static MeterMaker maker() {
    if (!enabled) {
      return DISABLED;
    }
    synchronized (Meters.class) {
      if (maker == null) {
        maker = new ArbitratedMeterMaker(arbiter(), Ticker.systemTicker());
      }
      return maker;
    }
  }

  /**
   * @return the process arbiter, created with {@link MeterArbiter#DEFAULT_TICK_INTERVAL} if it
   *     does not exist yet.
   */
  public static synchronized MeterArbiter arbiter() {
    if (arbiter == null) {
      arbiter = MeterArbiter.create(MeterArbiter.DEFAULT_TICK_INTERVAL);
    }
    return arbiter;
  }

  /**
   * Get the process arbiter, creating it with {@code tickInterval} if it does not exist yet.
   *
   * @throws IllegalStateException if the arbiter already ticks at a different interval.
   */
  public static synchronized MeterArbiter arbiter(Duration tickInterval) {
    if (arbiter == null) {
      arbiter = MeterArbiter.create(tickInterval);
    }
    checkState(
        arbiter.tickInterval().equals(tickInterval),
        "meter arbiter already ticks every %s, cannot use %s",
        arbiter.tickInterval(),
        tickInterval);
    return arbiter;
  }

  /** Stop the process arbiter, if one was created. Meant for process shutdown. */
  public static synchronized void shutdown() {
    if (arbiter != null) {
      arbiter.shutdown();
    }
  }

  /** Switch meter creation on or off. Meters created earlier are not affected. */
  public static void setEnabled(boolean enable) {
    enabled = enable;
  }

  public static boolean isEnabled() {
    return enabled;
  }

  /** Shut down and forget the process arbiter so the next caller creates a fresh one. */
  @VisibleForTesting
  public static synchronized void resetForTesting() throws InterruptedException {
    if (arbiter != null) {
      arbiter.shutdown();
      arbiter.awaitTermination(Duration.ofSeconds(10));
    }
    arbiter = null;
    maker = null;
    enabled = true;
  }

  private Meters() {}
}
