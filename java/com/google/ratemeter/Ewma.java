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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Exponentially-weighted moving average of an event rate.
 *
 * <p>{@link #update(long)} may be called from any thread. {@link #tick()} must be serialized by
 * the caller; the owning {@link StandardMeter} is only ever ticked by one arbiter pass at a time.
 */
public class Ewma {
  private static final double SECONDS_PER_MINUTE = 60.0;

  /** Decay constant for a window of {@code windowMinutes} sampled every {@code tickInterval}. */
  public static double alpha(Duration tickInterval, int windowMinutes) {
    checkArgument(windowMinutes > 0, "window must be positive: %s", windowMinutes);
    return 1 - Math.exp(-seconds(tickInterval) / SECONDS_PER_MINUTE / windowMinutes);
  }

  public static Ewma oneMinute(Duration tickInterval) {
    return new Ewma(alpha(tickInterval, 1), tickInterval);
  }

  public static Ewma fiveMinute(Duration tickInterval) {
    return new Ewma(alpha(tickInterval, 5), tickInterval);
  }

  public static Ewma fifteenMinute(Duration tickInterval) {
    return new Ewma(alpha(tickInterval, 15), tickInterval);
  }

  private final double alpha;
  private final double intervalSeconds;
  private final AtomicLong uncounted = new AtomicLong();

  // Written only by tick().
  private volatile boolean initialized;
  private volatile double rate;

  public Ewma(double alpha, Duration tickInterval) {
    checkArgument(alpha > 0 && alpha <= 1, "alpha must be in (0, 1]: %s", alpha);
    this.alpha = alpha;
    this.intervalSeconds = seconds(tickInterval);
  }

  /** Add {@code n} events to the current interval. */
  public void update(long n) {
    uncounted.addAndGet(n);
  }

  /** Fold the events of the elapsed interval into the average. */
  public void tick() {
    double instantRate = uncounted.getAndSet(0) / intervalSeconds;
    if (initialized) {
      rate += alpha * (instantRate - rate);
    } else {
      rate = instantRate;
      initialized = true;
    }
  }

  /** @return decayed rate in events per second, 0 before the first tick. */
  public double rate() {
    return rate;
  }

  @VisibleForTesting
  double alpha() {
    return alpha;
  }

  private static double seconds(Duration d) {
    checkArgument(!d.isNegative() && !d.isZero(), "tick interval must be positive: %s", d);
    return d.toNanos() / 1e9;
  }
}
