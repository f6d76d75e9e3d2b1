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

/**
 * Counts events and derives smoothed event rates from them.
 *
 * <p>Rates are exponentially-weighted moving averages over one, five and fifteen minutes, plus the
 * mean rate since creation and a step rate measured between two reads of {@link #rateStep()}.
 *
 * <p>{@link #count()} and the {@code rateN()} readers never block and may be called at any
 * frequency. Each value is published independently: a reader observing a new {@link #rate1()} is
 * not guaranteed to observe the {@link #count()} that produced it. Only {@link #snapshot()}
 * promises a coherent view.
 */
public abstract class Meter {
  /** Record the occurrence of one event. */
  public void mark() {
    mark(1);
  }

  /**
   * Record the occurrence of {@code n} events.
   *
   * @param n number of events, may be negative.
   */
  public abstract void mark(long n);

  /** @return number of events recorded. */
  public abstract long count();

  /** @return one-minute moving average rate, in events per second. */
  public abstract double rate1();

  /** @return five-minute moving average rate, in events per second. */
  public abstract double rate5();

  /** @return fifteen-minute moving average rate, in events per second. */
  public abstract double rate15();

  /** @return mean rate since the meter was created, in events per second. */
  public abstract double rateMean();

  /**
   * Rate of events since the previous call to this method or to {@link #snapshot()}.
   *
   * <p>Unlike the other readers this refreshes every published rate before returning.
   *
   * @return step rate, in events per second.
   */
  public abstract double rateStep();

  /**
   * Refresh all rates and return a read-only copy of this meter.
   *
   * <p>Calling {@link #mark(long)} on the returned copy throws.
   *
   * @return frozen copy whose values never change.
   */
  public abstract Meter snapshot();

  /**
   * Stop tracking rates. Later calls to {@link #mark(long)} are ignored, the last values stay
   * readable. Calling this more than once has no effect.
   */
  public abstract void stop();
}
