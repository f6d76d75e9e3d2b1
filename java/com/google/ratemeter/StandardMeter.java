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

import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.AtomicDouble;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Meter ticked by a shared {@link MeterArbiter}.
 *
 * <p>{@link #mark(long)}, {@link #count()} and the {@code rateN()} readers only use atomic loads
 * and stores. {@link #rateStep()}, {@link #snapshot()} and {@link #stop()} take a per-meter lock,
 * they never block the lock-free operations.
 */
public class StandardMeter extends Meter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Ticker ticker;
  private final long startNanos;
  private final Ewma m1Rate;
  private final Ewma m5Rate;
  private final Ewma m15Rate;
  private final RegistrationHandle registration;

  private final AtomicLong count = new AtomicLong();
  private final AtomicDouble rate1 = new AtomicDouble();
  private final AtomicDouble rate5 = new AtomicDouble();
  private final AtomicDouble rate15 = new AtomicDouble();
  private final AtomicDouble rateMean = new AtomicDouble();
  private final AtomicDouble rateStep = new AtomicDouble();

  private final Object lock = new Object();
  private volatile boolean stopped;

  // Guarded by lock.
  private long lastCount;
  private long lastNanos;

  /**
   * Create a meter and register it with {@code arbiter}, starting the arbiter's loop if this is
   * its first meter.
   */
  StandardMeter(MeterArbiter arbiter, Ticker ticker) {
    Duration tickInterval = arbiter.tickInterval();
    this.ticker = ticker;
    this.startNanos = ticker.read();
    this.lastNanos = startNanos;
    this.m1Rate = Ewma.oneMinute(tickInterval);
    this.m5Rate = Ewma.fiveMinute(tickInterval);
    this.m15Rate = Ewma.fifteenMinute(tickInterval);
    this.registration = arbiter.register(this);
  }

  @Override
  public void mark(long n) {
    if (stopped) {
      return;
    }
    count.addAndGet(n);
    m1Rate.update(n);
    m5Rate.update(n);
    m15Rate.update(n);
    publishRates();
  }

  @Override
  public long count() {
    return count.get();
  }

  @Override
  public double rate1() {
    return rate1.get();
  }

  @Override
  public double rate5() {
    return rate5.get();
  }

  @Override
  public double rate15() {
    return rate15.get();
  }

  @Override
  public double rateMean() {
    return rateMean.get();
  }

  @Override
  public double rateStep() {
    synchronized (lock) {
      refreshStep();
      return rateStep.get();
    }
  }

  @Override
  public MeterSnapshot snapshot() {
    synchronized (lock) {
      long current = refreshStep();
      return new MeterSnapshot(
          current, rate1.get(), rate5.get(), rate15.get(), rateMean.get(), rateStep.get());
    }
  }

  @Override
  public void stop() {
    synchronized (lock) {
      if (stopped) {
        return;
      }
      stopped = true;
    }
    registration.remove();
    logger.atFine().log("Stopped meter at count %d", count.get());
  }

  public boolean isStopped() {
    return stopped;
  }

  /** Advance the moving averages by one interval. Called by {@link MeterArbiter} only. */
  void tick() {
    m1Rate.tick();
    m5Rate.tick();
    m15Rate.tick();
    publishRates();
  }

  private void publishRates() {
    rate1.set(m1Rate.rate());
    rate5.set(m5Rate.rate());
    rate15.set(m15Rate.rate());
    double elapsed = secondsBetween(startNanos, ticker.read());
    if (elapsed > 0) {
      rateMean.set(count.get() / elapsed);
    }
  }

  /** Republish every rate including the step rate. Must hold {@code lock}. */
  private long refreshStep() {
    long now = ticker.read();
    long current = count.get();
    double sinceStart = secondsBetween(startNanos, now);
    double step = secondsBetween(lastNanos, now);
    rate1.set(m1Rate.rate());
    rate5.set(m5Rate.rate());
    rate15.set(m15Rate.rate());
    if (sinceStart > 0) {
      rateMean.set(current / sinceStart);
    }
    if (step > 0) {
      rateStep.set((current - lastCount) / step);
    }
    lastCount = current;
    lastNanos = now;
    return current;
  }

  private static double secondsBetween(long fromNanos, long toNanos) {
    return (toNanos - fromNanos) / 1e9;
  }
}
