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
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Ticks every registered {@link StandardMeter} from a single periodic task.
 *
 * <p>The task is scheduled on the first registration and then runs until {@link #shutdown()},
 * doing nothing while no meters are registered. A process normally has a single arbiter, see
 * {@link Meters#arbiter()}. Membership is a set of references; a stopped
 * meter is removed so it is no longer ticked and can be collected.
 */
public class MeterArbiter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(5);

  /** Create an arbiter ticking on its own daemon thread. */
  public static MeterArbiter create(Duration tickInterval) {
    ScheduledExecutorService executor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("MeterArbiter-%d")
                .setDaemon(true)
                .setPriority(Thread.MIN_PRIORITY)
                .build());
    return new MeterArbiter(executor, tickInterval);
  }

  private final ScheduledExecutorService executor;
  private final Duration tickInterval;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  // Guarded by lock.
  private final Set<StandardMeter> meters = Sets.newIdentityHashSet();
  private boolean started;

  public MeterArbiter(ScheduledExecutorService executor, Duration tickInterval) {
    checkArgument(
        !tickInterval.isNegative() && !tickInterval.isZero(),
        "tick interval must be positive: %s",
        tickInterval);
    this.executor = checkNotNull(executor, "executor");
    this.tickInterval = tickInterval;
  }

  public Duration tickInterval() {
    return tickInterval;
  }

  public boolean isStarted() {
    lock.readLock().lock();
    try {
      return started;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** @return number of meters currently ticked. */
  public int meterCount() {
    lock.readLock().lock();
    try {
      return meters.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  RegistrationHandle register(StandardMeter meter) {
    lock.writeLock().lock();
    try {
      meters.add(meter);
      if (!started) {
        started = true;
        start();
      }
    } finally {
      lock.writeLock().unlock();
    }
    return () -> deregister(meter);
  }

  private void deregister(StandardMeter meter) {
    lock.writeLock().lock();
    try {
      if (meters.remove(meter)) {
        logger.atFine().log("Deregistered meter, %d remaining", meters.size());
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Stop the ticking task. Registered meters keep their last values but are no longer ticked.
   * Meant for process shutdown; an arbiter is not restarted.
   */
  public void shutdown() {
    executor.shutdown();
  }

  /**
   * Wait for the ticking task to finish after {@link #shutdown()}.
   *
   * @return true if the executor terminated before the timeout.
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return executor.awaitTermination(timeout.toNanos(), NANOSECONDS);
  }

  private void start() {
    logger.atInfo().log("Starting meter arbiter, ticking every %s", tickInterval);
    long nanos = tickInterval.toNanos();
    @SuppressWarnings("unused") // Runnable already handles errors
    Future<?> possiblyIgnoredError =
        executor.scheduleAtFixedRate(this::tickMeters, nanos, nanos, NANOSECONDS);
  }

  /** Run one pass, ticking each registered meter once. */
  @VisibleForTesting
  void tickMeters() {
    lock.readLock().lock();
    try {
      for (StandardMeter meter : meters) {
        try {
          meter.tick();
        } catch (VirtualMachineError e) {
          throw e;
        } catch (RuntimeException | Error e) {
          // The periodic task is cancelled for good if it throws.
          logger.atSevere().withCause(e).log("Failed to tick meter %s", meter);
        }
      }
    } finally {
      lock.readLock().unlock();
    }
  }
}
