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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/** Records periodic tasks instead of running them, so tests can fire them by hand. */
class FakeScheduledExecutor extends ScheduledThreadPoolExecutor {
  private final List<Runnable> periodic = new ArrayList<>();
  private final List<Long> periodNanos = new ArrayList<>();

  FakeScheduledExecutor() {
    super(
        1,
        new ThreadFactoryBuilder().setNameFormat("FakeScheduledExecutor-%d").setDaemon(true).build());
  }

  @Override
  public synchronized ScheduledFuture<?> scheduleAtFixedRate(
      Runnable command, long initialDelay, long period, TimeUnit unit) {
    periodic.add(command);
    periodNanos.add(unit.toNanos(period));
    return new DoneFuture();
  }

  synchronized int periodicTaskCount() {
    return periodic.size();
  }

  synchronized long periodNanos(int index) {
    return periodNanos.get(index);
  }

  synchronized void runPeriodicTasks() {
    periodic.forEach(Runnable::run);
  }

  /** Never started, so no worker thread is ever created. */
  private static class DoneFuture implements ScheduledFuture<Object> {
    @Override
    public long getDelay(TimeUnit unit) {
      return 0;
    }

    @Override
    public int compareTo(Delayed other) {
      return Long.compare(0, other.getDelay(TimeUnit.NANOSECONDS));
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
      return false;
    }

    @Override
    public boolean isCancelled() {
      return false;
    }

    @Override
    public boolean isDone() {
      return true;
    }

    @Override
    public Object get() {
      return null;
    }

    @Override
    public Object get(long timeout, TimeUnit unit) {
      return null;
    }
  }
}
