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

import static com.google.common.truth.Truth.assertThat;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.Assert.assertThrows;

import com.google.common.testing.FakeTicker;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class StandardMeterTest {
  private static final double EPSILON = 1e-9;

  private FakeTicker ticker;
  private FakeScheduledExecutor executor;
  private MeterArbiter arbiter;
  private MeterMaker maker;

  @Before
  public void setUp() {
    ticker = new FakeTicker();
    executor = new FakeScheduledExecutor();
    arbiter = new MeterArbiter(executor, MeterArbiter.DEFAULT_TICK_INTERVAL);
    maker = new ArbitratedMeterMaker(arbiter, ticker);
  }

  @After
  public void tearDown() {
    executor.shutdownNow();
  }

  @Test
  public void ratesAreZeroAfterConstruction() {
    Meter meter = maker.newMeter();
    assertThat(meter.count()).isEqualTo(0);
    assertThat(meter.rate1()).isEqualTo(0.0);
    assertThat(meter.rate5()).isEqualTo(0.0);
    assertThat(meter.rate15()).isEqualTo(0.0);
    assertThat(meter.rateMean()).isEqualTo(0.0);
  }

  @Test
  public void countIsRunningSum() {
    Meter meter = maker.newMeter();
    meter.mark(5);
    meter.mark(-2);
    meter.mark();
    meter.mark(10);
    assertThat(meter.count()).isEqualTo(14);
  }

  @Test
  public void concurrentMarksAreNotLost() throws Exception {
    Meter meter = maker.newMeter();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        futures.add(
            pool.submit(
                () -> {
                  for (int i = 0; i < 10_000; i++) {
                    meter.mark(1);
                  }
                }));
      }
      for (Future<?> f : futures) {
        f.get();
      }
    } finally {
      pool.shutdown();
    }
    assertThat(meter.count()).isEqualTo(80_000);
  }

  @Test
  public void markDoesNotWaitForTick() {
    Meter meter = maker.newMeter();
    meter.mark(10);
    assertThat(meter.count()).isEqualTo(10);
    assertThat(meter.rate1()).isEqualTo(0.0);

    arbiter.tickMeters();
    assertThat(meter.rate1()).isWithin(EPSILON).of(2.0);
    assertThat(meter.rate5()).isWithin(EPSILON).of(2.0);
    assertThat(meter.rate15()).isWithin(EPSILON).of(2.0);
  }

  @Test
  public void meanRateIsCountOverElapsedTime() {
    Meter meter = maker.newMeter();
    ticker.advance(10, SECONDS);
    meter.mark(25);
    assertThat(meter.rateMean()).isWithin(EPSILON).of(2.5);
  }

  @Test
  public void oneEventPerSecondForAMinute() {
    Meter meter = maker.newMeter();
    for (int second = 1; second <= 60; second++) {
      ticker.advance(1, SECONDS);
      meter.mark(1);
      if (second % 5 == 0) {
        arbiter.tickMeters();
      }
    }

    Meter snapshot = meter.snapshot();
    assertThat(snapshot.count()).isEqualTo(60);
    assertThat(snapshot.rateMean()).isWithin(EPSILON).of(1.0);
    assertThat(snapshot.rate1()).isWithin(EPSILON).of(1.0);
    assertThat(snapshot.rate5()).isWithin(EPSILON).of(1.0);
    assertThat(snapshot.rate15()).isWithin(EPSILON).of(1.0);
  }

  @Test
  public void rateOneMinuteDecaysAfterEventsStop() {
    Meter meter = maker.newMeter();
    meter.mark(5);
    arbiter.tickMeters();
    double before = meter.rate1();
    for (int i = 0; i < 12; i++) {
      arbiter.tickMeters();
    }
    assertThat(meter.rate1()).isWithin(EPSILON).of(before * Math.exp(-1));
    assertThat(meter.rate15()).isGreaterThan(meter.rate5());
    assertThat(meter.rate5()).isGreaterThan(meter.rate1());
  }

  @Test
  public void markAfterStopIsIgnored() {
    StandardMeter meter = (StandardMeter) maker.newMeter();
    meter.mark(3);
    meter.stop();
    meter.mark(4);
    assertThat(meter.isStopped()).isTrue();
    assertThat(meter.count()).isEqualTo(3);
    assertThat(arbiter.meterCount()).isEqualTo(0);
  }

  @Test
  public void stopIsIdempotent() {
    Meter first = maker.newMeter();
    Meter second = maker.newMeter();
    first.stop();
    first.stop();
    assertThat(arbiter.meterCount()).isEqualTo(1);
    second.mark(5);
    assertThat(second.count()).isEqualTo(5);
  }

  @Test
  public void lastValuesStayReadableAfterStop() {
    Meter meter = maker.newMeter();
    meter.mark(10);
    arbiter.tickMeters();
    meter.stop();
    arbiter.tickMeters();
    assertThat(meter.rate1()).isWithin(EPSILON).of(2.0);
    assertThat(meter.count()).isEqualTo(10);
  }

  @Test
  public void snapshotDoesNotChange() {
    Meter meter = maker.newMeter();
    ticker.advance(5, SECONDS);
    meter.mark(5);
    arbiter.tickMeters();
    Meter snapshot = meter.snapshot();

    meter.mark(100);
    ticker.advance(5, SECONDS);
    arbiter.tickMeters();

    assertThat(snapshot.count()).isEqualTo(5);
    assertThat(snapshot.rate1()).isWithin(EPSILON).of(1.0);
    assertThat(snapshot.rateMean()).isWithin(EPSILON).of(1.0);
    assertThat(meter.count()).isEqualTo(105);
    assertThat(meter.rate1()).isGreaterThan(1.0);
  }

  @Test
  public void snapshotsStayFrozenWhileMeterIsMarkedAndTicked() throws Exception {
    Meter meter = maker.newMeter();
    AtomicBoolean done = new AtomicBoolean();
    List<Meter> snapshots = new ArrayList<>();
    List<Long> counts = new ArrayList<>();
    List<Double> rates = new ArrayList<>();
    List<Double> means = new ArrayList<>();
    ExecutorService pool = Executors.newFixedThreadPool(3);
    try {
      List<Future<?>> writers = new ArrayList<>();
      for (int t = 0; t < 2; t++) {
        writers.add(
            pool.submit(
                () -> {
                  for (int i = 0; i < 20_000; i++) {
                    meter.mark(1);
                  }
                }));
      }
      Future<?> ticking =
          pool.submit(
              () -> {
                while (!done.get()) {
                  ticker.advance(1, SECONDS);
                  arbiter.tickMeters();
                }
              });

      long previous = 0;
      for (int i = 0; i < 500; i++) {
        meter.rateStep();
        Meter snapshot = meter.snapshot();
        assertThat(snapshot.count()).isAtLeast(previous);
        previous = snapshot.count();
        snapshots.add(snapshot);
        counts.add(snapshot.count());
        rates.add(snapshot.rate1());
        means.add(snapshot.rateMean());
      }
      for (Future<?> f : writers) {
        f.get();
      }
      done.set(true);
      ticking.get();
    } finally {
      done.set(true);
      pool.shutdown();
    }

    for (int i = 0; i < snapshots.size(); i++) {
      Meter snapshot = snapshots.get(i);
      assertThat(snapshot.count()).isEqualTo(counts.get(i));
      assertThat(snapshot.rate1()).isEqualTo(rates.get(i));
      assertThat(snapshot.rateMean()).isEqualTo(means.get(i));
    }
    assertThat(meter.count()).isEqualTo(40_000);
  }

  @Test
  public void markRacingStopIsAppliedFullyOrNotAtAll() throws Exception {
    StandardMeter meter = (StandardMeter) maker.newMeter();
    int threads = 4;
    CountDownLatch running = new CountDownLatch(threads);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        futures.add(
            pool.submit(
                () -> {
                  running.countDown();
                  for (int i = 0; i < 50_000; i++) {
                    meter.mark(1);
                  }
                }));
      }
      running.await();
      meter.stop();
      for (Future<?> f : futures) {
        f.get();
      }
    } finally {
      pool.shutdown();
    }

    long stoppedAt = meter.count();
    assertThat(stoppedAt).isAtMost(threads * 50_000L);
    meter.mark(100);
    assertThat(meter.count()).isEqualTo(stoppedAt);

    // Every mark counted also reached the moving averages.
    meter.tick();
    assertThat(meter.rate1()).isWithin(EPSILON).of(stoppedAt / 5.0);
  }

  @Test
  public void markOnSnapshotFails() {
    Meter meter = maker.newMeter();
    meter.mark(1);
    Meter snapshot = meter.snapshot();
    assertThrows(UnsupportedOperationException.class, () -> snapshot.mark(1));
    assertThrows(UnsupportedOperationException.class, () -> snapshot.mark());
    assertThat(snapshot.count()).isEqualTo(1);
  }

  @Test
  public void snapshotOfSnapshotIsItself() {
    Meter snapshot = maker.newMeter().snapshot();
    assertThat(snapshot.snapshot()).isSameInstanceAs(snapshot);
  }

  @Test
  public void stepRateIsMeasuredBetweenReads() {
    Meter meter = maker.newMeter();
    ticker.advance(2, SECONDS);
    meter.mark(10);
    assertThat(meter.rateStep()).isWithin(EPSILON).of(5.0);

    ticker.advance(4, SECONDS);
    meter.mark(2);
    assertThat(meter.rateStep()).isWithin(EPSILON).of(0.5);

    // No time has passed, the previous step rate is kept.
    assertThat(meter.rateStep()).isWithin(EPSILON).of(0.5);
  }

  @Test
  public void snapshotCarriesStepRateAndResetsStep() {
    Meter meter = maker.newMeter();
    ticker.advance(5, SECONDS);
    meter.mark(10);
    Meter snapshot = meter.snapshot();
    assertThat(snapshot.rateStep()).isWithin(EPSILON).of(2.0);

    ticker.advance(5, SECONDS);
    assertThat(meter.rateStep()).isEqualTo(0.0);
    assertThat(snapshot.rateStep()).isWithin(EPSILON).of(2.0);
  }

  @Test
  public void snapshotToStringNamesFields() {
    Meter meter = maker.newMeter();
    meter.mark(7);
    assertThat(meter.snapshot().toString()).contains("count=7");
  }
}
