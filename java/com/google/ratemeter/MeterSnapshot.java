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

import com.google.common.base.MoreObjects;

/** Read-only copy of a {@link Meter}, taken by {@link Meter#snapshot()}. */
public final class MeterSnapshot extends Meter {
  private final long count;
  private final double rate1;
  private final double rate5;
  private final double rate15;
  private final double rateMean;
  private final double rateStep;

  MeterSnapshot(
      long count, double rate1, double rate5, double rate15, double rateMean, double rateStep) {
    this.count = count;
    this.rate1 = rate1;
    this.rate5 = rate5;
    this.rate15 = rate15;
    this.rateMean = rateMean;
    this.rateStep = rateStep;
  }

  /**
   * Always throws, a snapshot is read-only.
   *
   * @throws UnsupportedOperationException on every call.
   */
  @Override
  public void mark(long n) {
    throw new UnsupportedOperationException("mark called on a meter snapshot");
  }

  @Override
  public long count() {
    return count;
  }

  @Override
  public double rate1() {
    return rate1;
  }

  @Override
  public double rate5() {
    return rate5;
  }

  @Override
  public double rate15() {
    return rate15;
  }

  @Override
  public double rateMean() {
    return rateMean;
  }

  /** @return step rate computed by the refresh that produced this snapshot. */
  @Override
  public double rateStep() {
    return rateStep;
  }

  @Override
  public MeterSnapshot snapshot() {
    return this;
  }

  /** No-op, a snapshot is not ticked. */
  @Override
  public void stop() {}

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("count", count)
        .add("rate1", rate1)
        .add("rate5", rate5)
        .add("rate15", rate15)
        .add("rateMean", rateMean)
        .add("rateStep", rateStep)
        .toString();
  }
}
