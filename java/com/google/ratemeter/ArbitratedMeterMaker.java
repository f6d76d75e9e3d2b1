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
import com.google.inject.Inject;
import com.google.inject.Singleton;

/** Creates {@link StandardMeter}s ticked by a shared {@link MeterArbiter}. */
@Singleton
public class ArbitratedMeterMaker extends MeterMaker {
  private final MeterArbiter arbiter;
  private final Ticker ticker;

  @Inject
  public ArbitratedMeterMaker(MeterArbiter arbiter, Ticker ticker) {
    this.arbiter = arbiter;
    this.ticker = ticker;
  }

  @Override
  public StandardMeter newMeter() {
    return new StandardMeter(arbiter, ticker);
  }

  public MeterArbiter arbiter() {
    return arbiter;
  }
}
