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

import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.ratemeter.ArbitratedMeterMaker;
import com.google.ratemeter.DisabledMeterMaker;
import com.google.ratemeter.MeterArbiter;
import com.google.ratemeter.MeterMaker;
import com.google.ratemeter.Meters;
import org.eclipse.jgit.lib.Config;

/** Binds {@link MeterMaker} according to the {@code metrics} and {@code meter} sections. */
public class MeterModule extends AbstractModule {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final MeterConfig meterConfig;

  public MeterModule(Config cfg) {
    this(MeterConfig.fromConfig(cfg));
  }

  public MeterModule(MeterConfig meterConfig) {
    this.meterConfig = meterConfig;
  }

  @Override
  protected void configure() {
    bind(MeterConfig.class).toInstance(meterConfig);
    bind(Ticker.class).toInstance(Ticker.systemTicker());
    if (meterConfig.enabled()) {
      bind(MeterMaker.class).to(ArbitratedMeterMaker.class);
    } else {
      logger.atInfo().log("Meters are disabled, all meters will be no-ops");
      bind(MeterMaker.class).to(DisabledMeterMaker.class);
    }
  }

  /** Every injector shares the process arbiter, so a process never runs two ticking tasks. */
  @Provides
  @Singleton
  MeterArbiter provideMeterArbiter(MeterConfig cfg) {
    return Meters.arbiter(cfg.tickInterval());
  }
}
