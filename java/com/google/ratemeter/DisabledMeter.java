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

/** Records nothing, used when metrics are disabled. */
public final class DisabledMeter extends Meter {
  public static final DisabledMeter INSTANCE = new DisabledMeter();

  private DisabledMeter() {}

  @Override
  public void mark(long n) {}

  @Override
  public long count() {
    return 0;
  }

  @Override
  public double rate1() {
    return 0;
  }

  @Override
  public double rate5() {
    return 0;
  }

  @Override
  public double rate15() {
    return 0;
  }

  @Override
  public double rateMean() {
    return 0;
  }

  @Override
  public double rateStep() {
    return 0;
  }

  @Override
  public DisabledMeter snapshot() {
    return INSTANCE;
  }

  @Override
  public void stop() {}
}
