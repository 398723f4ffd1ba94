// Copyright 2025 The Zonerelay Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package zonerelay.util;

import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import java.time.Duration;

/**
 * Logs a step of a multi-request operation only when it took longer than a threshold.
 *
 * <p>Each call to {@link #tick} measures the time since the previous tick (or since construction),
 * so a single instance follows one operation through its steps.
 */
public final class StopwatchLogger {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Duration DEFAULT_THRESHOLD = Duration.ofMillis(400);

  private final String operation;
  private final long thresholdNanos;
  private final Ticker ticker;
  private long lastTickNanos;

  public StopwatchLogger(String operation) {
    this(operation, DEFAULT_THRESHOLD, Ticker.systemTicker());
  }

  public StopwatchLogger(String operation, Duration threshold, Ticker ticker) {
    this.operation = operation;
    this.thresholdNanos = threshold.toNanos();
    this.ticker = ticker;
    this.lastTickNanos = ticker.read();
  }

  /** Returns whether the step was slow enough to be logged. */
  public boolean tick(String step) {
    long currentNanos = ticker.read();
    long elapsedNanos = currentNanos - lastTickNanos;
    this.lastTickNanos = currentNanos;

    if (elapsedNanos <= thresholdNanos) {
      return false;
    }
    logger.atInfo().log(
        "%s: %s (took %d ms)", operation, step, Duration.ofNanos(elapsedNanos).toMillis());
    return true;
  }
}
