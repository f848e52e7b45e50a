/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fleak.skyetl.lib.load;

import com.google.common.base.Preconditions;
import java.time.Duration;
import lombok.NonNull;

/**
 * Bounded exponential backoff. The wait after the n-th failed attempt is {@code min(cap, base *
 * 2^(n-1))}.
 *
 * @param maxAttempts total attempts per batch, including the first
 */
public record RetryPolicy(
    int maxAttempts, @NonNull Duration backoffBase, @NonNull Duration backoffCap) {

  public static final RetryPolicy DEFAULT =
      new RetryPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(10));

  public RetryPolicy {
    Preconditions.checkArgument(
        maxAttempts >= 1, "maxAttempts must be at least 1: %s", maxAttempts);
    Preconditions.checkArgument(!backoffBase.isNegative(), "backoffBase must not be negative");
    Preconditions.checkArgument(
        backoffCap.compareTo(backoffBase) >= 0, "backoffCap must not be below backoffBase");
  }

  public Duration backoff(int failedAttempt) {
    Preconditions.checkArgument(failedAttempt >= 1, "failedAttempt must be at least 1");
    // bounded shift keeps the long arithmetic from overflowing
    int shift = Math.min(failedAttempt - 1, 62);
    long baseMillis = backoffBase.toMillis();
    long capMillis = backoffCap.toMillis();
    if (baseMillis == 0) {
      return Duration.ZERO;
    }
    if (baseMillis > (capMillis >> shift)) {
      return backoffCap;
    }
    return Duration.ofMillis(Math.min(capMillis, baseMillis << shift));
  }
}
