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

/**
 * States of one batch delivery. {@code ATTEMPTING} and {@code BACKOFF_WAIT} alternate until the
 * delivery reaches one of the terminal states.
 */
public enum DeliveryState {
  ATTEMPTING,
  BACKOFF_WAIT,
  SUCCEEDED,
  /** Every attempt failed with a transient error. */
  EXHAUSTED,
  /** Storage refused the batch for a reason retrying cannot fix. */
  REJECTED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == EXHAUSTED || this == REJECTED;
  }
}
