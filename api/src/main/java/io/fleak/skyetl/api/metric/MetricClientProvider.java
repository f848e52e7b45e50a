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
package io.fleak.skyetl.api.metric;

import java.util.Map;

public interface MetricClientProvider extends AutoCloseable {

  EtlCounter counter(String name, Map<String, String> tags);

  EtlStopWatch stopWatch(String name, Map<String, String> tags);

  @Override
  void close();

  class NoopMetricClientProvider implements MetricClientProvider {

    @Override
    public EtlCounter counter(String name, Map<String, String> tags) {
      return (n, additionalTags) -> {};
    }

    @Override
    public EtlStopWatch stopWatch(String name, Map<String, String> tags) {
      return new EtlStopWatch() {
        @Override
        protected void reportDuration(long durationMillis, Map<String, String> additionalTags) {
          // no-op
        }
      };
    }

    @Override
    public void close() {
      // no-op
    }
  }
}
