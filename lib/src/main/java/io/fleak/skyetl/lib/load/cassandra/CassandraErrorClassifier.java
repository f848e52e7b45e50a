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
package io.fleak.skyetl.lib.load.cassandra;

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.datastax.oss.driver.api.core.connection.BusyConnectionException;
import com.datastax.oss.driver.api.core.connection.ClosedConnectionException;
import com.datastax.oss.driver.api.core.connection.HeartbeatException;
import com.datastax.oss.driver.api.core.servererrors.BootstrappingException;
import com.datastax.oss.driver.api.core.servererrors.OverloadedException;
import com.datastax.oss.driver.api.core.servererrors.ReadTimeoutException;
import com.datastax.oss.driver.api.core.servererrors.UnavailableException;
import com.datastax.oss.driver.api.core.servererrors.WriteTimeoutException;
import io.fleak.skyetl.api.sink.PermanentWriteException;
import io.fleak.skyetl.api.sink.SinkWriteException;
import io.fleak.skyetl.api.sink.TransientWriteException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Sorts driver failures into retryable and non-retryable ones. Timeouts, unavailable or overloaded
 * replicas and connection-level failures are transient. Query validation errors (invalid query,
 * syntax, schema mismatch, authorization), codec errors and anything unrecognized are permanent.
 */
public final class CassandraErrorClassifier {

  private CassandraErrorClassifier() {}

  public static SinkWriteException classify(Throwable error) {
    Throwable cause = unwrap(error);
    String message = cause.getClass().getSimpleName() + ": " + cause.getMessage();
    if (isTransient(cause)) {
      return new TransientWriteException(message, cause);
    }
    return new PermanentWriteException(message, cause);
  }

  static boolean isTransient(Throwable cause) {
    return cause instanceof DriverTimeoutException
        || cause instanceof WriteTimeoutException
        || cause instanceof ReadTimeoutException
        || cause instanceof UnavailableException
        || cause instanceof OverloadedException
        || cause instanceof BootstrappingException
        || cause instanceof AllNodesFailedException
        || cause instanceof BusyConnectionException
        || cause instanceof ClosedConnectionException
        || cause instanceof HeartbeatException;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
