/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.tracegraph.impl;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.flogger.FluentLogger;
import org.jspecify.annotations.Nullable;
import org.tracegraph.RestartAnalysis;
import org.tracegraph.TraceConfig;
import org.tracegraph.UnsupportedTraceException;

/**
 * Runs a trace, re-running it from the beginning each time it is abandoned with a {@link
 * RestartAnalysis}.
 *
 * <p>Nothing from an abandoned attempt is reused; each attempt is expected to start with a fresh
 * graph and registry. What does carry over is the {@link GenerationTracker}, which records the
 * composites that an earlier attempt found could not be specialized.
 */
public final class TraceDriver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** A single attempt at a trace. */
  public interface TraceAttempt<T> {
    /** Runs the trace; {@code attempt} is 0 for the first attempt, 1 for the second, etc. */
    T run(int attempt);
  }

  private final TraceConfig config;
  private final GenerationTracker generations;

  public TraceDriver(TraceConfig config, GenerationTracker generations) {
    this.config = checkNotNull(config);
    this.generations = checkNotNull(generations);
  }

  public TraceConfig config() {
    return config;
  }

  public GenerationTracker generations() {
    return generations;
  }

  /**
   * Runs {@code attempt} until it completes without requesting a restart, and returns its result.
   * Throws an UnsupportedTraceException if more than {@link TraceConfig#maxRestarts} restarts are
   * requested.
   */
  public <T> T run(TraceAttempt<T> attempt) {
    @Nullable RestartAnalysis last = null;
    for (int i = 0; i <= config.maxRestarts(); i++) {
      try {
        return attempt.run(i);
      } catch (RestartAnalysis restart) {
        logger.atInfo().log("Restarting trace after attempt %s: %s", i, restart.getMessage());
        last = restart;
      }
    }
    logger.atWarning().log("Giving up after %s restarts", config.maxRestarts());
    throw new UnsupportedTraceException(
        String.format("trace restarted more than %s times", config.maxRestarts()), last);
  }
}
