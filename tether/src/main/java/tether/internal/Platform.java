/*
 * Copyright 2013-2024 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package tether.internal;

import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import tether.CorrelationInfo;

/**
 * Access to platform-specific features.
 *
 * <p>Note: Logging is centralized here to avoid classloader problems. Diagnostics about individual
 * requests are logged at {@link Level#FINE}, so they cost nothing unless enabled.
 *
 * <p>Originally designed by OkHttp team, derived from {@code okhttp3.internal.platform.Platform}
 */
public abstract class Platform {
  private static final Platform PLATFORM = findPlatform();
  private static final Logger LOG = Logger.getLogger(CorrelationInfo.class.getName());

  public static Platform get() {
    return PLATFORM;
  }

  /** Like {@link Logger#log(Level, String, Throwable)} at {@link Level#FINE} */
  public void log(String msg, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LOG.log(Level.FINE, msg, thrown);
  }

  /** Like {@link Logger#log(Level, String, Object)}, except with a throwable arg */
  public void log(String msg, Object param1, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return;
    log(Level.FINE, msg, new Object[] {param1}, thrown);
  }

  /** Like {@link #log(String, Object, Throwable)}, except with two parameters */
  public void log(String msg, Object param1, Object param2, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return;
    log(Level.FINE, msg, new Object[] {param1, param2}, thrown);
  }

  /** Logs a condition an operator should notice, such as a header that could not be written. */
  public void warn(String msg, @Nullable Object param1) {
    if (!LOG.isLoggable(Level.WARNING)) return;
    log(Level.WARNING, msg, new Object[] {param1}, null);
  }

  /** Logs a request that was rejected. */
  public void error(String msg, @Nullable Object param1) {
    if (!LOG.isLoggable(Level.SEVERE)) return;
    log(Level.SEVERE, msg, new Object[] {param1}, null);
  }

  static void log(Level level, String msg, Object[] params, @Nullable Throwable thrown) {
    LogRecord lr = new LogRecord(level, msg);
    lr.setLoggerName(LOG.getName());
    lr.setParameters(params);
    if (thrown != null) lr.setThrown(thrown);
    LOG.log(lr);
  }

  /**
   * Returns a pseudo-random long which may be zero.
   *
   * <p>This optimizes speed over full coverage of 64-bits, which is why it doesn't share a {@link
   * java.security.SecureRandom}.
   */
  public abstract long randomLong();

  /** Generates a new 64-bit ID, taking care to dodge zero which can be confused with absent */
  public long nextId() {
    long nextId = randomLong();
    while (nextId == 0L) {
      nextId = randomLong();
    }
    return nextId;
  }

  /** Attempt to match the host runtime to a capable Platform implementation. */
  static Platform findPlatform() {
    return new Jre8();
  }

  static class Jre8 extends Platform {
    @Override public long randomLong() {
      return ThreadLocalRandom.current().nextLong();
    }

    @Override public String toString() {
      return "Jre8{}";
    }
  }
}
