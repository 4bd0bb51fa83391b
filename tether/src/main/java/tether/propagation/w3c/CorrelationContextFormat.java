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
package tether.propagation.w3c;

import java.util.Arrays;
import tether.internal.Nullable;
import tether.internal.Platform;
import tether.propagation.TraceContext;

import static tether.internal.Strings.truncate;

/**
 * Reads the legacy {@code Correlation-Context} header: comma-separated {@code key=value} pairs
 * which become baggage.
 */
public final class CorrelationContextFormat {
  public static final String CORRELATION_CONTEXT = "Correlation-Context";
  public static final int KEY_MAX_LENGTH = 50, VALUE_MAX_LENGTH = 1024;

  /** Like {@link #parseCorrelationContext(Iterable, TraceContext.Builder)}, for a raw header. */
  public static int parseCorrelationContext(@Nullable String value, TraceContext.Builder builder) {
    if (builder == null) throw new NullPointerException("builder == null");
    if (value == null || value.isEmpty()) return 0;
    return parseCorrelationContext(Arrays.asList(value.split(",")), builder);
  }

  /**
   * Adds each {@code key=value} entry with exactly one '=' as baggage. Keys are truncated to
   * {@link #KEY_MAX_LENGTH} and values to {@link #VALUE_MAX_LENGTH} before trimming whitespace.
   * Other entries are skipped.
   *
   * @return the count of entries added
   */
  public static int parseCorrelationContext(Iterable<String> entries,
    TraceContext.Builder builder) {
    if (entries == null) throw new NullPointerException("entries == null");
    if (builder == null) throw new NullPointerException("builder == null");

    int added = 0;
    for (String entry : entries) {
      String[] parts = entry.split("=", -1); // -1 keeps the empty value of "key="
      if (parts.length != 2) {
        Platform.get().log("Invalid input: skipping {0} entry {1}", CORRELATION_CONTEXT, entry,
          null);
        continue;
      }
      String key = truncate(parts[0], KEY_MAX_LENGTH).trim();
      if (key.isEmpty()) continue;
      builder.addBaggage(key, truncate(parts[1], VALUE_MAX_LENGTH).trim());
      added++;
    }
    return added;
  }

  CorrelationContextFormat() {
  }
}
