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

import tether.internal.Nullable;
import tether.internal.Platform;
import tether.propagation.TraceContext;

import static tether.internal.HexCodec.isLowerHex;
import static tether.internal.HexCodec.lenientLowerHexToUnsignedLong;
import static tether.internal.HexCodec.writeHexLong;

/** Implements https://w3c.github.io/trace-context/#traceparent-header */
public final class TraceparentFormat {
  /** The header name, which is lowercase on the wire. */
  public static final String TRACEPARENT = "traceparent";
  /** Version '00' is fixed length. */
  public static final int FORMAT_LENGTH = 3 + 32 + 1 + 16 + 3; // 00-traceid128-spanid-01

  static final int TRACE_ID_INDEX = 3, PARENT_ID_INDEX = 3 + 32 + 1;

  /**
   * Returns true when the input is exactly {@link #FORMAT_LENGTH} characters and starts with a
   * lower-hex version that isn't the reserved "ff".
   *
   * <p>This is a gate for continuing a trace, not a full parse. Failing it means the header is
   * treated as absent. See {@link #parseTraceparentFormat(CharSequence)} for the identifiers.
   */
  public static boolean isValid(@Nullable CharSequence traceparent) {
    if (traceparent == null || traceparent.length() != FORMAT_LENGTH) return false;
    char v0 = traceparent.charAt(0), v1 = traceparent.charAt(1);
    if (!isLowerHex(v0) || !isLowerHex(v1)) return false;
    // 8-bit unsigned 255 is disallowed https://w3c.github.io/trace-context/#version
    return v0 != 'f' || v1 != 'f';
  }

  /**
   * Parses the trace ID and the caller's span ID of a value that passed {@link
   * #isValid(CharSequence)}. The result's {@linkplain TraceContext#spanId() span ID} is the
   * caller's, so a new hop must be a child of it.
   *
   * @return null, after logging, if either ID is not lower-hex or all zeros
   */
  @Nullable public static TraceContext parseTraceparentFormat(CharSequence traceparent) {
    if (traceparent.length() < FORMAT_LENGTH) {
      Platform.get().log("Invalid input: {0} is too short", TRACEPARENT, null);
      return null;
    }

    long traceIdHigh = lenientLowerHexToUnsignedLong(traceparent, TRACE_ID_INDEX, 19);
    long traceId = lenientLowerHexToUnsignedLong(traceparent, 19, 35);
    if (traceIdHigh == 0L && traceId == 0L) {
      // lenient parsing returns zero on invalid characters, so this also catches bad input
      logInvalid(traceparent, "trace ID");
      return null;
    }
    if ((traceIdHigh == 0L && !isZeros(traceparent, TRACE_ID_INDEX, 19))
      || (traceId == 0L && !isZeros(traceparent, 19, 35))) {
      logInvalid(traceparent, "trace ID");
      return null;
    }

    long parentId = lenientLowerHexToUnsignedLong(traceparent, PARENT_ID_INDEX, 52);
    if (parentId == 0L) {
      logInvalid(traceparent, "parent ID");
      return null;
    }

    return TraceContext.newBuilder()
      .traceIdHigh(traceIdHigh)
      .traceId(traceId)
      .spanId(parentId)
      .build();
  }

  /** Writes the identifiers of the context as an unsampled, version 00 {@code traceparent}. */
  public static String writeTraceparentFormat(TraceContext context) {
    char[] result = new char[FORMAT_LENGTH];
    int pos = 0;
    result[pos++] = '0';
    result[pos++] = '0';
    result[pos++] = '-';
    writeHexLong(result, pos, context.traceIdHigh());
    pos += 16;
    writeHexLong(result, pos, context.traceId());
    pos += 16;
    result[pos++] = '-';
    writeHexLong(result, pos, context.spanId());
    pos += 16;
    result[pos++] = '-';
    result[pos++] = '0';
    result[pos] = '0';
    return new String(result);
  }

  static boolean isZeros(CharSequence input, int beginIndex, int endIndex) {
    for (int i = beginIndex; i < endIndex; i++) {
      if (input.charAt(i) != '0') return false;
    }
    return true;
  }

  static void logInvalid(CharSequence traceparent, String field) {
    Platform.get().log("Invalid input: {0} in traceparent {1} is not lower-hex or all zeros",
      field, traceparent, null);
  }

  TraceparentFormat() {
  }
}
