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
package tether.http;

import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import tether.internal.Nullable;
import tether.internal.Platform;

import static tether.internal.Strings.isBlank;

/**
 * Validates and parses the hierarchical request ID, for example "|abc.def".
 *
 * <p>The grammar has nested repetition, so an adversarial header could take exponential time to
 * reject. Matching is bounded by a deadline which, when exceeded, counts as no match.
 */
final class RequestIdFormat {
  static final Pattern REQUEST_ID =
    Pattern.compile("^(\\|)?([a-zA-Z0-9\\-]+(\\.[a-zA-Z0-9\\-]+)?)+(_|\\.)?$");
  static final long DEFAULT_TIMEOUT_NANOS = TimeUnit.SECONDS.toNanos(1);

  static final RequestIdFormat INSTANCE = new RequestIdFormat(DEFAULT_TIMEOUT_NANOS);

  final long timeoutNanos;

  RequestIdFormat(long timeoutNanos) {
    this.timeoutNanos = timeoutNanos;
  }

  /** Returns true if the request ID matches the grammar before the deadline. */
  boolean matches(String requestId, String headerName) {
    try {
      return REQUEST_ID.matcher(new DeadlineCharSequence(requestId, timeoutNanos)).matches();
    } catch (MatchTimeoutException e) {
      Platform.get().log("Upstream service {0} header was timed-out during validation",
        headerName, e);
      return false;
    }
  }

  /**
   * Returns the ID after the last '.', ignoring blank segments, or the input without leading '|'
   * characters when there is no '.'.
   */
  @Nullable static String parseOperationParentId(String requestId) {
    if (requestId.indexOf('.') != -1) {
      String[] ids = requestId.split("\\.");
      for (int i = ids.length - 1; i >= 0; i--) {
        if (!isBlank(ids[i])) return ids[i];
      }
      return null;
    }
    int begin = 0;
    while (begin < requestId.length() && requestId.charAt(begin) == '|') begin++;
    return requestId.substring(begin);
  }

  /** Checks the clock while the regex engine reads characters, which it does as it backtracks. */
  static final class DeadlineCharSequence implements CharSequence {
    final CharSequence delegate;
    final long deadlineNanos;

    DeadlineCharSequence(CharSequence delegate, long timeoutNanos) {
      this(delegate, System.nanoTime(), timeoutNanos);
    }

    DeadlineCharSequence(CharSequence delegate, long startNanos, long timeoutNanos) {
      this.delegate = delegate;
      this.deadlineNanos = startNanos + timeoutNanos;
    }

    @Override public char charAt(int index) {
      if (System.nanoTime() - deadlineNanos >= 0) throw new MatchTimeoutException();
      return delegate.charAt(index);
    }

    @Override public int length() {
      return delegate.length();
    }

    @Override public CharSequence subSequence(int start, int end) {
      return new DeadlineCharSequence(delegate.subSequence(start, end), deadlineNanos, 0L);
    }

    @Override public String toString() {
      return delegate.toString();
    }
  }

  static final class MatchTimeoutException extends RuntimeException {
    MatchTimeoutException() {
      super("regular expression match timed out", null, false, false);
    }
  }
}
