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

import tether.internal.Nullable;
import tether.propagation.CurrentTraceContext;
import tether.propagation.TraceContext;

import static tether.internal.Strings.isBlank;

/**
 * Outcome of {@link HttpCorrelation#trySettingCorrelationFromRequest}. Pass it to {@link
 * HttpCorrelation#setCorrelationHeadersInResponse} once the response is ready.
 *
 * <p>On failure, the host decides how to respond, typically by rejecting the request.
 */
//@Immutable
public final class HttpCorrelationResult {
  /**
   * @param requestId the upstream request ID to echo in the response, or null if there is none
   */
  public static HttpCorrelationResult success(@Nullable String requestId) {
    return new HttpCorrelationResult(true, null, requestId, null);
  }

  /**
   * Like {@link #success(String)}, except including the W3C trace context started for the
   * request.
   */
  public static HttpCorrelationResult success(@Nullable String requestId, TraceContext context) {
    if (context == null) throw new NullPointerException("context == null");
    return new HttpCorrelationResult(true, null, requestId, context);
  }

  /** @param errorMessage why the request could not be correlated */
  public static HttpCorrelationResult failure(String errorMessage) {
    if (isBlank(errorMessage)) throw new IllegalArgumentException("errorMessage is blank");
    return new HttpCorrelationResult(false, errorMessage, null, null);
  }

  final boolean success;
  @Nullable final String errorMessage, requestId;
  @Nullable final TraceContext context;

  HttpCorrelationResult(boolean success, @Nullable String errorMessage, @Nullable String requestId,
    @Nullable TraceContext context) {
    this.success = success;
    this.errorMessage = errorMessage;
    this.requestId = requestId;
    this.context = context;
  }

  public boolean isSuccess() {
    return success;
  }

  /** Present only when not {@link #isSuccess() successful}. */
  @Nullable public String errorMessage() {
    return errorMessage;
  }

  /**
   * The raw upstream request ID or {@code traceparent} value. This is only used to echo it in the
   * response, it is not a part of the correlation.
   */
  @Nullable public String requestId() {
    return requestId;
  }

  /**
   * The trace context started for this request in {@link HttpCorrelationFormat#W3C}, otherwise
   * null. Place it in scope with {@link CurrentTraceContext#newScope(TraceContext)} so that
   * requests made while processing continue the trace.
   */
  @Nullable public TraceContext context() {
    return context;
  }

  @Override public String toString() {
    if (!success) return "HttpCorrelationResult{failure=" + errorMessage + "}";
    StringBuilder result = new StringBuilder("HttpCorrelationResult{success");
    if (requestId != null) result.append(", requestId=").append(requestId);
    if (context != null) result.append(", context=").append(context);
    return result.append('}').toString();
  }
}
