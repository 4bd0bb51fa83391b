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

import java.util.Map;
import tether.CorrelationInfo;
import tether.CorrelationInfoAccessor;
import tether.internal.Nullable;
import tether.internal.Platform;
import tether.propagation.CurrentTraceContext;
import tether.propagation.TraceContext;
import tether.propagation.w3c.CorrelationContextFormat;
import tether.propagation.w3c.TraceparentFormat;

/** Correlates a request that uses W3C trace-context. */
final class W3CCorrelation {
  static final String TRACESTATE = "tracestate";

  final CorrelationInfoAccessor accessor;
  @Nullable final CurrentTraceContext currentTraceContext;

  W3CCorrelation(CorrelationInfoAccessor accessor,
    @Nullable CurrentTraceContext currentTraceContext) {
    this.accessor = accessor;
    this.currentTraceContext = currentTraceContext;
  }

  /** Starts a new trace as there was no usable {@code traceparent}. */
  HttpCorrelationResult correlateForNewParent(HttpHeaders headers) {
    Platform platform = Platform.get();
    TraceContext context = newContextBuilder(headers)
      .traceIdHigh(platform.nextId())
      .traceId(platform.nextId())
      .spanId(platform.nextId())
      .build();

    String transactionId = context.traceIdString();
    platform.log("Correlation transaction ID {0} generated for incoming HTTP request",
      transactionId, null);
    String operationId = context.spanIdString();
    platform.log("Correlation operation ID {0} generated for incoming HTTP request",
      operationId, null);

    accessor.set(CorrelationInfo.create(operationId, transactionId, null));
    return HttpCorrelationResult.success(null, context);
  }

  /**
   * Continues the trace of the caller. The input passed {@link TraceparentFormat#isValid}.
   *
   * <p>Format example: {@code 00-4b1c0c8d608f57db7bd0b13c88ef865e-4c6893cc6c6cad10-00}
   */
  HttpCorrelationResult correlateForExistingParent(HttpHeaders headers, String traceparent) {
    TraceContext parent = TraceparentFormat.parseTraceparentFormat(traceparent);
    if (parent == null) {
      return HttpCorrelationResult.failure(
        "No correlation transaction or operation parent ID could be read from the '"
          + TraceparentFormat.TRACEPARENT + "' request header as they are not lower-hex");
    }

    TraceContext context = newContextBuilder(headers)
      .traceIdHigh(parent.traceIdHigh())
      .traceId(parent.traceId())
      .parentId(parent.spanId())
      .spanId(nextChildId(parent.spanId()))
      .build();

    Platform platform = Platform.get();
    String transactionId = context.traceIdString();
    platform.log("Correlation transaction ID {0} found in traceparent HTTP request header",
      transactionId, null);
    String operationParentId = context.parentIdString();
    platform.log("Correlation operation parent ID {0} found in traceparent HTTP request header",
      operationParentId, null);

    String operationId = context.spanIdString();
    platform.log("Correlation operation ID {0} generated for incoming HTTP request",
      operationId, null);

    accessor.set(CorrelationInfo.create(operationId, transactionId, operationParentId));
    return HttpCorrelationResult.success(traceparent, context);
  }

  /**
   * Copies tags and baggage from the context already in scope, if any. Without baggage in scope,
   * the baggage is read from the {@code Correlation-Context} header.
   */
  TraceContext.Builder newContextBuilder(HttpHeaders headers) {
    TraceContext.Builder builder = TraceContext.newBuilder()
      .traceState(headers.value(TRACESTATE));

    TraceContext current = currentTraceContext != null ? currentTraceContext.get() : null;
    if (current != null) {
      for (Map.Entry<String, String> tag : current.tags().entrySet()) {
        builder.addTag(tag.getKey(), tag.getValue());
      }
      for (Map.Entry<String, String> entry : current.baggage().entrySet()) {
        builder.addBaggage(entry.getKey(), entry.getValue());
      }
    }

    if (!builder.hasBaggage()) {
      CorrelationContextFormat.parseCorrelationContext(
        headers.values(CorrelationContextFormat.CORRELATION_CONTEXT), builder);
    }
    return builder;
  }

  /** The span ID of this hop must differ from the caller's. */
  static long nextChildId(long parentId) {
    long spanId = Platform.get().nextId();
    while (spanId == parentId) spanId = Platform.get().nextId();
    return spanId;
  }
}
