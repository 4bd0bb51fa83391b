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

import tether.CorrelationInfo;
import tether.CorrelationInfoAccessor;
import tether.internal.Nullable;
import tether.internal.Platform;
import tether.propagation.CurrentTraceContext;
import tether.propagation.w3c.TraceparentFormat;

import static tether.internal.Strings.isBlank;

/**
 * Correlates an incoming request, then writes the correlation headers to its response.
 *
 * <p>Typical use in a filter:
 * <pre>{@code
 * HttpCorrelationResult result =
 *   correlation.trySettingCorrelationFromRequest(request, request.getRequestId());
 * if (!result.isSuccess()) {
 *   response.sendError(400, result.errorMessage());
 *   return;
 * }
 * try {
 *   chain.doFilter(request, response);
 * } finally {
 *   correlation.setCorrelationHeadersInResponse(response, result);
 * }
 * }</pre>
 *
 * <p>This type is stateless apart from its collaborators. The {@link CorrelationInfoAccessor}
 * must resolve the storage of the request being processed, for example by using request
 * attributes, or a new instance of this type is created per request.
 *
 * @param <Req> the native request type of the HTTP library
 * @param <Resp> the native response type of the HTTP library
 */
public final class HttpCorrelation<Req, Resp> {
  public static <Req, Resp> Builder<Req, Resp> newBuilder(
    HttpCorrelationAdapter<Req, Resp> adapter, CorrelationInfoAccessor accessor) {
    return new Builder<>(adapter, accessor);
  }

  /** The paths a request can take. Exactly one applies per request. */
  enum Route {
    HIERARCHICAL,
    /** W3C without a usable {@code traceparent}: start a new trace. */
    W3C_NEW_PARENT,
    /** W3C with a compliant {@code traceparent}: continue the caller's trace. */
    W3C_EXISTING_PARENT
  }

  final HttpCorrelationOptions options;
  final HttpCorrelationAdapter<Req, Resp> adapter;
  final CorrelationInfoAccessor accessor;
  final W3CCorrelation w3c;
  final HierarchicalCorrelation hierarchical;

  HttpCorrelation(Builder<Req, Resp> builder) {
    this.options = builder.options;
    this.adapter = builder.adapter;
    this.accessor = builder.accessor;
    this.w3c = new W3CCorrelation(accessor, builder.currentTraceContext);
    this.hierarchical =
      new HierarchicalCorrelation(options, accessor, builder.requestIdFormat);
  }

  public HttpCorrelationOptions options() {
    return options;
  }

  /**
   * Correlates the request according to the {@linkplain HttpCorrelationOptions options}. On
   * success, the resulting {@link CorrelationInfo} is set into the accessor.
   *
   * <p>This is only half of the correlation. Once the response is ready, pass the result to
   * {@link #setCorrelationHeadersInResponse(Object, HttpCorrelationResult)}.
   *
   * @param request the incoming request
   * @param traceIdentifier identifies the request in the host, for example a request ID assigned
   * by the server. When present, it is the operation ID in {@link HttpCorrelationFormat#HIERARCHICAL}.
   * @throws IllegalStateException if the format is unknown or an ID generator returned blank
   */
  public HttpCorrelationResult trySettingCorrelationFromRequest(Req request,
    @Nullable String traceIdentifier) {
    if (request == null) throw new NullPointerException("request == null");

    HttpHeaders headers = adapter.requestHeaders(request);
    if (headers == null) {
      Platform.get().warn("No HTTP request headers could be determined from incoming request, "
        + "please verify the adapter {0} was correctly implemented", adapter);
      headers = HttpHeaders.EMPTY;
    }

    String traceparent = headers.value(TraceparentFormat.TRACEPARENT);
    switch (route(options.format(), traceparent)) {
      case HIERARCHICAL:
        return hierarchical.correlate(headers, traceIdentifier);
      case W3C_EXISTING_PARENT:
        return w3c.correlateForExistingParent(headers, traceparent);
      case W3C_NEW_PARENT:
        return w3c.correlateForNewParent(headers);
      default:
        throw new AssertionError();
    }
  }

  static Route route(@Nullable HttpCorrelationFormat format, @Nullable String traceparent) {
    if (format == HttpCorrelationFormat.HIERARCHICAL) return Route.HIERARCHICAL;
    if (format == HttpCorrelationFormat.W3C) {
      return TraceparentFormat.isValid(traceparent)
        ? Route.W3C_EXISTING_PARENT
        : Route.W3C_NEW_PARENT;
    }
    throw new IllegalStateException("Could not determine which type of HTTP correlation system "
      + "to use (Hierarchical or W3C); we recommend to use W3C instead of the deprecated "
      + "Hierarchical correlation system");
  }

  /**
   * Writes the correlation headers that are configured for the response and have a value. A
   * missing value is logged, not thrown.
   *
   * @param response the outgoing response
   * @param result the result of {@link #trySettingCorrelationFromRequest(Object, String)} for the
   * same request
   */
  public void setCorrelationHeadersInResponse(Resp response, HttpCorrelationResult result) {
    if (response == null) throw new NullPointerException("response == null");
    if (result == null) throw new NullPointerException("result == null");

    CorrelationInfo correlationInfo = accessor.get();
    Platform platform = Platform.get();

    HttpCorrelationOptions.Operation operation = options.operation();
    if (operation.includeInResponse()) {
      String operationId = correlationInfo != null ? correlationInfo.operationId() : null;
      if (isBlank(operationId)) {
        platform.warn("No response header {0} was added given no operation ID was found",
          operation.headerName());
      } else {
        adapter.responseHeader(response, operation.headerName(), operationId);
      }
    }

    HttpCorrelationOptions.UpstreamService upstream = options.upstreamService();
    if (upstream.includeInResponse()) {
      String headerName = upstreamHeaderName();
      String requestId = result.requestId();
      if (isBlank(requestId)) {
        platform.warn("No response header {0} was added given no operation parent ID was found",
          headerName);
      } else {
        adapter.responseHeader(response, headerName, requestId);
      }
    }

    HttpCorrelationOptions.Transaction transaction = options.transaction();
    if (transaction.includeInResponse()) {
      String transactionId = correlationInfo != null ? correlationInfo.transactionId() : null;
      if (isBlank(transactionId)) {
        platform.warn("No response header {0} was added given no transaction ID was found",
          transaction.headerName());
      } else {
        adapter.responseHeader(response, transaction.headerName(), transactionId);
      }
    }
  }

  String upstreamHeaderName() {
    switch (options.format()) {
      case HIERARCHICAL:
        return options.upstreamService().headerName();
      case W3C:
        return TraceparentFormat.TRACEPARENT;
      default:
        throw new IllegalStateException("Unknown HTTP correlation format: " + options.format());
    }
  }

  @Override public String toString() {
    return "HttpCorrelation{options=" + options + ", adapter=" + adapter + "}";
  }

  public static final class Builder<Req, Resp> {
    final HttpCorrelationAdapter<Req, Resp> adapter;
    final CorrelationInfoAccessor accessor;
    HttpCorrelationOptions options = HttpCorrelationOptions.create();
    CurrentTraceContext currentTraceContext;
    RequestIdFormat requestIdFormat = RequestIdFormat.INSTANCE;

    Builder(HttpCorrelationAdapter<Req, Resp> adapter, CorrelationInfoAccessor accessor) {
      if (adapter == null) throw new NullPointerException("adapter == null");
      if (accessor == null) throw new NullPointerException("accessor == null");
      this.adapter = adapter;
      this.accessor = accessor;
    }

    /** Defaults to {@link HttpCorrelationOptions#create()}. */
    public Builder<Req, Resp> options(HttpCorrelationOptions options) {
      if (options == null) throw new NullPointerException("options == null");
      this.options = options;
      return this;
    }

    /**
     * When set, a W3C trace started for a request copies the tags and baggage of the context in
     * scope. Defaults to none.
     */
    public Builder<Req, Resp> currentTraceContext(CurrentTraceContext currentTraceContext) {
      if (currentTraceContext == null) {
        throw new NullPointerException("currentTraceContext == null");
      }
      this.currentTraceContext = currentTraceContext;
      return this;
    }

    Builder<Req, Resp> requestIdFormat(RequestIdFormat requestIdFormat) {
      this.requestIdFormat = requestIdFormat;
      return this;
    }

    public HttpCorrelation<Req, Resp> build() {
      return new HttpCorrelation<>(this);
    }
  }
}
