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

/**
 * Reads headers from the request type of an HTTP library and writes them to its response type.
 *
 * <p>For example, a servlet adapter:
 * <pre>{@code
 * class ServletAdapter extends HttpCorrelationAdapter<HttpServletRequest, HttpServletResponse> {
 *   @Override public HttpHeaders requestHeaders(HttpServletRequest request) {
 *     HttpHeaders.Builder result = HttpHeaders.newBuilder();
 *     for (String name : Collections.list(request.getHeaderNames())) {
 *       for (String value : Collections.list(request.getHeaders(name))) result.add(name, value);
 *     }
 *     return result.build();
 *   }
 *
 *   @Override public void responseHeader(HttpServletResponse response, String name, String value) {
 *     response.setHeader(name, value);
 *   }
 * }
 * }</pre>
 *
 * @param <Req> the native request type of the HTTP library
 * @param <Resp> the native response type of the HTTP library
 */
public abstract class HttpCorrelationAdapter<Req, Resp> {
  /**
   * Returns all headers of the request. A null result is logged and treated as {@link
   * HttpHeaders#EMPTY}.
   */
  @Nullable public abstract HttpHeaders requestHeaders(Req request);

  /**
   * Sets a response header. Called at most once per name by {@link
   * HttpCorrelation#setCorrelationHeadersInResponse}, and never with a blank value.
   */
  public abstract void responseHeader(Resp response, String name, String value);
}
