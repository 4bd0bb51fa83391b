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

/** The protocol used to correlate requests. Only one is active at a time. */
public enum HttpCorrelationFormat {
  /**
   * W3C trace-context: the {@code traceparent} header carries the trace ID and the caller's span
   * ID.
   */
  W3C,
  /** Legacy correlation with a transaction header and a dotted {@code Request-Id} header. */
  HIERARCHICAL
}
