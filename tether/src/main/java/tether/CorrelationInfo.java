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
package tether;

import tether.internal.Nullable;

import static tether.internal.Strings.isBlank;

/**
 * Identifiers that tie a request to the distributed flow it belongs to.
 *
 * <p>One instance is created per request, then read by application code and when writing
 * response headers. Instances are never mutated.
 */
//@Immutable
public final class CorrelationInfo {
  /**
   * @param operationId identity of the current request, not blank
   * @param transactionId identity of the end-to-end flow, or null if it wasn't supplied or
   * generated
   * @param operationParentId identity of the calling service, or null if there was none
   * @throws IllegalArgumentException if the operation ID is blank
   */
  public static CorrelationInfo create(String operationId, @Nullable String transactionId,
    @Nullable String operationParentId) {
    if (isBlank(operationId)) throw new IllegalArgumentException("operationId is blank");
    return new CorrelationInfo(operationId, transactionId, operationParentId);
  }

  final String operationId;
  @Nullable final String transactionId, operationParentId;

  CorrelationInfo(String operationId, @Nullable String transactionId,
    @Nullable String operationParentId) {
    this.operationId = operationId;
    this.transactionId = transactionId;
    this.operationParentId = operationParentId;
  }

  /** Identifies the request being processed. Never blank. */
  public String operationId() {
    return operationId;
  }

  /** Identifies the end-to-end flow this request is a part of. */
  @Nullable public String transactionId() {
    return transactionId;
  }

  /** Identifies the immediate caller of this request, when known. */
  @Nullable public String operationParentId() {
    return operationParentId;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof CorrelationInfo)) return false;
    CorrelationInfo that = (CorrelationInfo) o;
    return operationId.equals(that.operationId)
      && (transactionId == null
      ? that.transactionId == null : transactionId.equals(that.transactionId))
      && (operationParentId == null
      ? that.operationParentId == null : operationParentId.equals(that.operationParentId));
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= operationId.hashCode();
    h *= 1000003;
    h ^= transactionId == null ? 0 : transactionId.hashCode();
    h *= 1000003;
    h ^= operationParentId == null ? 0 : operationParentId.hashCode();
    return h;
  }

  @Override public String toString() {
    StringBuilder result = new StringBuilder("CorrelationInfo{operationId=").append(operationId);
    if (transactionId != null) result.append(", transactionId=").append(transactionId);
    if (operationParentId != null) {
      result.append(", operationParentId=").append(operationParentId);
    }
    return result.append('}').toString();
  }
}
