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
import tether.IdGenerators;
import tether.internal.Nullable;
import tether.internal.Platform;

import static tether.internal.Strings.isBlank;

/** Correlates a request that uses a transaction header and a dotted request ID header. */
final class HierarchicalCorrelation {
  final HttpCorrelationOptions options;
  final CorrelationInfoAccessor accessor;
  final RequestIdFormat requestIdFormat;

  HierarchicalCorrelation(HttpCorrelationOptions options, CorrelationInfoAccessor accessor,
    RequestIdFormat requestIdFormat) {
    this.options = options;
    this.accessor = accessor;
    this.requestIdFormat = requestIdFormat;
  }

  HttpCorrelationResult correlate(HttpHeaders headers, @Nullable String traceIdentifier) {
    HttpCorrelationOptions.Transaction transaction = options.transaction();
    String presentTransactionId = headers.value(transaction.headerName());
    if (presentTransactionId != null) {
      if (!transaction.allowInRequest()) {
        Platform.get().error(
          "No correlation request header {0} for transaction ID was allowed in request",
          transaction.headerName());
        return HttpCorrelationResult.failure("No correlation transaction ID request header '"
          + transaction.headerName() + "' was allowed in the request");
      }
      Platform.get().log("Correlation request header {0} found with transaction ID {1}",
        transaction.headerName(), presentTransactionId, null);
    }

    String operationId = determineOperationId(traceIdentifier);
    String transactionId = determineTransactionId(presentTransactionId);
    String operationParentId = null, requestId = null;

    HttpCorrelationOptions.UpstreamService upstream = options.upstreamService();
    if (upstream.extractFromRequest()) {
      requestId = requestId(headers, upstream.headerName());
      if (requestId != null) {
        operationParentId = RequestIdFormat.parseOperationParentId(requestId);
        Platform.get().log("Extracted operation parent ID {0} from request ID {1}",
          operationParentId, requestId, null);
      }
    } else {
      operationParentId = IdGenerators.nextIdOrThrow(upstream.idGenerator(), "operation parent");
      requestId = operationParentId;
    }

    accessor.set(CorrelationInfo.create(operationId, transactionId, operationParentId));
    return HttpCorrelationResult.success(requestId);
  }

  String determineOperationId(@Nullable String traceIdentifier) {
    if (!isBlank(traceIdentifier)) {
      Platform.get().log("Found unique trace identifier {0} for operation correlation ID",
        traceIdentifier, null);
      return traceIdentifier;
    }

    Platform.get().log("No unique trace identifier was found in the request, generating one", null);
    String operationId =
      IdGenerators.nextIdOrThrow(options.operation().idGenerator(), "operation");
    Platform.get().log("Generated {0} as unique operation correlation ID", operationId, null);
    return operationId;
  }

  @Nullable String determineTransactionId(@Nullable String presentTransactionId) {
    if (presentTransactionId != null) return presentTransactionId;

    HttpCorrelationOptions.Transaction transaction = options.transaction();
    if (!transaction.generateWhenNotSpecified()) {
      Platform.get().log("No transaction ID found in request header {0} and generation is off",
        transaction.headerName(), null);
      return null;
    }

    String transactionId = IdGenerators.nextIdOrThrow(transaction.idGenerator(), "transaction");
    Platform.get().log("Generated {0} as transactional correlation ID", transactionId, null);
    return transactionId;
  }

  /** Returns the upstream header value if it matches the request ID format, or null. */
  @Nullable String requestId(HttpHeaders headers, String headerName) {
    String value = headers.value(headerName);
    if (value != null && requestIdFormat.matches(value, headerName)) {
      Platform.get().log("Found operation parent ID {0} from upstream service in header {1}",
        value, headerName, null);
      return value;
    }
    Platform.get().log("No operation parent ID found from upstream service in header {0} that "
      + "matches the expected format: |Guid.", headerName, null);
    return null;
  }
}
