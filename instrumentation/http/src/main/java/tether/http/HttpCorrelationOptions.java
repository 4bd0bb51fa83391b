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

import tether.IdGenerator;
import tether.IdGenerators;
import tether.propagation.w3c.TraceparentFormat;

import static tether.internal.Strings.isBlank;

/**
 * Controls how {@link HttpCorrelation} reads and writes identifiers. Instances are immutable and
 * can be shared across requests.
 *
 * <p>For example, to reject requests that try to dictate the transaction ID:
 * <pre>{@code
 * options = HttpCorrelationOptions.newBuilder()
 *   .format(HttpCorrelationFormat.HIERARCHICAL)
 *   .transaction(Transaction.newBuilder().allowInRequest(false).build())
 *   .build();
 * }</pre>
 */
public final class HttpCorrelationOptions {
  public static HttpCorrelationOptions create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Defaults to {@link HttpCorrelationFormat#W3C}. */
  public HttpCorrelationFormat format() {
    return format;
  }

  /** How the ID of the request itself is written to the response. */
  public Operation operation() {
    return operation;
  }

  /** How the ID of the end-to-end flow is read, generated and written. */
  public Transaction transaction() {
    return transaction;
  }

  /** How the ID of the calling service is read, generated and written. */
  public UpstreamService upstreamService() {
    return upstreamService;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  final HttpCorrelationFormat format;
  final Operation operation;
  final Transaction transaction;
  final UpstreamService upstreamService;

  HttpCorrelationOptions(Builder builder) {
    this.format = builder.format;
    this.operation = builder.operation;
    this.transaction = builder.transaction;
    this.upstreamService = builder.upstreamService;
  }

  @Override public String toString() {
    return "HttpCorrelationOptions{format=" + format
      + ", operation=" + operation
      + ", transaction=" + transaction
      + ", upstreamService=" + upstreamService
      + "}";
  }

  public static final class Builder {
    HttpCorrelationFormat format;
    Operation operation;
    Transaction transaction;
    UpstreamService upstreamService;

    Builder() {
      this.format = HttpCorrelationFormat.W3C;
      this.operation = Operation.newBuilder().build();
      this.transaction = Transaction.newBuilder().build();
      this.upstreamService = UpstreamService.newBuilder().build();
    }

    Builder(HttpCorrelationOptions source) {
      this.format = source.format;
      this.operation = source.operation;
      this.transaction = source.transaction;
      this.upstreamService = source.upstreamService;
    }

    /** @see HttpCorrelationOptions#format() */
    public Builder format(HttpCorrelationFormat format) {
      if (format == null) throw new NullPointerException("format == null");
      this.format = format;
      return this;
    }

    /** @see HttpCorrelationOptions#operation() */
    public Builder operation(Operation operation) {
      if (operation == null) throw new NullPointerException("operation == null");
      this.operation = operation;
      return this;
    }

    /** @see HttpCorrelationOptions#transaction() */
    public Builder transaction(Transaction transaction) {
      if (transaction == null) throw new NullPointerException("transaction == null");
      this.transaction = transaction;
      return this;
    }

    /** @see HttpCorrelationOptions#upstreamService() */
    public Builder upstreamService(UpstreamService upstreamService) {
      if (upstreamService == null) throw new NullPointerException("upstreamService == null");
      this.upstreamService = upstreamService;
      return this;
    }

    /**
     * @throws IllegalArgumentException if two response headers share a name, compared
     * case-insensitively. In {@link HttpCorrelationFormat#W3C} the upstream header is
     * "traceparent".
     */
    public HttpCorrelationOptions build() {
      String upstreamHeaderName = format == HttpCorrelationFormat.W3C
        ? TraceparentFormat.TRACEPARENT
        : upstreamService.headerName;
      checkDistinct(operation.headerName, transaction.headerName);
      checkDistinct(operation.headerName, upstreamHeaderName);
      checkDistinct(transaction.headerName, upstreamHeaderName);
      return new HttpCorrelationOptions(this);
    }

    static void checkDistinct(String headerName, String otherHeaderName) {
      if (headerName.equalsIgnoreCase(otherHeaderName)) {
        throw new IllegalArgumentException(
          "headerName " + headerName + " is used for more than one ID");
      }
    }
  }

  /** Options for the operation ID, which identifies the current request. */
  public static final class Operation {
    public static Builder newBuilder() {
      return new Builder();
    }

    /** The response header that holds the operation ID. Defaults to "RequestId". */
    public String headerName() {
      return headerName;
    }

    /** Defaults to true. */
    public boolean includeInResponse() {
      return includeInResponse;
    }

    /**
     * Used in {@link HttpCorrelationFormat#HIERARCHICAL} when the host didn't supply a trace
     * identifier. Defaults to {@link IdGenerators#uuid()}.
     */
    public IdGenerator idGenerator() {
      return idGenerator;
    }

    final String headerName;
    final boolean includeInResponse;
    final IdGenerator idGenerator;

    Operation(Builder builder) {
      this.headerName = builder.headerName;
      this.includeInResponse = builder.includeInResponse;
      this.idGenerator = builder.idGenerator;
    }

    @Override public String toString() {
      return "Operation{headerName=" + headerName
        + ", includeInResponse=" + includeInResponse + "}";
    }

    public static final class Builder {
      String headerName = "RequestId";
      boolean includeInResponse = true;
      IdGenerator idGenerator = IdGenerators.uuid();

      Builder() {
      }

      public Builder headerName(String headerName) {
        this.headerName = checkHeaderName(headerName);
        return this;
      }

      public Builder includeInResponse(boolean includeInResponse) {
        this.includeInResponse = includeInResponse;
        return this;
      }

      public Builder idGenerator(IdGenerator idGenerator) {
        if (idGenerator == null) throw new NullPointerException("idGenerator == null");
        this.idGenerator = idGenerator;
        return this;
      }

      public Operation build() {
        return new Operation(this);
      }
    }
  }

  /** Options for the transaction ID, which identifies the end-to-end flow. */
  public static final class Transaction {
    public static Builder newBuilder() {
      return new Builder();
    }

    /** The request and response header that holds the transaction ID. */
    public String headerName() {
      return headerName;
    }

    /**
     * When false, a request that includes the {@link #headerName() transaction header} fails
     * correlation. Defaults to true.
     */
    public boolean allowInRequest() {
      return allowInRequest;
    }

    /** When true, a transaction ID is generated if the request has none. Defaults to true. */
    public boolean generateWhenNotSpecified() {
      return generateWhenNotSpecified;
    }

    /** Defaults to true. */
    public boolean includeInResponse() {
      return includeInResponse;
    }

    /** Defaults to {@link IdGenerators#uuid()}. */
    public IdGenerator idGenerator() {
      return idGenerator;
    }

    final String headerName;
    final boolean allowInRequest, generateWhenNotSpecified, includeInResponse;
    final IdGenerator idGenerator;

    Transaction(Builder builder) {
      this.headerName = builder.headerName;
      this.allowInRequest = builder.allowInRequest;
      this.generateWhenNotSpecified = builder.generateWhenNotSpecified;
      this.includeInResponse = builder.includeInResponse;
      this.idGenerator = builder.idGenerator;
    }

    @Override public String toString() {
      return "Transaction{headerName=" + headerName
        + ", allowInRequest=" + allowInRequest
        + ", generateWhenNotSpecified=" + generateWhenNotSpecified
        + ", includeInResponse=" + includeInResponse + "}";
    }

    public static final class Builder {
      String headerName = "X-Transaction-ID";
      boolean allowInRequest = true, generateWhenNotSpecified = true, includeInResponse = true;
      IdGenerator idGenerator = IdGenerators.uuid();

      Builder() {
      }

      public Builder headerName(String headerName) {
        this.headerName = checkHeaderName(headerName);
        return this;
      }

      public Builder allowInRequest(boolean allowInRequest) {
        this.allowInRequest = allowInRequest;
        return this;
      }

      public Builder generateWhenNotSpecified(boolean generateWhenNotSpecified) {
        this.generateWhenNotSpecified = generateWhenNotSpecified;
        return this;
      }

      public Builder includeInResponse(boolean includeInResponse) {
        this.includeInResponse = includeInResponse;
        return this;
      }

      public Builder idGenerator(IdGenerator idGenerator) {
        if (idGenerator == null) throw new NullPointerException("idGenerator == null");
        this.idGenerator = idGenerator;
        return this;
      }

      public Transaction build() {
        return new Transaction(this);
      }
    }
  }

  /** Options for the ID of the calling service. */
  public static final class UpstreamService {
    public static Builder newBuilder() {
      return new Builder();
    }

    /**
     * The request and response header that holds the caller's request ID in {@link
     * HttpCorrelationFormat#HIERARCHICAL}. In {@link HttpCorrelationFormat#W3C}, the response uses
     * "traceparent" instead. Defaults to "Request-Id".
     */
    public String headerName() {
      return headerName;
    }

    /**
     * When true, the operation parent ID is read from the {@link #headerName() request header}.
     * When false, it is generated. Defaults to true.
     */
    public boolean extractFromRequest() {
      return extractFromRequest;
    }

    /** Defaults to true. */
    public boolean includeInResponse() {
      return includeInResponse;
    }

    /** Used when not {@link #extractFromRequest()}. Defaults to {@link IdGenerators#uuid()}. */
    public IdGenerator idGenerator() {
      return idGenerator;
    }

    final String headerName;
    final boolean extractFromRequest, includeInResponse;
    final IdGenerator idGenerator;

    UpstreamService(Builder builder) {
      this.headerName = builder.headerName;
      this.extractFromRequest = builder.extractFromRequest;
      this.includeInResponse = builder.includeInResponse;
      this.idGenerator = builder.idGenerator;
    }

    @Override public String toString() {
      return "UpstreamService{headerName=" + headerName
        + ", extractFromRequest=" + extractFromRequest
        + ", includeInResponse=" + includeInResponse + "}";
    }

    public static final class Builder {
      String headerName = "Request-Id";
      boolean extractFromRequest = true, includeInResponse = true;
      IdGenerator idGenerator = IdGenerators.uuid();

      Builder() {
      }

      public Builder headerName(String headerName) {
        this.headerName = checkHeaderName(headerName);
        return this;
      }

      public Builder extractFromRequest(boolean extractFromRequest) {
        this.extractFromRequest = extractFromRequest;
        return this;
      }

      public Builder includeInResponse(boolean includeInResponse) {
        this.includeInResponse = includeInResponse;
        return this;
      }

      public Builder idGenerator(IdGenerator idGenerator) {
        if (idGenerator == null) throw new NullPointerException("idGenerator == null");
        this.idGenerator = idGenerator;
        return this;
      }

      public UpstreamService build() {
        return new UpstreamService(this);
      }
    }
  }

  static String checkHeaderName(String headerName) {
    if (headerName == null) throw new NullPointerException("headerName == null");
    if (isBlank(headerName)) throw new IllegalArgumentException("headerName is blank");
    return headerName;
  }
}
