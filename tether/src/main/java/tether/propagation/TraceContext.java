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
package tether.propagation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import tether.internal.Nullable;

import static tether.internal.HexCodec.toLowerHex;
import static tether.internal.HexCodec.writeHexLong;

/**
 * Contains the W3C trace identifiers of a request, along with state that travels with it in
 * process: the opaque {@code tracestate}, tags and baggage.
 *
 * <p>The trace ID is always 128-bit, split into {@link #traceIdHigh()} and {@link #traceId()}.
 */
//@Immutable
public final class TraceContext {
  public static Builder newBuilder() {
    return new Builder();
  }

  /** The upper 8 bytes of the trace ID. */
  public long traceIdHigh() {
    return traceIdHigh;
  }

  /** The lower 8 bytes of the trace ID. */
  public long traceId() {
    return traceId;
  }

  /** Unique 8-byte identifier of this hop in the trace. Never zero. */
  public long spanId() {
    return spanId;
  }

  /** The span ID of the caller or null if this is the root of a trace. */
  @Nullable public Long parentId() {
    return parentId != 0 ? parentId : null;
  }

  /** The inbound {@code tracestate} header, passed through verbatim. */
  @Nullable public String traceState() {
    return traceState;
  }

  /** Unmodifiable tags, in insertion order. */
  public Map<String, String> tags() {
    return tags;
  }

  /** Unmodifiable baggage, in insertion order. */
  public Map<String, String> baggage() {
    return baggage;
  }

  volatile String traceIdString; // Lazily initialized and cached.

  /** Returns the 32 character lower-hex encoded trace ID. */
  public String traceIdString() {
    String r = traceIdString;
    if (r == null) r = traceIdString = toLowerHex(traceIdHigh, traceId);
    return r;
  }

  volatile String spanIdString; // Lazily initialized and cached.

  /** Returns the 16 character lower-hex encoded span ID. */
  public String spanIdString() {
    String r = spanIdString;
    if (r == null) r = spanIdString = toLowerHex(spanId);
    return r;
  }

  /** Returns the 16 character lower-hex encoded parent ID or null if there is none. */
  @Nullable public String parentIdString() {
    return parentId != 0 ? toLowerHex(parentId) : null;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Returns {@code $traceId/$spanId} */
  @Override public String toString() {
    char[] result = new char[3 * 16 + 1]; // 2 ids and the delimiter
    writeHexLong(result, 0, traceIdHigh);
    writeHexLong(result, 16, traceId);
    result[32] = '/';
    writeHexLong(result, 33, spanId);
    return new String(result);
  }

  public static final class Builder {
    long traceIdHigh, traceId, parentId, spanId;
    String traceState;
    LinkedHashMap<String, String> tags, baggage;

    Builder() {
    }

    Builder(TraceContext context) {
      traceIdHigh = context.traceIdHigh;
      traceId = context.traceId;
      parentId = context.parentId;
      spanId = context.spanId;
      traceState = context.traceState;
      if (!context.tags.isEmpty()) tags = new LinkedHashMap<>(context.tags);
      if (!context.baggage.isEmpty()) baggage = new LinkedHashMap<>(context.baggage);
    }

    /** @see TraceContext#traceIdHigh() */
    public Builder traceIdHigh(long traceIdHigh) {
      this.traceIdHigh = traceIdHigh;
      return this;
    }

    /** @see TraceContext#traceId() */
    public Builder traceId(long traceId) {
      this.traceId = traceId;
      return this;
    }

    /** @see TraceContext#parentId() */
    public Builder parentId(long parentId) {
      this.parentId = parentId;
      return this;
    }

    /** @see TraceContext#spanId() */
    public Builder spanId(long spanId) {
      this.spanId = spanId;
      return this;
    }

    /** @see TraceContext#traceState() */
    public Builder traceState(@Nullable String traceState) {
      this.traceState = traceState;
      return this;
    }

    /** Adds or replaces a tag. */
    public Builder addTag(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value == null");
      if (tags == null) tags = new LinkedHashMap<>();
      tags.put(key, value);
      return this;
    }

    /** Adds or replaces a baggage entry. */
    public Builder addBaggage(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value == null");
      if (baggage == null) baggage = new LinkedHashMap<>();
      baggage.put(key, value);
      return this;
    }

    /** Returns true when at least one baggage entry was added. */
    public boolean hasBaggage() {
      return baggage != null && !baggage.isEmpty();
    }

    public TraceContext build() {
      String missing = "";
      if (traceIdHigh == 0L && traceId == 0L) missing += " traceId";
      if (spanId == 0L) missing += " spanId";
      if (!"".equals(missing)) throw new IllegalStateException("Missing:" + missing);
      return new TraceContext(this);
    }
  }

  final long traceIdHigh, traceId, parentId, spanId;
  @Nullable final String traceState;
  final Map<String, String> tags, baggage;

  TraceContext(Builder builder) {
    traceIdHigh = builder.traceIdHigh;
    traceId = builder.traceId;
    parentId = builder.parentId;
    spanId = builder.spanId;
    traceState = builder.traceState;
    tags = ensureImmutable(builder.tags);
    baggage = ensureImmutable(builder.baggage);
  }

  static Map<String, String> ensureImmutable(@Nullable LinkedHashMap<String, String> map) {
    if (map == null || map.isEmpty()) return Collections.emptyMap();
    return Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }

  /** Only includes identifiers, not tags or baggage. */
  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceContext)) return false;
    TraceContext that = (TraceContext) o;
    return (traceIdHigh == that.traceIdHigh)
      && (traceId == that.traceId)
      && (spanId == that.spanId)
      && (parentId == that.parentId);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= (int) ((traceIdHigh >>> 32) ^ traceIdHigh);
    h *= 1000003;
    h ^= (int) ((traceId >>> 32) ^ traceId);
    h *= 1000003;
    h ^= (int) ((spanId >>> 32) ^ spanId);
    h *= 1000003;
    h ^= (int) ((parentId >>> 32) ^ parentId);
    return h;
  }
}
