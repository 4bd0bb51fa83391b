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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import tether.internal.Nullable;

import static tether.internal.Strings.isBlank;

/**
 * Immutable snapshot of request headers, looked up case-insensitively.
 *
 * <p>Names are kept in arrival order. When the same name arrives with different case, the first
 * one wins.
 */
public final class HttpHeaders {
  public static final HttpHeaders EMPTY = new HttpHeaders(Collections.emptyList());

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Copies a header map, such as the one of a servlet or JAX-RS request. */
  public static HttpHeaders of(Map<String, ? extends Collection<String>> headers) {
    if (headers == null) throw new NullPointerException("headers == null");
    Builder builder = newBuilder();
    for (Map.Entry<String, ? extends Collection<String>> entry : headers.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) continue;
      for (String value : entry.getValue()) {
        builder.add(entry.getKey(), value);
      }
    }
    return builder.build();
  }

  /**
   * Returns the value of the first header matching the name case-insensitively, or null if it is
   * absent or blank. Multiple values are joined with a comma.
   */
  @Nullable public String value(String name) {
    if (name == null) throw new NullPointerException("name == null");
    for (int i = 0, length = entries.size(); i < length; i++) {
      Entry entry = entries.get(i);
      if (!entry.name.equalsIgnoreCase(name)) continue;
      String result = entry.values.size() == 1
        ? entry.values.get(0)
        : String.join(",", entry.values);
      return isBlank(result) ? null : result;
    }
    return null;
  }

  /**
   * Returns the values of the first header matching the name case-insensitively, each split on
   * comma and trimmed. Blank entries are dropped, and an absent header returns an empty list.
   */
  public List<String> values(String name) {
    if (name == null) throw new NullPointerException("name == null");
    for (int i = 0, length = entries.size(); i < length; i++) {
      Entry entry = entries.get(i);
      if (!entry.name.equalsIgnoreCase(name)) continue;
      List<String> result = new ArrayList<>();
      for (String value : entry.values) {
        for (String item : value.split(",")) {
          if (!isBlank(item)) result.add(item.trim());
        }
      }
      return Collections.unmodifiableList(result);
    }
    return Collections.emptyList();
  }

  /** Returns true when there are no headers. */
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  final List<Entry> entries;

  HttpHeaders(List<Entry> entries) {
    this.entries = entries;
  }

  @Override public String toString() {
    StringBuilder result = new StringBuilder("HttpHeaders{");
    for (int i = 0, length = entries.size(); i < length; i++) {
      if (i > 0) result.append(", ");
      Entry entry = entries.get(i);
      result.append(entry.name).append('=').append(entry.values);
    }
    return result.append('}').toString();
  }

  public static final class Builder {
    final List<Entry> entries = new ArrayList<>();

    Builder() {
    }

    /** Adds a value, appending to existing values of the same name regardless of case. */
    public Builder add(String name, String value) {
      if (name == null) throw new NullPointerException("name == null");
      if (value == null) throw new NullPointerException("value == null");
      for (Entry entry : entries) {
        if (entry.name.equalsIgnoreCase(name)) {
          entry.values.add(value);
          return this;
        }
      }
      Entry entry = new Entry(name);
      entry.values.add(value);
      entries.add(entry);
      return this;
    }

    public HttpHeaders build() {
      if (entries.isEmpty()) return EMPTY;
      List<Entry> copy = new ArrayList<>(entries.size());
      for (Entry entry : entries) {
        Entry immutable = new Entry(entry.name, Collections.unmodifiableList(
          new ArrayList<>(entry.values)));
        copy.add(immutable);
      }
      return new HttpHeaders(Collections.unmodifiableList(copy));
    }
  }

  static final class Entry {
    final String name;
    final List<String> values;

    Entry(String name) {
      this(name, new ArrayList<>(1));
    }

    Entry(String name, List<String> values) {
      this.name = name;
      this.values = values;
    }
  }
}
