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
package tether.internal;

public final class Strings {
  /** Returns true when the input is null, empty or only whitespace. */
  public static boolean isBlank(@Nullable String value) {
    return value == null || value.isBlank();
  }

  /** Returns the input when it is at most {@code maxLength} characters, otherwise a prefix. */
  public static String truncate(String value, int maxLength) {
    if (value.length() <= maxLength) return value;
    return value.substring(0, maxLength);
  }

  Strings() {
  }
}
