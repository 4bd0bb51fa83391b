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

import tether.internal.HexCodec;
import tether.internal.Platform;

import static tether.internal.Strings.isBlank;

/** Convenience generators for use in correlation options. */
public final class IdGenerators {
  /** Returns a random UUID in its canonical 36 character form. */
  public static IdGenerator uuid() {
    return Constants.UUID;
  }

  /** Returns 16 lower-hex characters of a non-zero random 64-bit ID. */
  public static IdGenerator randomHex64() {
    return Constants.RANDOM_HEX_64;
  }

  /**
   * Calls the generator and returns its result.
   *
   * @param category used in the exception message, for example "operation"
   * @throws IllegalStateException if the generator returned a blank value
   */
  public static String nextIdOrThrow(IdGenerator generator, String category) {
    String id = generator.nextId();
    if (isBlank(id)) {
      throw new IllegalStateException(
        "Correlation cannot use " + generator + " to generate a " + category
          + " ID because the resulting ID value is blank");
    }
    return id;
  }

  enum Constants implements IdGenerator {
    UUID() {
      @Override public String nextId() {
        return java.util.UUID.randomUUID().toString();
      }

      @Override public String toString() {
        return "UUID.randomUUID()";
      }
    },
    RANDOM_HEX_64() {
      @Override public String nextId() {
        return HexCodec.toLowerHex(Platform.get().nextId());
      }

      @Override public String toString() {
        return "RandomHex64";
      }
    }
  }

  IdGenerators() {
  }
}
