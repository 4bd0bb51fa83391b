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

/**
 * Creates a new identifier for one category of correlation: operation, transaction or upstream
 * service.
 *
 * <p>Implementations must return a non-blank value. A blank or null result is a configuration
 * error: correlation of the request fails with an {@link IllegalStateException}.
 *
 * @see IdGenerators
 */
@FunctionalInterface
public interface IdGenerator {
  /** Returns a new, globally unique identifier. */
  String nextId();
}
