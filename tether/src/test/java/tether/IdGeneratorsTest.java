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

import java.util.LinkedHashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdGeneratorsTest {
  @Test void uuid_isCanonical() {
    assertThat(IdGenerators.uuid().nextId())
      .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
  }

  @Test void randomHex64_isLowerHex() {
    assertThat(IdGenerators.randomHex64().nextId())
      .matches("[0-9a-f]{16}")
      .isNotEqualTo("0000000000000000");
  }

  @Test void randomHex64_doesNotRepeat() {
    Set<String> ids = new LinkedHashSet<>();
    for (int i = 0; i < 10_000; i++) {
      ids.add(IdGenerators.randomHex64().nextId());
    }
    assertThat(ids).hasSize(10_000);
  }

  @Test void nextIdOrThrow_returnsGeneratedId() {
    assertThat(IdGenerators.nextIdOrThrow(() -> "abc", "operation")).isEqualTo("abc");
  }

  @Test void nextIdOrThrow_blankIsConfigurationError() {
    assertThatThrownBy(() -> IdGenerators.nextIdOrThrow(() -> " ", "transaction"))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("transaction ID");
    assertThatThrownBy(() -> IdGenerators.nextIdOrThrow(() -> null, "operation"))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("operation ID");
  }
}
