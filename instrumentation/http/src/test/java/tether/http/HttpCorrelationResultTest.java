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

import org.junit.jupiter.api.Test;
import tether.propagation.TraceContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpCorrelationResultTest {
  TraceContext context = TraceContext.newBuilder().traceId(1L).spanId(2L).build();

  @Test void success() {
    HttpCorrelationResult result = HttpCorrelationResult.success("|abc.def");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.errorMessage()).isNull();
    assertThat(result.requestId()).isEqualTo("|abc.def");
    assertThat(result.context()).isNull();
  }

  @Test void success_withContext() {
    HttpCorrelationResult result = HttpCorrelationResult.success(null, context);

    assertThat(result.requestId()).isNull();
    assertThat(result.context()).isSameAs(context);
  }

  @Test void success_nullContext() {
    assertThatThrownBy(() -> HttpCorrelationResult.success(null, null))
      .isInstanceOf(NullPointerException.class);
  }

  @Test void failure() {
    HttpCorrelationResult result = HttpCorrelationResult.failure("rejected");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.errorMessage()).isEqualTo("rejected");
    assertThat(result.requestId()).isNull();
  }

  @Test void failure_blankMessage() {
    assertThatThrownBy(() -> HttpCorrelationResult.failure(" "))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test void testToString() {
    assertThat(HttpCorrelationResult.failure("rejected"))
      .hasToString("HttpCorrelationResult{failure=rejected}");
    assertThat(HttpCorrelationResult.success("|abc"))
      .hasToString("HttpCorrelationResult{success, requestId=|abc}");
  }
}
