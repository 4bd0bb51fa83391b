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
package tether.propagation.w3c;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import tether.propagation.TraceContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static tether.propagation.w3c.CorrelationContextFormat.parseCorrelationContext;

class CorrelationContextFormatTest {
  TraceContext.Builder builder = TraceContext.newBuilder().traceId(1L).spanId(1L);

  @Test void parse_pairs() {
    assertThat(parseCorrelationContext("user=alice, region = eu-west", builder)).isEqualTo(2);

    assertThat(builder.build().baggage())
      .containsExactly(entry("user", "alice"), entry("region", "eu-west"));
  }

  @Test void parse_absent() {
    assertThat(parseCorrelationContext((String) null, builder)).isZero();
    assertThat(parseCorrelationContext("", builder)).isZero();
    assertThat(builder.hasBaggage()).isFalse();
  }

  @Test void parse_skipsEntriesWithoutExactlyOneSeparator() {
    assertThat(parseCorrelationContext("novalue,a=b=c,ok=1", builder)).isEqualTo(1);

    assertThat(builder.build().baggage()).containsExactly(entry("ok", "1"));
  }

  @Test void parse_entries() {
    assertThat(parseCorrelationContext(Arrays.asList("user=alice", "region=eu", "bad"), builder))
      .isEqualTo(2);

    assertThat(builder.build().baggage())
      .containsExactly(entry("user", "alice"), entry("region", "eu"));
  }

  @Test void parse_emptyValue() {
    parseCorrelationContext("key=", builder);

    assertThat(builder.build().baggage()).containsExactly(entry("key", ""));
  }

  @Test void parse_skipsBlankKey() {
    assertThat(parseCorrelationContext(" =value", builder)).isZero();
  }

  @Test void parse_truncatesBeforeTrimming() {
    String longKey = "k".repeat(60);
    String longValue = "v".repeat(2000);

    parseCorrelationContext(longKey + "=" + longValue, builder);

    assertThat(builder.build().baggage())
      .containsExactly(entry("k".repeat(50), "v".repeat(1024)));
  }
}
