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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tether.CorrelationInfo;
import tether.CorrelationInfoAccessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HttpCorrelationTest {
  static final Logger LOG = Logger.getLogger(CorrelationInfo.class.getName());

  @Mock HttpCorrelationAdapter<Object, Object> adapter;
  Object request = new Object(), response = new Object();
  CorrelationInfoAccessor accessor = CorrelationInfoAccessor.newHolder();
  List<LogRecord> logged = new ArrayList<>();
  Handler handler = new Handler() {
    @Override public void publish(LogRecord record) {
      logged.add(record);
    }

    @Override public void flush() {
    }

    @Override public void close() {
    }
  };

  @BeforeEach void addHandler() {
    LOG.addHandler(handler);
  }

  @AfterEach void removeHandler() {
    LOG.removeHandler(handler);
  }

  HttpCorrelation<Object, Object> correlation(HttpCorrelationOptions options) {
    return HttpCorrelation.newBuilder(adapter, accessor).options(options).build();
  }

  @Test void newBuilder_rejectsNull() {
    assertThatThrownBy(() -> HttpCorrelation.newBuilder(null, accessor))
      .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> HttpCorrelation.newBuilder(adapter, null))
      .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> HttpCorrelation.newBuilder(adapter, accessor).options(null))
      .isInstanceOf(NullPointerException.class);
  }

  @Test void options_defaultsToW3C() {
    HttpCorrelation<Object, Object> correlation =
      HttpCorrelation.newBuilder(adapter, accessor).build();

    assertThat(correlation.options().format()).isEqualTo(HttpCorrelationFormat.W3C);
  }

  @Test void trySettingCorrelationFromRequest_nullRequest() {
    HttpCorrelation<Object, Object> correlation = correlation(HttpCorrelationOptions.create());

    assertThatThrownBy(() -> correlation.trySettingCorrelationFromRequest(null, null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("request == null");
  }

  @Test void trySettingCorrelationFromRequest_nullHeadersAreEmpty() {
    when(adapter.requestHeaders(request)).thenReturn(null);

    HttpCorrelationResult result = correlation(HttpCorrelationOptions.create())
      .trySettingCorrelationFromRequest(request, null);

    assertThat(result.isSuccess()).isTrue();
    assertThat(accessor.get().operationParentId()).isNull();
    assertThat(logged)
      .extracting(LogRecord::getLevel)
      .contains(Level.WARNING);
  }

  @Test void route() {
    String traceparent = W3CCorrelationTest.TRACEPARENT;

    assertThat(HttpCorrelation.route(HttpCorrelationFormat.HIERARCHICAL, traceparent))
      .isEqualTo(HttpCorrelation.Route.HIERARCHICAL);
    assertThat(HttpCorrelation.route(HttpCorrelationFormat.W3C, traceparent))
      .isEqualTo(HttpCorrelation.Route.W3C_EXISTING_PARENT);
    assertThat(HttpCorrelation.route(HttpCorrelationFormat.W3C, null))
      .isEqualTo(HttpCorrelation.Route.W3C_NEW_PARENT);
    assertThat(HttpCorrelation.route(HttpCorrelationFormat.W3C, "00-abc"))
      .isEqualTo(HttpCorrelation.Route.W3C_NEW_PARENT);
  }

  @Test void route_unknownFormat() {
    assertThatThrownBy(() -> HttpCorrelation.route(null, null))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("Hierarchical or W3C");
  }

  @Test void setCorrelationHeadersInResponse_rejectsNull() {
    HttpCorrelation<Object, Object> correlation = correlation(HttpCorrelationOptions.create());
    HttpCorrelationResult result = HttpCorrelationResult.success(null);

    assertThatThrownBy(() -> correlation.setCorrelationHeadersInResponse(null, result))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("response == null");
    assertThatThrownBy(() -> correlation.setCorrelationHeadersInResponse(response, null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("result == null");
  }

  @Test void setCorrelationHeadersInResponse_noCorrelationWritesNothing() {
    correlation(HttpCorrelationOptions.create())
      .setCorrelationHeadersInResponse(response, HttpCorrelationResult.failure("rejected"));

    verify(adapter, never()).responseHeader(any(), anyString(), anyString());
    assertThat(logged)
      .extracting(LogRecord::getLevel)
      .containsOnly(Level.WARNING);
  }

  @Test void setCorrelationHeadersInResponse_blankTransactionIsSkipped() {
    accessor.set(CorrelationInfo.create("op-1", " ", null));

    correlation(HttpCorrelationOptions.create())
      .setCorrelationHeadersInResponse(response, HttpCorrelationResult.success(null));

    verify(adapter).responseHeader(response, "RequestId", "op-1");
    verifyNoMoreInteractions(adapter);
  }

  @Test void setCorrelationHeadersInResponse_inclusionOff() {
    accessor.set(CorrelationInfo.create("op-1", "tx-1", "parent-1"));
    HttpCorrelationOptions options = HttpCorrelationOptions.newBuilder()
      .format(HttpCorrelationFormat.HIERARCHICAL)
      .operation(HttpCorrelationOptions.Operation.newBuilder().includeInResponse(false).build())
      .transaction(HttpCorrelationOptions.Transaction.newBuilder().includeInResponse(false).build())
      .upstreamService(HttpCorrelationOptions.UpstreamService.newBuilder()
        .includeInResponse(false).build())
      .build();

    correlation(options)
      .setCorrelationHeadersInResponse(response, HttpCorrelationResult.success("|parent-1"));

    verify(adapter, never()).responseHeader(any(), anyString(), anyString());
  }

  @Test void setCorrelationHeadersInResponse_customHeaderNames() {
    accessor.set(CorrelationInfo.create("op-1", "tx-1", "parent-1"));
    HttpCorrelationOptions options = HttpCorrelationOptions.newBuilder()
      .format(HttpCorrelationFormat.HIERARCHICAL)
      .operation(HttpCorrelationOptions.Operation.newBuilder().headerName("X-Op").build())
      .transaction(HttpCorrelationOptions.Transaction.newBuilder().headerName("X-Tx").build())
      .upstreamService(HttpCorrelationOptions.UpstreamService.newBuilder()
        .headerName("X-Parent").build())
      .build();
    HttpCorrelation<HttpHeaders, Map<String, String>> correlation =
      HttpCorrelation.newBuilder(new FakeAdapter(), accessor).options(options).build();
    Map<String, String> headers = new LinkedHashMap<>();

    correlation.setCorrelationHeadersInResponse(headers,
      HttpCorrelationResult.success("|parent-1"));

    assertThat(headers).containsExactly(
      entry("X-Op", "op-1"),
      entry("X-Parent", "|parent-1"),
      entry("X-Tx", "tx-1")
    );
  }

  @Test void setCorrelationHeadersInResponse_hierarchicalMayUseTraceparent() {
    HttpCorrelationOptions options = HttpCorrelationOptions.newBuilder()
      .format(HttpCorrelationFormat.HIERARCHICAL)
      .upstreamService(HttpCorrelationOptions.UpstreamService.newBuilder()
        .headerName("traceparent").build())
      .build();

    // switching to W3C would write "traceparent" for the upstream ID too
    assertThatThrownBy(() -> options.toBuilder().format(HttpCorrelationFormat.W3C)
      .operation(HttpCorrelationOptions.Operation.newBuilder().headerName("traceparent").build())
      .build())
      .isInstanceOf(IllegalArgumentException.class);

    accessor.set(CorrelationInfo.create("op-1", "tx-1", "parent-1"));
    Map<String, String> headers = new LinkedHashMap<>();
    HttpCorrelation.newBuilder(new FakeAdapter(), accessor).options(options).build()
      .setCorrelationHeadersInResponse(headers, HttpCorrelationResult.success("|parent-1"));

    assertThat(headers).containsOnlyKeys("RequestId", "traceparent", "X-Transaction-ID");
  }

  @Test void upstreamHeaderName() {
    HttpCorrelationOptions.UpstreamService upstream =
      HttpCorrelationOptions.UpstreamService.newBuilder().headerName("X-Parent").build();

    assertThat(correlation(HttpCorrelationOptions.newBuilder()
      .upstreamService(upstream).build()).upstreamHeaderName())
      .isEqualTo("traceparent");
    assertThat(correlation(HttpCorrelationOptions.newBuilder()
      .format(HttpCorrelationFormat.HIERARCHICAL).upstreamService(upstream).build())
      .upstreamHeaderName())
      .isEqualTo("X-Parent");
  }

  @Test void fullRequest_eachHeaderWrittenOnce() {
    HttpHeaders headers = HttpHeaders.newBuilder()
      .add("traceparent", W3CCorrelationTest.TRACEPARENT)
      .build();
    when(adapter.requestHeaders(request)).thenReturn(headers);
    HttpCorrelation<Object, Object> correlation = correlation(HttpCorrelationOptions.create());

    HttpCorrelationResult result = correlation.trySettingCorrelationFromRequest(request, null);
    correlation.setCorrelationHeadersInResponse(response, result);

    verify(adapter).responseHeader(response, "RequestId", accessor.get().operationId());
    verify(adapter).responseHeader(response, "traceparent", W3CCorrelationTest.TRACEPARENT);
    verify(adapter).responseHeader(response, "X-Transaction-ID",
      "4b1c0c8d608f57db7bd0b13c88ef865e");
  }

  @Test void hierarchicalRejection_isLoggedAsError() {
    when(adapter.requestHeaders(request))
      .thenReturn(HttpHeaders.newBuilder().add("X-Transaction-ID", "tx-1").build());
    HttpCorrelationOptions options = HttpCorrelationOptions.newBuilder()
      .format(HttpCorrelationFormat.HIERARCHICAL)
      .transaction(HttpCorrelationOptions.Transaction.newBuilder().allowInRequest(false).build())
      .build();

    HttpCorrelationResult result =
      correlation(options).trySettingCorrelationFromRequest(request, null);

    assertThat(result.isSuccess()).isFalse();
    assertThat(accessor.get()).isNull();
    assertThat(logged)
      .extracting(LogRecord::getLevel)
      .contains(Level.SEVERE);
  }
}
