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

import tether.internal.Nullable;

/**
 * Holds the {@link CorrelationInfo} of one in-flight request. The host owns the lifecycle: one
 * instance per request, never shared across requests.
 *
 * <p>Correlation sets the value at most once per request. This contract is not enforced.
 */
public interface CorrelationInfoAccessor {
  /** Returns the correlation of the current request or null if it was not yet set. */
  @Nullable CorrelationInfo get();

  void set(CorrelationInfo correlationInfo);

  /** Returns a plain holder for hosts that don't have their own request scoped storage. */
  static CorrelationInfoAccessor newHolder() {
    return new Holder();
  }

  final class Holder implements CorrelationInfoAccessor {
    volatile CorrelationInfo correlationInfo;

    Holder() {
    }

    @Override public CorrelationInfo get() {
      return correlationInfo;
    }

    @Override public void set(CorrelationInfo correlationInfo) {
      if (correlationInfo == null) throw new NullPointerException("correlationInfo == null");
      this.correlationInfo = correlationInfo;
    }

    @Override public String toString() {
      return "CorrelationInfoHolder{" + correlationInfo + "}";
    }
  }
}
