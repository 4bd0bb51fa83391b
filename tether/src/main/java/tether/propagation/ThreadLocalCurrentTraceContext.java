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

import tether.internal.Nullable;

/**
 * In-process trace context propagation backed by a thread local owned by this instance.
 *
 * <p>Unlike a static thread local, two instances never see each other's contexts. Share one
 * instance across the components that should observe the same scope.
 */
public final class ThreadLocalCurrentTraceContext extends CurrentTraceContext {
  public static ThreadLocalCurrentTraceContext create() {
    return new ThreadLocalCurrentTraceContext();
  }

  /**
   * Call this to clear the reference when you are sure any residual state is due to a leak. This
   * is generally only useful in tests.
   */
  public void clear() {
    local.remove();
  }

  @SuppressWarnings("ThreadLocalUsage") // one scope stack per instance
  final ThreadLocal<TraceContext> local = new ThreadLocal<>();

  ThreadLocalCurrentTraceContext() {
  }

  @Override public TraceContext get() {
    return local.get();
  }

  /** The returned scope restores whatever context this one replaced, which may be null. */
  @Override public Scope newScope(@Nullable TraceContext context) {
    TraceContext previous = local.get();
    local.set(context);
    if (previous == null) return local::remove;
    return () -> local.set(previous);
  }

  @Override public String toString() {
    return "ThreadLocalCurrentTraceContext{}";
  }
}
