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

import java.io.Closeable;
import tether.internal.Nullable;

/**
 * This makes a given trace context the current one by placing it in scope (usually but not always
 * a thread local scope).
 *
 * <p>Instances are owned by the caller and passed explicitly to the components that read the
 * current context. Correlation uses it to copy tags and baggage of a trace already in progress in
 * this process into the context of a new request.
 *
 * <h3>Design</h3>
 *
 * This design was inspired by com.google.instrumentation.trace.ContextUtils,
 * com.google.inject.servlet.RequestScoper and com.github.kristofa.brave.CurrentSpan
 */
public abstract class CurrentTraceContext {
  /** Returns the current context in scope or null if there isn't one. */
  public abstract @Nullable TraceContext get();

  /**
   * Sets the current context in scope until the returned object is closed. It is a programming
   * error to drop or never close the result. Using try-with-resources is preferred for this
   * reason.
   *
   * @param context context to place into scope or null to clear the scope
   */
  public abstract Scope newScope(@Nullable TraceContext context);

  /**
   * Like {@link #newScope(TraceContext)}, except returns {@link Scope#NOOP} if the given context is
   * already in scope.
   */
  public Scope maybeScope(@Nullable TraceContext context) {
    TraceContext current = get();
    if (context == null) {
      if (current == null) return Scope.NOOP;
      return newScope(null);
    }
    return context.equals(current) ? Scope.NOOP : newScope(context);
  }

  /** A context in scope. Closing reverts to the prior context. */
  public interface Scope extends Closeable {
    /** Returned when {@link #maybeScope(TraceContext)} detected scope redundancy. */
    Scope NOOP = new Scope() {
      @Override public void close() {
      }

      @Override public String toString() {
        return "NoopScope";
      }
    };

    /** No exceptions are thrown when unbinding a context scope. */
    @Override void close();
  }
}
