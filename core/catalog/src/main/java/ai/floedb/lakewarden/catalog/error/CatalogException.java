/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.floedb.lakewarden.catalog.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of the domain errors. Holds the context stack and implements the append operations
 * once for every subtype; the typed chaining variants come from {@link ErrorStack}.
 */
public abstract class CatalogException extends RuntimeException implements CatalogFailure {

  private final List<String> stack = new ArrayList<>();
  private boolean wrapped;

  protected CatalogException(String message) {
    super(message);
  }

  protected CatalogException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public final List<String> stack() {
    return Collections.unmodifiableList(stack);
  }

  @Override
  public final void addDetail(String detail) {
    stack.add(Objects.requireNonNull(detail, "detail"));
  }

  @Override
  public final void addDetails(Iterable<String> details) {
    for (String detail : details) {
      addDetail(detail);
    }
  }

  /** Marks this error as the source of an operation error; false if it already is one. */
  final boolean markWrapped() {
    if (wrapped) {
      return false;
    }
    wrapped = true;
    return true;
  }

  @Override
  public final RuntimeException asException() {
    return this;
  }

  /**
   * Operator-facing rendering: the summary line followed by the context stack. Not the wire
   * representation, see {@link #toErrorModel()}.
   */
  public String render() {
    var sb = new StringBuilder(summary()).append('\n');
    appendStack(sb, stack);
    return sb.toString();
  }

  protected String summary() {
    return getMessage();
  }

  protected ErrorModel errorModel(String type, int code) {
    return ErrorModel.of(type, code, getMessage(), stack);
  }

  static void appendStack(StringBuilder sb, List<String> stack) {
    if (stack.isEmpty()) {
      return;
    }
    sb.append("Stack:\n");
    for (String detail : stack) {
      sb.append("  ").append(detail).append('\n');
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    var other = (CatalogException) obj;
    return stack.equals(other.stack) && Objects.equals(getMessage(), other.getMessage());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), stack, getMessage());
  }
}
