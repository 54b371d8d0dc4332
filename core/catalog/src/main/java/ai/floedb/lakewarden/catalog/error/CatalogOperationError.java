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

import java.util.List;
import java.util.Objects;

/**
 * Failure of one lifecycle operation. Wraps exactly one domain error from the operation's closed
 * source set; the stack, message and protocol mapping are those of the wrapped error.
 *
 * <p>The operation context is appended to the source's own stack, so a domain error can be the
 * source of one operation error only. Wrapping it a second time fails with {@link
 * IllegalStateException}.
 */
public abstract class CatalogOperationError extends RuntimeException implements CatalogFailure {

  private final CatalogFailure source;

  protected CatalogOperationError(CatalogFailure source, String context) {
    super(
        Objects.requireNonNull(source, "source").asException().getMessage(),
        source.asException());
    if (source instanceof CatalogException domain && !domain.markWrapped()) {
      throw new IllegalStateException(
          "Error is already the source of an operation error: " + domain.getMessage());
    }
    source.addDetail(context);
    this.source = source;
  }

  public CatalogFailure source() {
    return source;
  }

  @Override
  public List<String> stack() {
    return source.stack();
  }

  @Override
  public void addDetail(String detail) {
    source.addDetail(detail);
  }

  @Override
  public void addDetails(Iterable<String> details) {
    source.addDetails(details);
  }

  @Override
  public ErrorModel toErrorModel() {
    return source.toErrorModel();
  }

  @Override
  public RuntimeException asException() {
    return this;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    return source.equals(((CatalogOperationError) obj).source);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), source);
  }
}
