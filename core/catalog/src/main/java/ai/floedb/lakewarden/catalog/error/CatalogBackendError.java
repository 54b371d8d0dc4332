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

import java.util.Objects;

/**
 * A failure of the storage backend, classified as either unexpected or a concurrent
 * modification. The original failure is kept as cause for diagnostics and is not exposed on the
 * wire.
 */
public final class CatalogBackendError extends CatalogException
    implements ErrorStack<CatalogBackendError>,
        CatalogCreateWarehouseError.Source,
        CatalogDeleteWarehouseError.Source,
        CatalogRenameWarehouseError.Source,
        CatalogListWarehousesError.Source,
        CatalogGetWarehouseByIdError.Source,
        CatalogSetWarehouseStatusError.Source,
        CatalogSetWarehouseProtectionError.Source,
        CatalogUpdateStorageProfileError.Source {

  private final CatalogBackendErrorType type;
  private final Throwable source;

  private CatalogBackendError(Throwable source, CatalogBackendErrorType type) {
    super("Catalog backend error (" + type + "): " + describe(source), source);
    this.type = Objects.requireNonNull(type, "type");
    this.source = source;
  }

  private static String describe(Throwable source) {
    String message = Objects.requireNonNull(source, "source").getMessage();
    return message == null || message.isBlank() ? source.toString() : message;
  }

  public static CatalogBackendError classify(Throwable source, CatalogBackendErrorType type) {
    return new CatalogBackendError(source, type);
  }

  public static CatalogBackendError unexpected(Throwable source) {
    return new CatalogBackendError(source, CatalogBackendErrorType.UNEXPECTED);
  }

  public static CatalogBackendError concurrentModification(Throwable source) {
    return new CatalogBackendError(source, CatalogBackendErrorType.CONCURRENT_MODIFICATION);
  }

  public CatalogBackendErrorType type() {
    return type;
  }

  public Throwable source() {
    return source;
  }

  public boolean isRetryable() {
    return type == CatalogBackendErrorType.CONCURRENT_MODIFICATION;
  }

  @Override
  public ErrorModel toErrorModel() {
    // 503 would fit better, but older Iceberg clients retry 503 on their own, which repeats
    // side effects of non-idempotent requests.
    int code =
        switch (type) {
          case UNEXPECTED -> ErrorModel.INTERNAL_SERVER_ERROR;
          case CONCURRENT_MODIFICATION -> ErrorModel.CONFLICT;
        };
    return errorModel("CatalogBackendError", code);
  }

  @Override
  protected String summary() {
    return "CatalogBackendError (" + type + "): " + source;
  }

  @Override
  public String render() {
    var sb = new StringBuilder(summary()).append('\n');
    appendStack(sb, stack());
    Throwable cause = source.getCause();
    if (cause != null) {
      sb.append("Caused by:\n");
      ErrorChains.appendChain(sb, cause);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CatalogBackendError other)) {
      return false;
    }
    return type == other.type
        && stack().equals(other.stack())
        && source.toString().equals(other.source.toString());
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, stack(), source.toString());
  }
}
