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
 * Persisted state violates an invariant the catalog relies on, for example a row that references
 * a missing project or a stored value that no longer parses. Signals corrupt data, not a transient
 * backend failure.
 */
public final class DatabaseIntegrityError extends CatalogException
    implements ErrorStack<DatabaseIntegrityError>,
        CatalogListWarehousesError.Source,
        CatalogGetWarehouseByIdError.Source {

  private final String detailMessage;

  public DatabaseIntegrityError(String message) {
    super("Database integrity error: " + Objects.requireNonNull(message, "message"));
    this.detailMessage = message;
  }

  public DatabaseIntegrityError(String message, Throwable cause) {
    super("Database integrity error: " + Objects.requireNonNull(message, "message"), cause);
    this.detailMessage = message;
  }

  public String detailMessage() {
    return detailMessage;
  }

  @Override
  public ErrorModel toErrorModel() {
    return errorModel("DatabaseIntegrityError", ErrorModel.INTERNAL_SERVER_ERROR);
  }

  @Override
  protected String summary() {
    return "DatabaseIntegrityError: " + detailMessage;
  }
}
