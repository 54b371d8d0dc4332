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

/** Failure of activating or deactivating a warehouse. */
public final class CatalogSetWarehouseStatusError extends CatalogOperationError
    implements ErrorStack<CatalogSetWarehouseStatusError> {

  public static final String ERROR_STACK = "Error setting warehouse status in catalog";

  /** Domain errors this operation can fail with. */
  public sealed interface Source extends CatalogFailure
      permits CatalogBackendError,
          WarehouseIdNotFound {}

  private CatalogSetWarehouseStatusError(Source source) {
    super(source, ERROR_STACK);
  }

  /** Wraps {@code source} and appends {@link #ERROR_STACK} to its stack. */
  public static CatalogSetWarehouseStatusError from(Source source) {
    return new CatalogSetWarehouseStatusError(source);
  }

  @Override
  public Source source() {
    return (Source) super.source();
  }
}
