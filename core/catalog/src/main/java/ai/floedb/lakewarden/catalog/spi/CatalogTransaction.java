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
package ai.floedb.lakewarden.catalog.spi;

/**
 * Open transaction of a backend, owned by the caller. Lifecycle operations stage their writes in
 * it but never commit or roll it back.
 *
 * @param <S> the backend state the transaction was opened on
 */
public interface CatalogTransaction<S extends CatalogState> extends AutoCloseable {
  S state();

  /**
   * Makes all staged writes visible atomically.
   *
   * @throws ai.floedb.lakewarden.catalog.error.CatalogBackendError when the commit fails, with
   *     type {@code CONCURRENT_MODIFICATION} if another writer changed data this transaction read
   */
  void commit();

  /** Discards staged writes. Idempotent. */
  void rollback();

  boolean isOpen();

  /** Rolls back unless already committed. */
  @Override
  default void close() {
    if (isOpen()) {
      rollback();
    }
  }
}
