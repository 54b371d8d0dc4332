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

import ai.floedb.lakewarden.catalog.model.DeleteWarehouseQuery;
import ai.floedb.lakewarden.catalog.model.GetWarehouseResponse;
import ai.floedb.lakewarden.catalog.model.ProjectId;
import ai.floedb.lakewarden.catalog.model.SecretIdent;
import ai.floedb.lakewarden.catalog.model.StorageProfile;
import ai.floedb.lakewarden.catalog.model.TabularDeleteProfile;
import ai.floedb.lakewarden.catalog.model.WarehouseId;
import ai.floedb.lakewarden.catalog.model.WarehouseStatus;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Warehouse persistence implemented by a storage backend.
 *
 * <p>Implementations report failures by throwing the domain errors of the
 * {@code ai.floedb.lakewarden.catalog.error} package that the matching operation error permits,
 * and {@link ai.floedb.lakewarden.catalog.error.CatalogBackendError} for anything else they can
 * classify. They do not add context details; the calling service does.
 *
 * @param <S> read state of the backend
 * @param <T> transaction type of the backend
 */
public interface WarehouseCatalogStore<S extends CatalogState, T extends CatalogTransaction<S>> {

  /**
   * Stages a new active warehouse. Name uniqueness and project existence are checked within
   * {@code transaction}.
   */
  WarehouseId createWarehouse(
      String warehouseName,
      ProjectId projectId,
      StorageProfile storageProfile,
      TabularDeleteProfile tabularDeleteProfile,
      Optional<SecretIdent> storageSecretId,
      T transaction);

  /**
   * Checks the delete guards within {@code transaction} and stages the removal. Guards are
   * evaluated in this order: unfinished tasks, protection, emptiness.
   */
  void deleteWarehouse(WarehouseId warehouseId, DeleteWarehouseQuery query, T transaction);

  void renameWarehouse(WarehouseId warehouseId, String newName, T transaction);

  /** Warehouses of the project whose status is in {@code statuses}, ordered by name. */
  List<GetWarehouseResponse> listWarehouses(
      ProjectId projectId, Set<WarehouseStatus> statuses, S state);

  /** The warehouse if it exists and is active. */
  Optional<GetWarehouseResponse> getWarehouse(WarehouseId warehouseId, S state);

  void setWarehouseStatus(WarehouseId warehouseId, WarehouseStatus status, T transaction);

  GetWarehouseResponse setWarehouseDeletionProtection(
      WarehouseId warehouseId, boolean protectedFromDeletion, T transaction);

  void updateStorageProfile(
      WarehouseId warehouseId,
      StorageProfile storageProfile,
      Optional<SecretIdent> storageSecretId,
      T transaction);
}
