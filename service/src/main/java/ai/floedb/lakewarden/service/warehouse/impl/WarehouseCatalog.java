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
package ai.floedb.lakewarden.service.warehouse.impl;

import ai.floedb.lakewarden.catalog.error.CatalogBackendError;
import ai.floedb.lakewarden.catalog.error.CatalogCreateWarehouseError;
import ai.floedb.lakewarden.catalog.error.CatalogDeleteWarehouseError;
import ai.floedb.lakewarden.catalog.error.CatalogGetWarehouseByIdError;
import ai.floedb.lakewarden.catalog.error.CatalogListWarehousesError;
import ai.floedb.lakewarden.catalog.error.CatalogOperationError;
import ai.floedb.lakewarden.catalog.error.CatalogRenameWarehouseError;
import ai.floedb.lakewarden.catalog.error.CatalogSetWarehouseProtectionError;
import ai.floedb.lakewarden.catalog.error.CatalogSetWarehouseStatusError;
import ai.floedb.lakewarden.catalog.error.CatalogUpdateStorageProfileError;
import ai.floedb.lakewarden.catalog.error.WarehouseIdNotFound;
import ai.floedb.lakewarden.catalog.model.DeleteWarehouseQuery;
import ai.floedb.lakewarden.catalog.model.GetStorageConfigResponse;
import ai.floedb.lakewarden.catalog.model.GetWarehouseResponse;
import ai.floedb.lakewarden.catalog.model.ProjectId;
import ai.floedb.lakewarden.catalog.model.SecretIdent;
import ai.floedb.lakewarden.catalog.model.StorageProfile;
import ai.floedb.lakewarden.catalog.model.TabularDeleteProfile;
import ai.floedb.lakewarden.catalog.model.WarehouseId;
import ai.floedb.lakewarden.catalog.model.WarehouseStatus;
import ai.floedb.lakewarden.catalog.spi.CatalogState;
import ai.floedb.lakewarden.catalog.spi.CatalogTransaction;
import ai.floedb.lakewarden.catalog.spi.WarehouseCatalogStore;
import ai.floedb.lakewarden.service.common.LogHelper;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Warehouse lifecycle operations on top of a backend store.
 *
 * <p>Mutations stage their writes in the caller's transaction; the caller commits or rolls back.
 * Every failure leaves as the operation's error type with the operation context appended to its
 * stack exactly once. Failures outside the operation's set of domain errors are reported as
 * unexpected backend errors. Nothing is retried here.
 *
 * @param <S> read state of the backend
 * @param <T> transaction type of the backend
 */
public class WarehouseCatalog<S extends CatalogState, T extends CatalogTransaction<S>> {
  private static final Logger LOG = Logger.getLogger(WarehouseCatalog.class);

  private static final Set<WarehouseStatus> DEFAULT_LIST_STATUSES = Set.of(WarehouseStatus.ACTIVE);

  private final WarehouseCatalogStore<S, T> store;

  public WarehouseCatalog(WarehouseCatalogStore<S, T> store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  public WarehouseId createWarehouse(
      String warehouseName,
      ProjectId projectId,
      StorageProfile storageProfile,
      TabularDeleteProfile tabularDeleteProfile,
      SecretIdent storageSecretId,
      T transaction) {
    var L = LogHelper.start(LOG, "CreateWarehouse");
    try {
      WarehouseId id =
          store.createWarehouse(
              warehouseName,
              projectId,
              storageProfile,
              tabularDeleteProfile,
              Optional.ofNullable(storageSecretId),
              transaction);
      L.okf("warehouse_id=%s name=%s project_id=%s", id, warehouseName, projectId);
      return id;
    } catch (RuntimeException e) {
      throw failed(
          L,
          CatalogCreateWarehouseError.from(
              e instanceof CatalogCreateWarehouseError.Source s
                  ? s
                  : CatalogBackendError.unexpected(e)));
    }
  }

  public void deleteWarehouse(WarehouseId warehouseId, DeleteWarehouseQuery query, T transaction) {
    var L = LogHelper.start(LOG, "DeleteWarehouse");
    DeleteWarehouseQuery q = query == null ? DeleteWarehouseQuery.defaults() : query;
    try {
      store.deleteWarehouse(warehouseId, q, transaction);
      L.okf("warehouse_id=%s force=%s", warehouseId, q.force());
    } catch (RuntimeException e) {
      throw failed(
          L,
          CatalogDeleteWarehouseError.from(
              e instanceof CatalogDeleteWarehouseError.Source s
                  ? s
                  : CatalogBackendError.unexpected(e)));
    }
  }

  public void renameWarehouse(WarehouseId warehouseId, String newName, T transaction) {
    var L = LogHelper.start(LOG, "RenameWarehouse");
    try {
      store.renameWarehouse(warehouseId, newName, transaction);
      L.okf("warehouse_id=%s name=%s", warehouseId, newName);
    } catch (RuntimeException e) {
      throw failed(
          L,
          CatalogRenameWarehouseError.from(
              e instanceof CatalogRenameWarehouseError.Source s
                  ? s
                  : CatalogBackendError.unexpected(e)));
    }
  }

  /** Active warehouses of the project. */
  public List<GetWarehouseResponse> listWarehouses(ProjectId projectId, S state) {
    return listWarehouses(projectId, null, state);
  }

  /**
   * Warehouses of the project whose status is in {@code statuses}. {@code null} lists active
   * warehouses only; an empty set matches nothing.
   */
  public List<GetWarehouseResponse> listWarehouses(
      ProjectId projectId, Set<WarehouseStatus> statuses, S state) {
    var L = LogHelper.start(LOG, "ListWarehouses");
    Set<WarehouseStatus> filter = statuses == null ? DEFAULT_LIST_STATUSES : Set.copyOf(statuses);
    try {
      List<GetWarehouseResponse> warehouses = store.listWarehouses(projectId, filter, state);
      L.okf("project_id=%s count=%d", projectId, warehouses.size());
      return warehouses;
    } catch (RuntimeException e) {
      throw failed(
          L,
          CatalogListWarehousesError.from(
              e instanceof CatalogListWarehousesError.Source s
                  ? s
                  : CatalogBackendError.unexpected(e)));
    }
  }

  /** The warehouse if it exists and is active. */
  public Optional<GetWarehouseResponse> getWarehouseById(WarehouseId warehouseId, S state) {
    var L = LogHelper.start(LOG, "GetWarehouse");
    Optional<GetWarehouseResponse> warehouse = lookup(L, warehouseId, state);
    L.okf("warehouse_id=%s found=%s", warehouseId, warehouse.isPresent());
    return warehouse;
  }

  /** Like {@link #getWarehouseById} but fails with {@link WarehouseIdNotFound} when absent. */
  public GetWarehouseResponse requireWarehouseById(WarehouseId warehouseId, S state) {
    var L = LogHelper.start(LOG, "RequireWarehouse");
    GetWarehouseResponse warehouse = require(L, warehouseId, state);
    L.okf("warehouse_id=%s", warehouseId);
    return warehouse;
  }

  public GetStorageConfigResponse getStorageConfig(WarehouseId warehouseId, S state) {
    var L = LogHelper.start(LOG, "GetStorageConfig");
    GetStorageConfigResponse config = require(L, warehouseId, state).storageConfig();
    L.okf("warehouse_id=%s type=%s", warehouseId, config.storageProfile().type());
    return config;
  }

  public void setWarehouseStatus(WarehouseId warehouseId, WarehouseStatus status, T transaction) {
    var L = LogHelper.start(LOG, "SetWarehouseStatus");
    try {
      store.setWarehouseStatus(warehouseId, status, transaction);
      L.okf("warehouse_id=%s status=%s", warehouseId, status);
    } catch (RuntimeException e) {
      throw failed(
          L,
          CatalogSetWarehouseStatusError.from(
              e instanceof CatalogSetWarehouseStatusError.Source s
                  ? s
                  : CatalogBackendError.unexpected(e)));
    }
  }

  public GetWarehouseResponse setWarehouseDeletionProtection(
      WarehouseId warehouseId, boolean protectedFromDeletion, T transaction) {
    var L = LogHelper.start(LOG, "SetWarehouseDeletionProtection");
    try {
      GetWarehouseResponse warehouse =
          store.setWarehouseDeletionProtection(warehouseId, protectedFromDeletion, transaction);
      L.okf("warehouse_id=%s protected=%s", warehouseId, protectedFromDeletion);
      return warehouse;
    } catch (RuntimeException e) {
      throw failed(
          L,
          CatalogSetWarehouseProtectionError.from(
              e instanceof CatalogSetWarehouseProtectionError.Source s
                  ? s
                  : CatalogBackendError.unexpected(e)));
    }
  }

  public void updateStorageProfile(
      WarehouseId warehouseId,
      StorageProfile storageProfile,
      SecretIdent storageSecretId,
      T transaction) {
    var L = LogHelper.start(LOG, "UpdateStorageProfile");
    try {
      store.updateStorageProfile(
          warehouseId, storageProfile, Optional.ofNullable(storageSecretId), transaction);
      L.okf("warehouse_id=%s type=%s", warehouseId, storageProfile.type());
    } catch (RuntimeException e) {
      throw failed(
          L,
          CatalogUpdateStorageProfileError.from(
              e instanceof CatalogUpdateStorageProfileError.Source s
                  ? s
                  : CatalogBackendError.unexpected(e)));
    }
  }

  private Optional<GetWarehouseResponse> lookup(LogHelper L, WarehouseId warehouseId, S state) {
    try {
      return store.getWarehouse(warehouseId, state);
    } catch (RuntimeException e) {
      throw failed(
          L,
          CatalogGetWarehouseByIdError.from(
              e instanceof CatalogGetWarehouseByIdError.Source s
                  ? s
                  : CatalogBackendError.unexpected(e)));
    }
  }

  private GetWarehouseResponse require(LogHelper L, WarehouseId warehouseId, S state) {
    Optional<GetWarehouseResponse> warehouse = lookup(L, warehouseId, state);
    if (warehouse.isEmpty()) {
      throw failed(L, CatalogGetWarehouseByIdError.from(new WarehouseIdNotFound(warehouseId)));
    }
    return warehouse.get();
  }

  private static <E extends CatalogOperationError> E failed(LogHelper L, E error) {
    L.fail(error, error.toErrorModel().code());
    return error;
  }
}
