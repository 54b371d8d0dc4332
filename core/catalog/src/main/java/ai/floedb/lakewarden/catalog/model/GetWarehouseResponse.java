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
package ai.floedb.lakewarden.catalog.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a warehouse record.
 *
 * @param id ID of the warehouse
 * @param name name of the warehouse, unique within its project
 * @param projectId project in which the warehouse is created
 * @param storageProfile storage profile used for the warehouse
 * @param storageSecretId storage secret used for the warehouse, if any
 * @param status whether the warehouse is active
 * @param tabularDeleteProfile delete profile used for tables and views of the warehouse
 * @param protectedFromDeletion whether the warehouse is protected from being deleted
 */
public record GetWarehouseResponse(
    WarehouseId id,
    String name,
    ProjectId projectId,
    StorageProfile storageProfile,
    Optional<SecretIdent> storageSecretId,
    WarehouseStatus status,
    TabularDeleteProfile tabularDeleteProfile,
    boolean protectedFromDeletion) {

  public GetWarehouseResponse {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(storageProfile, "storageProfile");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(tabularDeleteProfile, "tabularDeleteProfile");
    storageSecretId = storageSecretId == null ? Optional.empty() : storageSecretId;
  }

  public boolean isActive() {
    return status == WarehouseStatus.ACTIVE;
  }

  public GetStorageConfigResponse storageConfig() {
    return new GetStorageConfigResponse(storageProfile, storageSecretId);
  }
}
