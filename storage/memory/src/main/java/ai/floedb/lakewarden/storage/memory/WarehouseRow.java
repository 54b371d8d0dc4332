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
package ai.floedb.lakewarden.storage.memory;

import ai.floedb.lakewarden.catalog.model.ProjectId;
import ai.floedb.lakewarden.catalog.model.SecretIdent;
import ai.floedb.lakewarden.catalog.model.TabularDeleteProfile;
import ai.floedb.lakewarden.catalog.model.WarehouseId;
import ai.floedb.lakewarden.catalog.model.WarehouseStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Persisted form of a warehouse. The storage profile is kept as its own JSON document so that a
 * profile that cannot be written is told apart from any other encoding failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record WarehouseRow(
    @JsonProperty("warehouse-id") WarehouseId id,
    @JsonProperty("warehouse-name") String name,
    @JsonProperty("project-id") ProjectId projectId,
    @JsonProperty("storage-profile") String storageProfileJson,
    @JsonProperty("storage-secret-id") SecretIdent storageSecretId,
    @JsonProperty("status") WarehouseStatus status,
    @JsonProperty("tabular-delete-profile") TabularDeleteProfile tabularDeleteProfile,
    @JsonProperty("protected") boolean protectedFromDeletion) {

  WarehouseRow {
    Objects.requireNonNull(id, "warehouse-id");
    Objects.requireNonNull(name, "warehouse-name");
    Objects.requireNonNull(projectId, "project-id");
    Objects.requireNonNull(storageProfileJson, "storage-profile");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(tabularDeleteProfile, "tabular-delete-profile");
  }

  WarehouseRow withName(String newName) {
    return new WarehouseRow(
        id,
        newName,
        projectId,
        storageProfileJson,
        storageSecretId,
        status,
        tabularDeleteProfile,
        protectedFromDeletion);
  }

  WarehouseRow withStatus(WarehouseStatus newStatus) {
    return new WarehouseRow(
        id,
        name,
        projectId,
        storageProfileJson,
        storageSecretId,
        newStatus,
        tabularDeleteProfile,
        protectedFromDeletion);
  }

  WarehouseRow withProtection(boolean newProtected) {
    return new WarehouseRow(
        id,
        name,
        projectId,
        storageProfileJson,
        storageSecretId,
        status,
        tabularDeleteProfile,
        newProtected);
  }

  WarehouseRow withStorage(String newStorageProfileJson, SecretIdent newStorageSecretId) {
    return new WarehouseRow(
        id,
        name,
        projectId,
        newStorageProfileJson,
        newStorageSecretId,
        status,
        tabularDeleteProfile,
        protectedFromDeletion);
  }
}
