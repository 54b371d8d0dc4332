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

import ai.floedb.lakewarden.catalog.error.CatalogBackendError;
import ai.floedb.lakewarden.catalog.error.DatabaseIntegrityError;
import ai.floedb.lakewarden.catalog.error.ProjectIdNotFoundError;
import ai.floedb.lakewarden.catalog.error.StorageProfileSerializationError;
import ai.floedb.lakewarden.catalog.error.WarehouseAlreadyExists;
import ai.floedb.lakewarden.catalog.error.WarehouseHasUnfinishedTasks;
import ai.floedb.lakewarden.catalog.error.WarehouseIdNotFound;
import ai.floedb.lakewarden.catalog.error.WarehouseNotEmpty;
import ai.floedb.lakewarden.catalog.error.WarehouseProtected;
import ai.floedb.lakewarden.catalog.model.DeleteWarehouseQuery;
import ai.floedb.lakewarden.catalog.model.GetWarehouseResponse;
import ai.floedb.lakewarden.catalog.model.ProjectId;
import ai.floedb.lakewarden.catalog.model.SecretIdent;
import ai.floedb.lakewarden.catalog.model.StorageProfile;
import ai.floedb.lakewarden.catalog.model.TabularDeleteProfile;
import ai.floedb.lakewarden.catalog.model.WarehouseId;
import ai.floedb.lakewarden.catalog.model.WarehouseStatus;
import ai.floedb.lakewarden.catalog.spi.WarehouseCatalogStore;
import ai.floedb.lakewarden.catalog.spi.WarehousePurgeListener;
import ai.floedb.lakewarden.storage.errors.CorruptionException;
import ai.floedb.lakewarden.storage.errors.NameConflictException;
import ai.floedb.lakewarden.storage.spi.Pointer;
import ai.floedb.lakewarden.storage.spi.PointerStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

public class InMemoryWarehouseCatalogStore
    implements WarehouseCatalogStore<InMemoryCatalogState, InMemoryTransaction> {
  private static final Logger LOG = Logger.getLogger(InMemoryWarehouseCatalogStore.class);
  private static final int SCAN_PAGE = 200;

  private final WarehousePurgeListener purgeListener;

  public InMemoryWarehouseCatalogStore() {
    this(WarehousePurgeListener.NOOP);
  }

  public InMemoryWarehouseCatalogStore(WarehousePurgeListener purgeListener) {
    this.purgeListener = Objects.requireNonNull(purgeListener, "purgeListener");
  }

  @Override
  public WarehouseId createWarehouse(
      String warehouseName,
      ProjectId projectId,
      StorageProfile storageProfile,
      TabularDeleteProfile tabularDeleteProfile,
      Optional<SecretIdent> storageSecretId,
      InMemoryTransaction tx) {
    Objects.requireNonNull(warehouseName, "warehouseName");
    if (tx.read(WarehouseKeys.projectKey(projectId)).isEmpty()) {
      throw new ProjectIdNotFoundError(projectId);
    }
    String nameKey = WarehouseKeys.warehouseByNameKey(projectId, warehouseName);
    if (tx.read(nameKey).isPresent()) {
      throw new WarehouseAlreadyExists(warehouseName, projectId);
    }

    String profileJson = writeStorageProfile(tx.state().mapper(), storageProfile);
    WarehouseId warehouseId = WarehouseId.random();
    WarehouseRow row =
        new WarehouseRow(
            warehouseId,
            warehouseName,
            projectId,
            profileJson,
            storageSecretId.orElse(null),
            WarehouseStatus.ACTIVE,
            tabularDeleteProfile,
            false);
    tx.put(WarehouseKeys.warehouseByIdKey(warehouseId), encode(tx.state().mapper(), row));
    tx.put(nameKey, warehouseId.toString());
    LOG.debugf("staged warehouse %s (%s) in project %s", warehouseName, warehouseId, projectId);
    return warehouseId;
  }

  @Override
  public void deleteWarehouse(
      WarehouseId warehouseId, DeleteWarehouseQuery query, InMemoryTransaction tx) {
    WarehouseRow row =
        loadForUpdate(warehouseId, tx).orElseThrow(() -> new WarehouseIdNotFound(warehouseId));

    // pins the task and tabular scans below to this commit
    String epochKey = WarehouseKeys.contentEpochKey(warehouseId);
    tx.read(epochKey);
    if (!tx.keysWithPrefix(WarehouseKeys.taskPrefix(warehouseId)).isEmpty()) {
      throw new WarehouseHasUnfinishedTasks();
    }
    if (!query.force() && row.protectedFromDeletion()) {
      throw new WarehouseProtected();
    }
    List<String> tabulars = tx.keysWithPrefix(WarehouseKeys.tabularPrefix(warehouseId));
    if (!query.force() && !tabulars.isEmpty()) {
      throw new WarehouseNotEmpty();
    }

    GetWarehouseResponse deleted = toResponseForUpdate(tx.state().mapper(), row);
    for (String tabularKey : tabulars) {
      tx.delete(tabularKey);
    }
    tx.delete(WarehouseKeys.warehouseByNameKey(row.projectId(), row.name()));
    tx.delete(WarehouseKeys.warehouseByIdKey(warehouseId));
    tx.delete(epochKey);
    tx.afterCommit(
        () -> {
          LOG.debugf("warehouse %s deleted, handing off for purge", warehouseId);
          purgeListener.warehouseDeleted(deleted);
        });
  }

  @Override
  public void renameWarehouse(WarehouseId warehouseId, String newName, InMemoryTransaction tx) {
    Objects.requireNonNull(newName, "newName");
    WarehouseRow row =
        loadForUpdate(warehouseId, tx)
            .filter(r -> r.status() == WarehouseStatus.ACTIVE)
            .orElseThrow(() -> new WarehouseIdNotFound(warehouseId));
    if (row.name().equals(newName)) {
      return;
    }

    String newNameKey = WarehouseKeys.warehouseByNameKey(row.projectId(), newName);
    if (tx.read(newNameKey).isPresent()) {
      throw CatalogBackendError.unexpected(
          new NameConflictException(
              "warehouse name '"
                  + newName
                  + "' is already taken in project "
                  + row.projectId()));
    }
    tx.delete(WarehouseKeys.warehouseByNameKey(row.projectId(), row.name()));
    tx.put(newNameKey, warehouseId.toString());
    tx.put(
        WarehouseKeys.warehouseByIdKey(warehouseId),
        encode(tx.state().mapper(), row.withName(newName)));
  }

  @Override
  public List<GetWarehouseResponse> listWarehouses(
      ProjectId projectId, Set<WarehouseStatus> statuses, InMemoryCatalogState state) {
    PointerStore store = state.pointerStore();
    List<GetWarehouseResponse> out = new ArrayList<>();
    StringBuilder next = new StringBuilder();
    String token = "";
    do {
      for (Pointer entry :
          store.listPointersByPrefix(
              WarehouseKeys.warehouseByNamePrefix(projectId), SCAN_PAGE, token, next)) {
        Optional<WarehouseRow> found = rowOfNameEntry(state, projectId, entry);
        if (found.isEmpty() || !statuses.contains(found.get().status())) {
          continue;
        }
        requireProject(state, found.get());
        out.add(toResponseForRead(state.mapper(), found.get()));
      }
      token = next.toString();
    } while (!token.isEmpty());

    out.sort(
        Comparator.comparing(GetWarehouseResponse::name)
            .thenComparing(w -> w.id().value()));
    return out;
  }

  @Override
  public Optional<GetWarehouseResponse> getWarehouse(
      WarehouseId warehouseId, InMemoryCatalogState state) {
    String key = WarehouseKeys.warehouseByIdKey(warehouseId);
    Optional<Pointer> pointer = state.pointerStore().get(key);
    if (pointer.isEmpty()) {
      return Optional.empty();
    }
    WarehouseRow row = decodeForRead(state.mapper(), key, pointer.get().payload());
    if (row.status() != WarehouseStatus.ACTIVE) {
      return Optional.empty();
    }
    requireProject(state, row);
    return Optional.of(toResponseForRead(state.mapper(), row));
  }

  @Override
  public void setWarehouseStatus(
      WarehouseId warehouseId, WarehouseStatus status, InMemoryTransaction tx) {
    Objects.requireNonNull(status, "status");
    WarehouseRow row =
        loadForUpdate(warehouseId, tx).orElseThrow(() -> new WarehouseIdNotFound(warehouseId));
    if (row.status() == status) {
      return;
    }
    tx.put(
        WarehouseKeys.warehouseByIdKey(warehouseId),
        encode(tx.state().mapper(), row.withStatus(status)));
  }

  @Override
  public GetWarehouseResponse setWarehouseDeletionProtection(
      WarehouseId warehouseId, boolean protectedFromDeletion, InMemoryTransaction tx) {
    WarehouseRow row =
        loadForUpdate(warehouseId, tx).orElseThrow(() -> new WarehouseIdNotFound(warehouseId));
    WarehouseRow updated = row.withProtection(protectedFromDeletion);
    tx.put(WarehouseKeys.warehouseByIdKey(warehouseId), encode(tx.state().mapper(), updated));
    return toResponseForUpdate(tx.state().mapper(), updated);
  }

  @Override
  public void updateStorageProfile(
      WarehouseId warehouseId,
      StorageProfile storageProfile,
      Optional<SecretIdent> storageSecretId,
      InMemoryTransaction tx) {
    WarehouseRow row =
        loadForUpdate(warehouseId, tx)
            .filter(r -> r.status() == WarehouseStatus.ACTIVE)
            .orElseThrow(() -> new WarehouseIdNotFound(warehouseId));
    String profileJson = writeStorageProfile(tx.state().mapper(), storageProfile);
    tx.put(
        WarehouseKeys.warehouseByIdKey(warehouseId),
        encode(tx.state().mapper(), row.withStorage(profileJson, storageSecretId.orElse(null))));
  }

  private static String writeStorageProfile(ObjectMapper mapper, StorageProfile storageProfile) {
    try {
      return mapper.writeValueAsString(Objects.requireNonNull(storageProfile, "storageProfile"));
    } catch (JsonProcessingException e) {
      throw new StorageProfileSerializationError(e);
    }
  }

  private static String encode(ObjectMapper mapper, WarehouseRow row) {
    try {
      return mapper.writeValueAsString(row);
    } catch (JsonProcessingException e) {
      throw CatalogBackendError.unexpected(e);
    }
  }

  private static Optional<WarehouseRow> loadForUpdate(
      WarehouseId warehouseId, InMemoryTransaction tx) {
    String key = WarehouseKeys.warehouseByIdKey(warehouseId);
    Optional<String> payload = tx.read(key);
    if (payload.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(tx.state().mapper().readValue(payload.get(), WarehouseRow.class));
    } catch (JsonProcessingException e) {
      throw CatalogBackendError.unexpected(
          new CorruptionException("undecodable warehouse row at " + key, e));
    }
  }

  private static GetWarehouseResponse toResponseForUpdate(ObjectMapper mapper, WarehouseRow row) {
    try {
      return toResponse(mapper, row);
    } catch (JsonProcessingException e) {
      throw CatalogBackendError.unexpected(
          new CorruptionException("undecodable storage profile of warehouse " + row.id(), e));
    }
  }

  private static WarehouseRow decodeForRead(ObjectMapper mapper, String key, String payload) {
    try {
      return mapper.readValue(payload, WarehouseRow.class);
    } catch (JsonProcessingException e) {
      throw new DatabaseIntegrityError(
          "warehouse row at " + key + " cannot be decoded: " + e.getOriginalMessage(), e);
    }
  }

  // Empty when the entry was removed or moved after the scan saw it.
  private static Optional<WarehouseRow> rowOfNameEntry(
      InMemoryCatalogState state, ProjectId projectId, Pointer entry) {
    WarehouseId warehouseId = warehouseIdOf(entry);
    String key = WarehouseKeys.warehouseByIdKey(warehouseId);
    PointerStore store = state.pointerStore();
    Optional<Pointer> row = store.get(key);
    if (row.isEmpty()) {
      boolean entryUnchanged =
          store.get(entry.key()).map(p -> p.version() == entry.version()).orElse(false);
      if (!entryUnchanged) {
        return Optional.empty();
      }
      throw new DatabaseIntegrityError(
          "name index entry "
              + entry.key()
              + " references warehouse "
              + warehouseId
              + " which does not exist");
    }
    WarehouseRow decoded = decodeForRead(state.mapper(), key, row.get().payload());
    if (!decoded.projectId().equals(projectId)) {
      throw new DatabaseIntegrityError(
          "name index entry "
              + entry.key()
              + " references warehouse "
              + warehouseId
              + " of project "
              + decoded.projectId());
    }
    return Optional.of(decoded);
  }

  private static WarehouseId warehouseIdOf(Pointer nameEntry) {
    try {
      return WarehouseId.of(nameEntry.payload());
    } catch (IllegalArgumentException e) {
      throw new DatabaseIntegrityError(
          "name index entry " + nameEntry.key() + " holds an invalid warehouse id", e);
    }
  }

  private static GetWarehouseResponse toResponseForRead(ObjectMapper mapper, WarehouseRow row) {
    try {
      return toResponse(mapper, row);
    } catch (JsonProcessingException e) {
      throw new DatabaseIntegrityError(
          "storage profile of warehouse "
              + row.id()
              + " cannot be decoded: "
              + e.getOriginalMessage(),
          e);
    }
  }

  private static void requireProject(InMemoryCatalogState state, WarehouseRow row) {
    if (!state.projectExists(row.projectId())) {
      throw new DatabaseIntegrityError(
          "warehouse "
              + row.id()
              + " references project "
              + row.projectId()
              + " which does not exist");
    }
  }

  private static GetWarehouseResponse toResponse(ObjectMapper mapper, WarehouseRow row)
      throws JsonProcessingException {
    StorageProfile profile = mapper.readValue(row.storageProfileJson(), StorageProfile.class);
    return new GetWarehouseResponse(
        row.id(),
        row.name(),
        row.projectId(),
        profile,
        Optional.ofNullable(row.storageSecretId()),
        row.status(),
        row.tabularDeleteProfile(),
        row.protectedFromDeletion());
  }
}
