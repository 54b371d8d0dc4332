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
import ai.floedb.lakewarden.catalog.model.WarehouseId;
import ai.floedb.lakewarden.catalog.spi.CatalogState;
import ai.floedb.lakewarden.storage.spi.Pointer;
import ai.floedb.lakewarden.storage.spi.PointerStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Read handle of the in-memory catalog and entry point for transactions. Also carries the
 * bookkeeping that other subsystems own in a full deployment: projects, tabulars registered in a
 * warehouse and queued background tasks.
 */
public final class InMemoryCatalogState implements CatalogState {
  private final PointerStore pointerStore;
  private final ObjectMapper mapper;

  public InMemoryCatalogState(PointerStore pointerStore) {
    this(pointerStore, new ObjectMapper());
  }

  public InMemoryCatalogState(PointerStore pointerStore, ObjectMapper mapper) {
    this.pointerStore = Objects.requireNonNull(pointerStore, "pointerStore");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public PointerStore pointerStore() {
    return pointerStore;
  }

  ObjectMapper mapper() {
    return mapper;
  }

  public InMemoryTransaction begin() {
    return new InMemoryTransaction(this);
  }

  /** Registers a project. Returns false if it already exists. */
  public boolean createProject(ProjectId projectId) {
    String key = WarehouseKeys.projectKey(projectId);
    return pointerStore.compareAndSet(key, 0L, Pointer.of(key, projectId.value()));
  }

  public boolean deleteProject(ProjectId projectId) {
    return pointerStore.delete(WarehouseKeys.projectKey(projectId));
  }

  public boolean projectExists(ProjectId projectId) {
    return pointerStore.get(WarehouseKeys.projectKey(projectId)).isPresent();
  }

  /**
   * Records a table or view in the warehouse, which makes the warehouse non-empty. Returns false
   * if it is already registered.
   */
  public boolean addTabular(WarehouseId warehouseId, String tabularName) {
    String key = WarehouseKeys.tabularKey(warehouseId, tabularName);
    return changeContent(
        warehouseId, new PointerStore.CasUpsert(key, 0L, Pointer.of(key, tabularName)));
  }

  public boolean dropTabular(WarehouseId warehouseId, String tabularName) {
    return removeContent(warehouseId, WarehouseKeys.tabularKey(warehouseId, tabularName));
  }

  public int tabularCount(WarehouseId warehouseId) {
    return pointerStore.countByPrefix(WarehouseKeys.tabularPrefix(warehouseId));
  }

  /** Queues a background task for the warehouse and returns its id. */
  public String enqueueTask(WarehouseId warehouseId, String taskType) {
    String taskId = UUID.randomUUID().toString();
    String key = WarehouseKeys.taskKey(warehouseId, taskId);
    changeContent(warehouseId, new PointerStore.CasUpsert(key, 0L, Pointer.of(key, taskType)));
    return taskId;
  }

  public boolean finishTask(WarehouseId warehouseId, String taskId) {
    return removeContent(warehouseId, WarehouseKeys.taskKey(warehouseId, taskId));
  }

  public int unfinishedTaskCount(WarehouseId warehouseId) {
    return pointerStore.countByPrefix(WarehouseKeys.taskPrefix(warehouseId));
  }

  private boolean removeContent(WarehouseId warehouseId, String key) {
    Optional<Pointer> current = pointerStore.get(key);
    return current.isPresent()
        && changeContent(warehouseId, new PointerStore.CasDelete(key, current.get().version()));
  }

  // Applies op together with a bump of the warehouse's content epoch, so that a transaction that
  // read the epoch fails to commit. False when op's own expected version no longer matches.
  private boolean changeContent(WarehouseId warehouseId, PointerStore.CasOp op) {
    String epochKey = WarehouseKeys.contentEpochKey(warehouseId);
    while (true) {
      long epoch = pointerStore.get(epochKey).map(Pointer::version).orElse(0L);
      var bump =
          new PointerStore.CasUpsert(
              epochKey, epoch, Pointer.of(epochKey, warehouseId.toString()));
      if (pointerStore.compareAndSetBatch(List.of(op, bump))) {
        return true;
      }
      if (pointerStore.get(epochKey).map(Pointer::version).orElse(0L) == epoch) {
        return false;
      }
    }
  }
}
