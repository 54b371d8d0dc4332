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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.lakewarden.catalog.error.CatalogBackendError;
import ai.floedb.lakewarden.catalog.error.CatalogBackendErrorType;
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
import ai.floedb.lakewarden.storage.errors.NameConflictException;
import ai.floedb.lakewarden.storage.spi.Pointer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryWarehouseCatalogStoreTest {
  private static final ProjectId PROJECT = ProjectId.of("p");
  private static final StorageProfile S3 =
      StorageProfile.of("s3", Map.of("bucket", "lake", "region", "eu-central-1"));

  private InMemoryPointerStore ptr;
  private InMemoryCatalogState state;
  private List<GetWarehouseResponse> purged;
  private InMemoryWarehouseCatalogStore store;

  @BeforeEach
  void setUp() {
    ptr = new InMemoryPointerStore();
    state = new InMemoryCatalogState(ptr);
    state.createProject(PROJECT);
    purged = new ArrayList<>();
    store = new InMemoryWarehouseCatalogStore(purged::add);
  }

  private WarehouseId create(String name) {
    try (InMemoryTransaction tx = state.begin()) {
      WarehouseId id =
          store.createWarehouse(
              name, PROJECT, S3, TabularDeleteProfile.hard(), Optional.empty(), tx);
      tx.commit();
      return id;
    }
  }

  @Test
  void createdWarehouseIsActiveAndReadable() {
    SecretIdent secret = SecretIdent.random();
    WarehouseId id;
    try (InMemoryTransaction tx = state.begin()) {
      id =
          store.createWarehouse(
              "sales",
              PROJECT,
              S3,
              TabularDeleteProfile.soft(Duration.ofDays(7)),
              Optional.of(secret),
              tx);
      tx.commit();
    }

    GetWarehouseResponse w = store.getWarehouse(id, state).orElseThrow();
    assertThat(w.name()).isEqualTo("sales");
    assertThat(w.projectId()).isEqualTo(PROJECT);
    assertThat(w.status()).isEqualTo(WarehouseStatus.ACTIVE);
    assertThat(w.storageProfile()).isEqualTo(S3);
    assertThat(w.storageSecretId()).contains(secret);
    assertThat(w.tabularDeleteProfile().expiration()).isEqualTo(Duration.ofDays(7));
    assertThat(w.protectedFromDeletion()).isFalse();
  }

  @Test
  void uncommittedCreateIsInvisible() {
    WarehouseId id;
    try (InMemoryTransaction tx = state.begin()) {
      id =
          store.createWarehouse(
              "sales", PROJECT, S3, TabularDeleteProfile.hard(), Optional.empty(), tx);
    }
    assertThat(store.getWarehouse(id, state)).isEmpty();
    assertThat(ptr.isEmpty()).isFalse();
    assertThat(ptr.countByPrefix("/warehouses/")).isZero();
  }

  @Test
  void duplicateNameInSameProjectIsRejected() {
    create("sales");
    try (InMemoryTransaction tx = state.begin()) {
      assertThatThrownBy(
              () ->
                  store.createWarehouse(
                      "sales", PROJECT, S3, TabularDeleteProfile.hard(), Optional.empty(), tx))
          .isInstanceOf(WarehouseAlreadyExists.class)
          .hasMessage("A warehouse with the name 'sales' already exists in project with id 'p'");
    }
  }

  @Test
  void sameNameInOtherProjectIsAllowed() {
    create("sales");
    ProjectId other = ProjectId.of("q");
    state.createProject(other);
    try (InMemoryTransaction tx = state.begin()) {
      store.createWarehouse("sales", other, S3, TabularDeleteProfile.hard(), Optional.empty(), tx);
      tx.commit();
    }
    assertThat(store.listWarehouses(other, EnumSet.of(WarehouseStatus.ACTIVE), state))
        .extracting(GetWarehouseResponse::name)
        .containsExactly("sales");
  }

  @Test
  void createInUnknownProjectFails() {
    try (InMemoryTransaction tx = state.begin()) {
      assertThatThrownBy(
              () ->
                  store.createWarehouse(
                      "sales",
                      ProjectId.of("nope"),
                      S3,
                      TabularDeleteProfile.hard(),
                      Optional.empty(),
                      tx))
          .isInstanceOf(ProjectIdNotFoundError.class);
    }
  }

  @Test
  void unserializableStorageProfileFails() {
    StorageProfile broken = StorageProfile.of("s3", Map.of("handle", new Object()));
    try (InMemoryTransaction tx = state.begin()) {
      assertThatThrownBy(
              () ->
                  store.createWarehouse(
                      "sales", PROJECT, broken, TabularDeleteProfile.hard(), Optional.empty(), tx))
          .isInstanceOf(StorageProfileSerializationError.class);
    }
  }

  @Test
  void deleteRemovesWarehouseAndHandsItToPurgeAfterCommit() {
    WarehouseId id = create("sales");
    try (InMemoryTransaction tx = state.begin()) {
      store.deleteWarehouse(id, DeleteWarehouseQuery.defaults(), tx);
      assertThat(purged).isEmpty();
      tx.commit();
    }

    assertThat(store.getWarehouse(id, state)).isEmpty();
    assertThat(purged).extracting(GetWarehouseResponse::id).containsExactly(id);
    // the name can be reused
    create("sales");
  }

  @Test
  void rolledBackDeleteKeepsWarehouseAndDoesNotPurge() {
    WarehouseId id = create("sales");
    try (InMemoryTransaction tx = state.begin()) {
      store.deleteWarehouse(id, DeleteWarehouseQuery.defaults(), tx);
      tx.rollback();
    }
    assertThat(store.getWarehouse(id, state)).isPresent();
    assertThat(purged).isEmpty();
  }

  @Test
  void deleteGuardsAreCheckedInOrder() {
    WarehouseId id = create("sales");
    state.addTabular(id, "orders");
    String task = state.enqueueTask(id, "tabular_expiration");
    try (InMemoryTransaction tx = state.begin()) {
      store.setWarehouseDeletionProtection(id, true, tx);
      tx.commit();
    }

    try (InMemoryTransaction tx = state.begin()) {
      assertThatThrownBy(() -> store.deleteWarehouse(id, DeleteWarehouseQuery.forced(), tx))
          .isInstanceOf(WarehouseHasUnfinishedTasks.class);
    }

    state.finishTask(id, task);
    try (InMemoryTransaction tx = state.begin()) {
      assertThatThrownBy(() -> store.deleteWarehouse(id, DeleteWarehouseQuery.defaults(), tx))
          .isInstanceOf(WarehouseProtected.class);
    }

    try (InMemoryTransaction tx = state.begin()) {
      store.setWarehouseDeletionProtection(id, false, tx);
      tx.commit();
    }
    try (InMemoryTransaction tx = state.begin()) {
      assertThatThrownBy(() -> store.deleteWarehouse(id, DeleteWarehouseQuery.defaults(), tx))
          .isInstanceOf(WarehouseNotEmpty.class);
    }
  }

  @Test
  void forcedDeleteBypassesProtectionAndEmptiness() {
    WarehouseId id = create("sales");
    state.addTabular(id, "orders");
    try (InMemoryTransaction tx = state.begin()) {
      store.setWarehouseDeletionProtection(id, true, tx);
      tx.commit();
    }

    try (InMemoryTransaction tx = state.begin()) {
      store.deleteWarehouse(id, DeleteWarehouseQuery.forced(), tx);
      tx.commit();
    }
    assertThat(state.tabularCount(id)).isZero();
    assertThat(store.getWarehouse(id, state)).isEmpty();
  }

  @Test
  void taskQueuedBeforeDeleteCommitsFailsTheDelete() {
    WarehouseId id = create("sales");
    InMemoryTransaction tx = state.begin();
    store.deleteWarehouse(id, DeleteWarehouseQuery.defaults(), tx);

    state.enqueueTask(id, "tabular_expiration");

    assertThatThrownBy(tx::commit)
        .isInstanceOfSatisfying(
            CatalogBackendError.class,
            e -> assertThat(e.type()).isEqualTo(CatalogBackendErrorType.CONCURRENT_MODIFICATION));
    assertThat(store.getWarehouse(id, state)).isPresent();
    assertThat(state.unfinishedTaskCount(id)).isOne();
    assertThat(purged).isEmpty();
  }

  @Test
  void tabularAddedBeforeForcedDeleteCommitsFailsTheDelete() {
    WarehouseId id = create("sales");
    InMemoryTransaction tx = state.begin();
    store.deleteWarehouse(id, DeleteWarehouseQuery.forced(), tx);

    assertThat(state.addTabular(id, "orders")).isTrue();

    assertThatThrownBy(tx::commit)
        .isInstanceOfSatisfying(
            CatalogBackendError.class, e -> assertThat(e.isRetryable()).isTrue());
    assertThat(store.getWarehouse(id, state)).isPresent();
    assertThat(state.tabularCount(id)).isOne();
  }

  @Test
  void contentEpochIsRemovedWithTheWarehouse() {
    WarehouseId id = create("sales");
    assertThat(state.addTabular(id, "orders")).isTrue();
    assertThat(state.addTabular(id, "orders")).isFalse();
    assertThat(state.dropTabular(id, "orders")).isTrue();
    assertThat(state.dropTabular(id, "orders")).isFalse();
    assertThat(ptr.get(WarehouseKeys.contentEpochKey(id))).isPresent();

    try (InMemoryTransaction tx = state.begin()) {
      store.deleteWarehouse(id, DeleteWarehouseQuery.defaults(), tx);
      tx.commit();
    }
    assertThat(ptr.get(WarehouseKeys.contentEpochKey(id))).isEmpty();
  }

  @Test
  void deleteOfUnknownWarehouseFails() {
    WarehouseId id = WarehouseId.random();
    try (InMemoryTransaction tx = state.begin()) {
      assertThatThrownBy(() -> store.deleteWarehouse(id, DeleteWarehouseQuery.defaults(), tx))
          .isInstanceOf(WarehouseIdNotFound.class)
          .hasMessage("A warehouse with id '" + id + "' does not exist");
    }
  }

  @Test
  void renameMovesNameIndex() {
    WarehouseId id = create("sales");
    try (InMemoryTransaction tx = state.begin()) {
      store.renameWarehouse(id, "revenue", tx);
      tx.commit();
    }
    assertThat(store.getWarehouse(id, state).orElseThrow().name()).isEqualTo("revenue");
    create("sales");
  }

  @Test
  void renameToTakenNameIsABackendError() {
    create("sales");
    WarehouseId id = create("orders");
    try (InMemoryTransaction tx = state.begin()) {
      assertThatThrownBy(() -> store.renameWarehouse(id, "sales", tx))
          .isInstanceOfSatisfying(
              CatalogBackendError.class,
              e -> assertThat(e.source()).isInstanceOf(NameConflictException.class));
    }
  }

  @Test
  void renameOfInactiveWarehouseIsNotFound() {
    WarehouseId id = create("sales");
    try (InMemoryTransaction tx = state.begin()) {
      store.setWarehouseStatus(id, WarehouseStatus.INACTIVE, tx);
      tx.commit();
    }
    try (InMemoryTransaction tx = state.begin()) {
      assertThatThrownBy(() -> store.renameWarehouse(id, "revenue", tx))
          .isInstanceOf(WarehouseIdNotFound.class);
    }
  }

  @Test
  void listFiltersByStatusAndSortsByName() {
    WarehouseId b = create("b");
    create("a");
    create("c");
    try (InMemoryTransaction tx = state.begin()) {
      store.setWarehouseStatus(b, WarehouseStatus.INACTIVE, tx);
      tx.commit();
    }

    assertThat(store.listWarehouses(PROJECT, Set.of(WarehouseStatus.ACTIVE), state))
        .extracting(GetWarehouseResponse::name)
        .containsExactly("a", "c");
    assertThat(store.listWarehouses(PROJECT, Set.of(WarehouseStatus.INACTIVE), state))
        .extracting(GetWarehouseResponse::name)
        .containsExactly("b");
    assertThat(store.listWarehouses(PROJECT, EnumSet.allOf(WarehouseStatus.class), state))
        .extracting(GetWarehouseResponse::name)
        .containsExactly("a", "b", "c");
    assertThat(store.listWarehouses(PROJECT, Set.of(), state)).isEmpty();
    assertThat(store.getWarehouse(b, state)).isEmpty();
  }

  @Test
  void corruptRowSurfacesAsIntegrityErrorOnRead() {
    WarehouseId id = create("sales");
    String key = WarehouseKeys.warehouseByIdKey(id);
    ptr.compareAndSet(key, 1L, Pointer.of(key, "{not json"));

    assertThatThrownBy(() -> store.getWarehouse(id, state))
        .isInstanceOf(DatabaseIntegrityError.class);
    assertThatThrownBy(
            () -> store.listWarehouses(PROJECT, Set.of(WarehouseStatus.ACTIVE), state))
        .isInstanceOf(DatabaseIntegrityError.class);
  }

  @Test
  void corruptRowInOtherProjectDoesNotBreakListing() {
    create("sales");
    ProjectId other = ProjectId.of("q");
    state.createProject(other);
    WarehouseId broken;
    try (InMemoryTransaction tx = state.begin()) {
      broken =
          store.createWarehouse(
              "orders", other, S3, TabularDeleteProfile.hard(), Optional.empty(), tx);
      tx.commit();
    }
    String key = WarehouseKeys.warehouseByIdKey(broken);
    ptr.compareAndSet(key, 1L, Pointer.of(key, "{not json"));

    assertThat(store.listWarehouses(PROJECT, Set.of(WarehouseStatus.ACTIVE), state))
        .extracting(GetWarehouseResponse::name)
        .containsExactly("sales");
    assertThatThrownBy(() -> store.listWarehouses(other, Set.of(WarehouseStatus.ACTIVE), state))
        .isInstanceOf(DatabaseIntegrityError.class);
  }

  @Test
  void danglingNameEntryIsAnIntegrityErrorOnList() {
    create("sales");
    WarehouseId missing = WarehouseId.random();
    String entry = WarehouseKeys.warehouseByNameKey(PROJECT, "ghost");
    ptr.compareAndSet(entry, 0L, Pointer.of(entry, missing.toString()));

    assertThatThrownBy(() -> store.listWarehouses(PROJECT, Set.of(WarehouseStatus.ACTIVE), state))
        .isInstanceOf(DatabaseIntegrityError.class)
        .hasMessageContaining("references warehouse " + missing + " which does not exist");
  }

  @Test
  void corruptRowSurfacesAsBackendErrorOnUpdate() {
    WarehouseId id = create("sales");
    String key = WarehouseKeys.warehouseByIdKey(id);
    ptr.compareAndSet(key, 1L, Pointer.of(key, "{not json"));

    try (InMemoryTransaction tx = state.begin()) {
      assertThatThrownBy(() -> store.deleteWarehouse(id, DeleteWarehouseQuery.defaults(), tx))
          .isInstanceOf(CatalogBackendError.class);
    }
  }

  @Test
  void warehouseOfDeletedProjectIsAnIntegrityError() {
    WarehouseId id = create("sales");
    state.deleteProject(PROJECT);

    assertThatThrownBy(() -> store.getWarehouse(id, state))
        .isInstanceOf(DatabaseIntegrityError.class)
        .hasMessageContaining("references project p");
  }

  @Test
  void updateStorageProfileReplacesProfileAndSecret() {
    WarehouseId id = create("sales");
    StorageProfile adls = StorageProfile.of("adls", Map.of("account", "lake"));
    SecretIdent secret = SecretIdent.random();
    try (InMemoryTransaction tx = state.begin()) {
      store.updateStorageProfile(id, adls, Optional.of(secret), tx);
      tx.commit();
    }

    GetWarehouseResponse w = store.getWarehouse(id, state).orElseThrow();
    assertThat(w.storageProfile()).isEqualTo(adls);
    assertThat(w.storageSecretId()).contains(secret);
  }

  @Test
  void concurrentRenameAndDeleteConflict() {
    WarehouseId id = create("sales");
    InMemoryTransaction rename = state.begin();
    InMemoryTransaction delete = state.begin();
    store.renameWarehouse(id, "revenue", rename);
    store.deleteWarehouse(id, DeleteWarehouseQuery.defaults(), delete);

    rename.commit();
    assertThatThrownBy(delete::commit)
        .isInstanceOfSatisfying(
            CatalogBackendError.class, e -> assertThat(e.isRetryable()).isTrue());
    assertThat(store.getWarehouse(id, state).orElseThrow().name()).isEqualTo("revenue");
    assertThat(purged).isEmpty();
  }
}
