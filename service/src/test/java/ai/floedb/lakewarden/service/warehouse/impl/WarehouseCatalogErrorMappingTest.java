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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import ai.floedb.lakewarden.catalog.error.CatalogBackendError;
import ai.floedb.lakewarden.catalog.error.CatalogBackendErrorType;
import ai.floedb.lakewarden.catalog.error.CatalogCreateWarehouseError;
import ai.floedb.lakewarden.catalog.error.CatalogDeleteWarehouseError;
import ai.floedb.lakewarden.catalog.error.CatalogGetWarehouseByIdError;
import ai.floedb.lakewarden.catalog.error.CatalogSetWarehouseProtectionError;
import ai.floedb.lakewarden.catalog.error.DatabaseIntegrityError;
import ai.floedb.lakewarden.catalog.error.WarehouseNotEmpty;
import ai.floedb.lakewarden.catalog.model.DeleteWarehouseQuery;
import ai.floedb.lakewarden.catalog.model.ProjectId;
import ai.floedb.lakewarden.catalog.model.StorageProfile;
import ai.floedb.lakewarden.catalog.model.TabularDeleteProfile;
import ai.floedb.lakewarden.catalog.model.WarehouseId;
import ai.floedb.lakewarden.catalog.model.WarehouseStatus;
import ai.floedb.lakewarden.catalog.spi.CatalogState;
import ai.floedb.lakewarden.catalog.spi.CatalogTransaction;
import ai.floedb.lakewarden.catalog.spi.WarehouseCatalogStore;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WarehouseCatalogErrorMappingTest {
  private WarehouseCatalogStore<CatalogState, CatalogTransaction<CatalogState>> store;
  private CatalogTransaction<CatalogState> tx;
  private CatalogState state;
  private WarehouseCatalog<CatalogState, CatalogTransaction<CatalogState>> catalog;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    store = mock(WarehouseCatalogStore.class);
    tx = mock(CatalogTransaction.class);
    state = mock(CatalogState.class);
    catalog = new WarehouseCatalog<>(store);
  }

  @Test
  void unknownRuntimeFailureBecomesUnexpectedBackendError() {
    var boom = new IllegalStateException("connection reset");
    when(store.createWarehouse(any(), any(), any(), any(), any(), any())).thenThrow(boom);

    var error =
        assertThrows(
            CatalogCreateWarehouseError.class,
            () ->
                catalog.createWarehouse(
                    "sales",
                    ProjectId.of("p"),
                    StorageProfile.of("s3", Map.of()),
                    TabularDeleteProfile.hard(),
                    null,
                    tx));

    var backend = assertInstanceOf(CatalogBackendError.class, error.source());
    assertEquals(CatalogBackendErrorType.UNEXPECTED, backend.type());
    assertSame(boom, backend.source());
    assertEquals(List.of(CatalogCreateWarehouseError.ERROR_STACK), error.stack());
    assertEquals(500, error.toErrorModel().code());
  }

  @Test
  void domainErrorOutsideTheOperationsSetIsReportedAsUnexpected() {
    var stray = new WarehouseNotEmpty();
    when(store.createWarehouse(any(), any(), any(), any(), any(), any())).thenThrow(stray);

    var error =
        assertThrows(
            CatalogCreateWarehouseError.class,
            () ->
                catalog.createWarehouse(
                    "sales",
                    ProjectId.of("p"),
                    StorageProfile.of("s3", Map.of()),
                    TabularDeleteProfile.hard(),
                    null,
                    tx));

    var backend = assertInstanceOf(CatalogBackendError.class, error.source());
    assertSame(stray, backend.source());
    assertTrue(stray.stack().isEmpty());
  }

  @Test
  void integrityErrorDuringDeleteIsUnexpected() {
    var id = WarehouseId.random();
    doThrow(new DatabaseIntegrityError("dangling"))
        .when(store)
        .deleteWarehouse(eq(id), any(), any());

    var error =
        assertThrows(
            CatalogDeleteWarehouseError.class,
            () -> catalog.deleteWarehouse(id, DeleteWarehouseQuery.defaults(), tx));

    assertInstanceOf(CatalogBackendError.class, error.source());
    assertEquals(List.of(CatalogDeleteWarehouseError.ERROR_STACK), error.stack());
  }

  @Test
  void backendErrorPassesThroughWithItsClassification() {
    var conflict = CatalogBackendError.concurrentModification(new IllegalStateException("race"));
    when(store.setWarehouseDeletionProtection(any(), anyBoolean(), any())).thenThrow(conflict);

    var error =
        assertThrows(
            CatalogSetWarehouseProtectionError.class,
            () -> catalog.setWarehouseDeletionProtection(WarehouseId.random(), true, tx));

    assertSame(conflict, error.source());
    assertEquals(409, error.toErrorModel().code());
  }

  @Test
  void integrityErrorDuringGetKeepsItsType() {
    when(store.getWarehouse(any(), any())).thenThrow(new DatabaseIntegrityError("bad row"));

    var error =
        assertThrows(
            CatalogGetWarehouseByIdError.class,
            () -> catalog.getWarehouseById(WarehouseId.random(), state));

    assertInstanceOf(DatabaseIntegrityError.class, error.source());
    assertEquals("DatabaseIntegrityError", error.toErrorModel().type());
  }

  @Test
  void listWithoutFilterAsksForActiveOnly() {
    var project = ProjectId.of("p");
    when(store.listWarehouses(any(), any(), any())).thenReturn(List.of());

    catalog.listWarehouses(project, state);
    verify(store).listWarehouses(project, Set.of(WarehouseStatus.ACTIVE), state);

    catalog.listWarehouses(project, EnumSet.noneOf(WarehouseStatus.class), state);
    verify(store).listWarehouses(project, Set.of(), state);
  }

  @Test
  void serviceNeverCommitsOrRollsBack() {
    var id = WarehouseId.random();

    catalog.deleteWarehouse(id, null, tx);
    catalog.renameWarehouse(id, "other", tx);
    catalog.setWarehouseStatus(id, WarehouseStatus.INACTIVE, tx);

    verify(store).deleteWarehouse(id, DeleteWarehouseQuery.defaults(), tx);
    verifyNoInteractions(tx);
  }
}
