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
import ai.floedb.lakewarden.catalog.spi.CatalogTransaction;
import ai.floedb.lakewarden.storage.errors.StorageAbortRetryableException;
import ai.floedb.lakewarden.storage.spi.Pointer;
import ai.floedb.lakewarden.storage.spi.PointerStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/**
 * Optimistic transaction over the pointer store. Records the version of every key it reads,
 * stages writes locally and applies them in one compare-and-set batch on commit. Staged writes
 * are visible to reads through the same transaction.
 *
 * <p>Prefix scans are not version-tracked: a key inserted under a scanned prefix by another
 * writer does not fail the commit on its own. Callers that depend on a scan also read a key
 * that every writer under the prefix bumps, such as {@link WarehouseKeys#contentEpochKey}.
 */
public final class InMemoryTransaction implements CatalogTransaction<InMemoryCatalogState> {
  private static final Logger LOG = Logger.getLogger(InMemoryTransaction.class);
  private static final int SCAN_PAGE = 200;

  private final InMemoryCatalogState state;
  private final Map<String, Long> readVersions = new HashMap<>();
  // empty value stages a delete
  private final Map<String, Optional<String>> staged = new LinkedHashMap<>();
  private final List<Runnable> afterCommit = new ArrayList<>();
  private boolean open = true;

  InMemoryTransaction(InMemoryCatalogState state) {
    this.state = state;
  }

  @Override
  public InMemoryCatalogState state() {
    return state;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  Optional<String> read(String key) {
    ensureOpen();
    Optional<String> pending = staged.get(key);
    if (pending != null) {
      return pending;
    }
    Optional<Pointer> current = state.pointerStore().get(key);
    readVersions.putIfAbsent(key, current.map(Pointer::version).orElse(0L));
    return current.map(Pointer::payload);
  }

  void put(String key, String payload) {
    ensureOpen();
    track(key);
    staged.put(key, Optional.of(payload));
  }

  void delete(String key) {
    ensureOpen();
    track(key);
    staged.put(key, Optional.empty());
  }

  /** Keys under {@code prefix} as seen by this transaction, in key order. */
  List<String> keysWithPrefix(String prefix) {
    ensureOpen();
    TreeSet<String> keys = new TreeSet<>();
    PointerStore store = state.pointerStore();
    StringBuilder next = new StringBuilder();
    String token = "";
    do {
      for (Pointer p : store.listPointersByPrefix(prefix, SCAN_PAGE, token, next)) {
        keys.add(p.key());
      }
      token = next.toString();
    } while (!token.isEmpty());

    for (Map.Entry<String, Optional<String>> e : staged.entrySet()) {
      if (!e.getKey().startsWith(prefix)) {
        continue;
      }
      if (e.getValue().isPresent()) {
        keys.add(e.getKey());
      } else {
        keys.remove(e.getKey());
      }
    }
    return new ArrayList<>(keys);
  }

  /** Runs {@code hook} once the transaction has committed. Dropped on rollback. */
  void afterCommit(Runnable hook) {
    ensureOpen();
    afterCommit.add(hook);
  }

  @Override
  public void commit() {
    ensureOpen();
    List<PointerStore.CasOp> ops = new ArrayList<>();
    for (Map.Entry<String, Long> read : readVersions.entrySet()) {
      String key = read.getKey();
      long expected = read.getValue();
      Optional<String> write = staged.get(key);
      if (write == null) {
        ops.add(new PointerStore.CasCheck(key, expected));
      } else if (write.isPresent()) {
        ops.add(new PointerStore.CasUpsert(key, expected, Pointer.of(key, write.get())));
      } else if (expected != 0L) {
        ops.add(new PointerStore.CasDelete(key, expected));
      } else {
        ops.add(new PointerStore.CasCheck(key, 0L));
      }
    }

    open = false;
    staged.clear();
    if (!state.pointerStore().compareAndSetBatch(ops)) {
      afterCommit.clear();
      throw CatalogBackendError.concurrentModification(
          new StorageAbortRetryableException(
              "transaction conflict: a key read by this transaction was modified concurrently"));
    }
    LOG.debugf("committed %d pointer operations", ops.size());

    List<Runnable> hooks = new ArrayList<>(afterCommit);
    afterCommit.clear();
    for (Runnable hook : hooks) {
      try {
        hook.run();
      } catch (RuntimeException e) {
        // the commit stands; the hook owner has to reconcile
        LOG.warn("after-commit hook failed", e);
      }
    }
  }

  @Override
  public void rollback() {
    open = false;
    staged.clear();
    afterCommit.clear();
    readVersions.clear();
  }

  private void track(String key) {
    if (!readVersions.containsKey(key)) {
      readVersions.put(key, state.pointerStore().get(key).map(Pointer::version).orElse(0L));
    }
  }

  private void ensureOpen() {
    if (!open) {
      throw new IllegalStateException("transaction is no longer open");
    }
  }
}
