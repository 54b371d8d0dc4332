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

import ai.floedb.lakewarden.storage.spi.Pointer;
import ai.floedb.lakewarden.storage.spi.PointerStore;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Singleton
public class InMemoryPointerStore implements PointerStore {
  private final Map<String, Pointer> map = new ConcurrentHashMap<>();

  @Override
  public Optional<Pointer> get(String key) {
    return Optional.ofNullable(map.get(key));
  }

  @Override
  public boolean compareAndSet(String key, long expectedVersion, Pointer next) {
    final boolean[] updated = {false};
    map.compute(
        key,
        (k, cur) -> {
          if (cur == null) {
            if (expectedVersion == 0L) {
              updated[0] = true;
              return new Pointer(key, next.payload(), 1L);
            }
            return null;
          }
          if (cur.version() == expectedVersion) {
            updated[0] = true;
            return new Pointer(key, next.payload(), expectedVersion + 1L);
          }
          return cur;
        });

    return updated[0];
  }

  @Override
  public List<Pointer> listPointersByPrefix(
      String prefix, int limit, String pageToken, StringBuilder nextTokenOut) {
    final String pfx = prefix == null ? "" : prefix;
    final int lim = Math.max(1, limit);

    List<String> keys = new ArrayList<>();
    for (String k : map.keySet()) {
      if (k.startsWith(pfx)) {
        keys.add(k);
      }
    }
    Collections.sort(keys);

    int start = 0;
    if (pageToken != null && !pageToken.isEmpty()) {
      int idx = Collections.binarySearch(keys, pageToken);
      start = idx >= 0 ? idx + 1 : -idx - 1;
    }

    if (start >= keys.size()) {
      if (nextTokenOut != null) {
        nextTokenOut.setLength(0);
      }

      return Collections.emptyList();
    }

    int end = Math.min(keys.size(), start + lim);
    List<Pointer> page = new ArrayList<>(end - start);
    for (int i = start; i < end; i++) {
      Pointer p = map.get(keys.get(i));
      if (p != null) {
        page.add(p);
      }
    }

    if (nextTokenOut != null) {
      nextTokenOut.setLength(0);
      if (end < keys.size()) {
        nextTokenOut.append(keys.get(end - 1));
      }
    }

    return page;
  }

  @Override
  public int countByPrefix(String prefix) {
    final String pfx = prefix == null ? "" : prefix;
    int n = 0;
    for (String k : map.keySet()) {
      if (k.startsWith(pfx)) {
        n++;
      }
    }

    return n;
  }

  @Override
  public boolean delete(String key) {
    return map.remove(key) != null;
  }

  @Override
  public boolean compareAndDelete(String key, long expectedVersion) {
    final boolean[] deleted = {false};
    map.compute(
        key,
        (k, cur) -> {
          if (cur == null) {
            return null;
          }

          if (cur.version() == expectedVersion) {
            deleted[0] = true;
            return null;
          }

          return cur;
        });

    return deleted[0];
  }

  @Override
  public boolean compareAndSetBatch(List<CasOp> ops) {
    if (ops == null || ops.isEmpty()) {
      return true;
    }
    synchronized (this) {
      for (CasOp op : ops) {
        Pointer cur = map.get(op.key());
        long actual = cur == null ? 0L : cur.version();
        if (actual != op.expectedVersion()) {
          return false;
        }
        if (op instanceof CasDelete && cur == null) {
          return false;
        }
      }

      for (CasOp op : ops) {
        if (op instanceof CasUpsert upsert) {
          map.put(
              upsert.key(),
              new Pointer(upsert.key(), upsert.next().payload(), upsert.expectedVersion() + 1L));
        } else if (op instanceof CasDelete delete) {
          map.remove(delete.key());
        }
        // CasCheck: verified above, nothing to apply
      }
      return true;
    }
  }

  @Override
  public boolean isEmpty() {
    return map.isEmpty();
  }
}
