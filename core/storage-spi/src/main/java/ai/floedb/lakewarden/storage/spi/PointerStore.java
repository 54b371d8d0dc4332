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
package ai.floedb.lakewarden.storage.spi;

import java.util.List;
import java.util.Optional;

public interface PointerStore {
  Optional<Pointer> get(String key);

  boolean compareAndSet(String key, long expectedVersion, Pointer next);

  boolean delete(String key);

  boolean compareAndDelete(String key, long expectedVersion);

  List<Pointer> listPointersByPrefix(
      String prefix, int limit, String pageToken, StringBuilder nextTokenOut);

  int countByPrefix(String prefix);

  /**
   * Applies all operations or none. Returns {@code false} when any expected version does not
   * match the stored one.
   */
  boolean compareAndSetBatch(List<CasOp> ops);

  boolean isEmpty();

  sealed interface CasOp permits CasUpsert, CasDelete, CasCheck {
    String key();

    long expectedVersion();
  }

  record CasUpsert(String key, long expectedVersion, Pointer next) implements CasOp {}

  record CasDelete(String key, long expectedVersion) implements CasOp {}

  /** Asserts the version of a key without changing it. Version {@code 0} asserts absence. */
  record CasCheck(String key, long expectedVersion) implements CasOp {}
}
