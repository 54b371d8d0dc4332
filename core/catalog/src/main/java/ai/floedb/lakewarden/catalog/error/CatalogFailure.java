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
package ai.floedb.lakewarden.catalog.error;

import java.util.List;

/** Common view of every catalog failure, independent of its concrete error type. */
public interface CatalogFailure {
  /** Unmodifiable view of the context strings, oldest first. */
  List<String> stack();

  void addDetail(String detail);

  void addDetails(Iterable<String> details);

  /** Protocol representation of this failure. */
  ErrorModel toErrorModel();

  RuntimeException asException();
}
