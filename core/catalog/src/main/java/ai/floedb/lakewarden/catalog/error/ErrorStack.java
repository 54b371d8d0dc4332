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

/**
 * Ordered, append-only list of context strings attached to an error as it crosses layers. Entries
 * are kept oldest first and are never removed, reordered or deduplicated.
 *
 * <p>Exceptions cannot be generic, so the concrete error classes implement this interface with
 * themselves as type argument to get chaining variants that keep their own type.
 *
 * @param <E> the concrete error type, returned by the chaining variants
 */
public interface ErrorStack<E extends ErrorStack<E>> extends CatalogFailure {

  /** Appends one detail and returns this error. */
  default E appendDetail(String detail) {
    addDetail(detail);
    return self();
  }

  /** Appends all details in iteration order and returns this error. */
  default E appendDetails(Iterable<String> details) {
    addDetails(details);
    return self();
  }

  @SuppressWarnings("unchecked")
  private E self() {
    return (E) this;
  }
}
