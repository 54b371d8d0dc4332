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
package ai.floedb.lakewarden.catalog.model;

/**
 * Options of a warehouse delete. {@code force} deletes protected and non-empty warehouses; it
 * never overrides unfinished tasks.
 */
public record DeleteWarehouseQuery(boolean force) {
  private static final DeleteWarehouseQuery DEFAULTS = new DeleteWarehouseQuery(false);

  public static DeleteWarehouseQuery defaults() {
    return DEFAULTS;
  }

  public static DeleteWarehouseQuery forced() {
    return new DeleteWarehouseQuery(true);
  }
}
