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

public final class WarehouseNotEmpty extends CatalogException
    implements ErrorStack<WarehouseNotEmpty>, CatalogDeleteWarehouseError.Source {

  public static final String MESSAGE =
      "Warehouse is not empty. Cannot delete a non-empty warehouse.";

  public WarehouseNotEmpty() {
    super(MESSAGE);
  }

  @Override
  public ErrorModel toErrorModel() {
    return errorModel("WarehouseNotEmpty", ErrorModel.CONFLICT);
  }
}
