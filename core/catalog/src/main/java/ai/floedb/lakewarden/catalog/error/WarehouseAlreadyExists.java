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

import ai.floedb.lakewarden.catalog.model.ProjectId;
import java.util.Objects;

public final class WarehouseAlreadyExists extends CatalogException
    implements ErrorStack<WarehouseAlreadyExists>, CatalogCreateWarehouseError.Source {

  private final String warehouseName;
  private final ProjectId projectId;

  public WarehouseAlreadyExists(String warehouseName, ProjectId projectId) {
    super(
        "A warehouse with the name '"
            + Objects.requireNonNull(warehouseName, "warehouseName")
            + "' already exists in project with id '"
            + Objects.requireNonNull(projectId, "projectId")
            + "'");
    this.warehouseName = warehouseName;
    this.projectId = projectId;
  }

  public String warehouseName() {
    return warehouseName;
  }

  public ProjectId projectId() {
    return projectId;
  }

  @Override
  public ErrorModel toErrorModel() {
    return errorModel("WarehouseAlreadyExists", ErrorModel.CONFLICT);
  }
}
