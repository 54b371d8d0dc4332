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

import ai.floedb.lakewarden.catalog.model.ProjectId;
import ai.floedb.lakewarden.catalog.model.WarehouseId;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/** Pointer key layout of the in-memory catalog. */
public final class WarehouseKeys {
  private WarehouseKeys() {}

  private static String encode(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8);
  }

  public static String projectKey(ProjectId projectId) {
    return "/projects/" + encode(projectId.value());
  }

  public static String warehouseByIdKey(WarehouseId warehouseId) {
    return "/warehouses/by-id/" + warehouseId;
  }

  public static String warehouseByNamePrefix(ProjectId projectId) {
    return projectKey(projectId) + "/warehouses/by-name/";
  }

  public static String warehouseByNameKey(ProjectId projectId, String warehouseName) {
    return warehouseByNamePrefix(projectId) + encode(warehouseName);
  }

  /** Bumped on every task or tabular change of the warehouse. */
  public static String contentEpochKey(WarehouseId warehouseId) {
    return "/warehouses/" + warehouseId + "/epoch";
  }

  public static String taskPrefix(WarehouseId warehouseId) {
    return "/warehouses/" + warehouseId + "/tasks/";
  }

  public static String taskKey(WarehouseId warehouseId, String taskId) {
    return taskPrefix(warehouseId) + encode(taskId);
  }

  public static String tabularPrefix(WarehouseId warehouseId) {
    return "/warehouses/" + warehouseId + "/tabulars/";
  }

  public static String tabularKey(WarehouseId warehouseId, String tabularName) {
    return tabularPrefix(warehouseId) + encode(tabularName);
  }
}
