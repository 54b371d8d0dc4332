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

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.Objects;

/** The storage profile could not be serialized for persistence. */
public final class StorageProfileSerializationError extends CatalogException
    implements ErrorStack<StorageProfileSerializationError>,
        CatalogCreateWarehouseError.Source,
        CatalogUpdateStorageProfileError.Source {

  private final JsonProcessingException source;

  public StorageProfileSerializationError(JsonProcessingException source) {
    super(
        "Error serializing storage profile: "
            + Objects.requireNonNull(source, "source").getOriginalMessage(),
        source);
    this.source = source;
  }

  public JsonProcessingException source() {
    return source;
  }

  /** Attaches the serialization failure, the one case where the cause travels with the error. */
  @Override
  public ErrorModel toErrorModel() {
    return errorModel("StorageProfileSerializationError", ErrorModel.INTERNAL_SERVER_ERROR)
        .withSource(source);
  }
}
