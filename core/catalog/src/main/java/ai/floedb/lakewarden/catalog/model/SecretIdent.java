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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import java.util.UUID;

/** Reference to a storage secret held by the secret store. */
public record SecretIdent(UUID value) {
  public SecretIdent {
    Objects.requireNonNull(value, "value");
  }

  public static SecretIdent random() {
    return new SecretIdent(UUID.randomUUID());
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static SecretIdent of(String raw) {
    try {
      return new SecretIdent(UUID.fromString(raw));
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalArgumentException("invalid secret id: " + raw, e);
    }
  }

  @JsonValue
  @Override
  public String toString() {
    return value.toString();
  }
}
