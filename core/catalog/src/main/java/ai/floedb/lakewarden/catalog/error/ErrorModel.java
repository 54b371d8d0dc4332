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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Uniform protocol error. {@code source} carries the native cause for diagnostics and is never
 * serialized.
 */
@JsonPropertyOrder({"message", "type", "code", "stack"})
public record ErrorModel(
    String type, int code, String message, List<String> stack, @JsonIgnore Throwable source) {

  public static final int NOT_FOUND = 404;
  public static final int CONFLICT = 409;
  public static final int INTERNAL_SERVER_ERROR = 500;

  public ErrorModel {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(message, "message");
    stack = stack == null ? List.of() : List.copyOf(stack);
  }

  public static ErrorModel of(String type, int code, String message, List<String> stack) {
    return new ErrorModel(type, code, message, stack, null);
  }

  public ErrorModel withSource(Throwable cause) {
    return new ErrorModel(type, code, message, stack, cause);
  }

  @JsonIgnore
  public Optional<Throwable> cause() {
    return Optional.ofNullable(source);
  }
}
