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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.Objects;

/**
 * How tables and views of a warehouse are purged when they are dropped. Soft deletion keeps the
 * data around until the expiration has passed.
 */
public record TabularDeleteProfile(
    @JsonProperty("type") Kind kind,
    @JsonProperty("expiration-seconds") long expirationSeconds) {

  public enum Kind {
    @JsonProperty("hard")
    HARD,
    @JsonProperty("soft")
    SOFT
  }

  public TabularDeleteProfile {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.HARD && expirationSeconds != 0L) {
      throw new IllegalArgumentException("hard delete profile has no expiration");
    }
    if (kind == Kind.SOFT && expirationSeconds <= 0L) {
      throw new IllegalArgumentException("soft delete expiration must be positive");
    }
  }

  public static TabularDeleteProfile hard() {
    return new TabularDeleteProfile(Kind.HARD, 0L);
  }

  public static TabularDeleteProfile soft(Duration expiration) {
    return new TabularDeleteProfile(Kind.SOFT, expiration.getSeconds());
  }

  @JsonIgnore
  public Duration expiration() {
    return Duration.ofSeconds(expirationSeconds);
  }
}
