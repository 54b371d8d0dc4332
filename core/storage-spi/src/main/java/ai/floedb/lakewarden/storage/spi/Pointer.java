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
package ai.floedb.lakewarden.storage.spi;

import java.util.Objects;

/**
 * A versioned key in the pointer store. Version {@code 0} is never stored; it is the expected
 * version used when creating a key that does not exist yet.
 */
public record Pointer(String key, String payload, long version) {
  public Pointer {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(payload, "payload");
  }

  public static Pointer of(String key, String payload) {
    return new Pointer(key, payload, 0L);
  }

  public Pointer withVersion(long nextVersion) {
    return new Pointer(key, payload, nextVersion);
  }
}
