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

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Storage configuration of a warehouse. The catalog does not interpret it beyond persisting it,
 * so the properties are kept as an ordered map of arbitrary values.
 *
 * <p>Numbers, also inside nested maps and lists, are normalized to the types they read back as
 * from JSON: integral values to the smallest of {@code Integer}, {@code Long} and {@code
 * BigInteger} that holds them, other numbers to {@code Double}. A persisted profile is therefore
 * equal to the one that was written.
 */
public record StorageProfile(
    @JsonProperty("type") String type, @JsonProperty("properties") Map<String, Object> properties) {

  public StorageProfile {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("storage profile type must not be blank");
    }
    properties = properties == null ? Map.of() : normalizeMap(properties);
  }

  public static StorageProfile of(String type, Map<String, Object> properties) {
    return new StorageProfile(type, properties);
  }

  public Object property(String key) {
    return properties.get(Objects.requireNonNull(key, "key"));
  }

  private static <K> Map<K, Object> normalizeMap(Map<K, ?> map) {
    Map<K, Object> out = new LinkedHashMap<>();
    for (Map.Entry<K, ?> e : map.entrySet()) {
      out.put(e.getKey(), normalize(e.getValue()));
    }
    return Collections.unmodifiableMap(out);
  }

  private static Object normalize(Object value) {
    if (value instanceof Map<?, ?> map) {
      return normalizeMap(map);
    }
    if (value instanceof List<?> list) {
      List<Object> out = new ArrayList<>(list.size());
      for (Object element : list) {
        out.add(normalize(element));
      }
      return Collections.unmodifiableList(out);
    }
    if (value instanceof Byte || value instanceof Short || value instanceof Long) {
      long v = ((Number) value).longValue();
      return v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE ? Integer.valueOf((int) v) : value;
    }
    if (value instanceof BigInteger big) {
      if (big.bitLength() < 32) {
        return big.intValue();
      }
      return big.bitLength() < 64 ? Long.valueOf(big.longValue()) : big;
    }
    if (value instanceof Float || value instanceof BigDecimal) {
      return ((Number) value).doubleValue();
    }
    return value;
  }
}
