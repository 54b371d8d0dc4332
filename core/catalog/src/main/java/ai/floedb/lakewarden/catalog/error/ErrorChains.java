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

import java.util.IdentityHashMap;
import java.util.Map;

/** Renders native cause chains for operator diagnostics. */
public final class ErrorChains {
  private ErrorChains() {}

  public static String render(Throwable t) {
    var sb = new StringBuilder();
    appendChain(sb, t);
    return sb.toString();
  }

  /** Deepest cause of {@code t}; on a cause cycle, the last cause before the cycle repeats. */
  public static Throwable rootCause(Throwable t) {
    if (t == null) {
      return null;
    }
    Map<Throwable, Boolean> seen = new IdentityHashMap<>();
    Throwable root = t;
    seen.put(root, Boolean.TRUE);
    while (root.getCause() != null && seen.put(root.getCause(), Boolean.TRUE) == null) {
      root = root.getCause();
    }
    return root;
  }

  static void appendChain(StringBuilder sb, Throwable t) {
    sb.append(t).append("\n\n");
    Map<Throwable, Boolean> seen = new IdentityHashMap<>();
    seen.put(t, Boolean.TRUE);
    Throwable current = t.getCause();
    while (current != null && seen.put(current, Boolean.TRUE) == null) {
      sb.append("Caused by:\n\t").append(current).append('\n');
      current = current.getCause();
    }
  }
}
