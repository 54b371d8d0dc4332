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
package ai.floedb.lakewarden.service.error.impl;

import ai.floedb.lakewarden.catalog.error.CatalogBackendError;
import ai.floedb.lakewarden.catalog.error.CatalogFailure;
import ai.floedb.lakewarden.catalog.error.ErrorChains;
import ai.floedb.lakewarden.catalog.error.ErrorModel;
import ai.floedb.lakewarden.service.api.error.IcebergError;
import ai.floedb.lakewarden.service.api.error.IcebergErrorResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

/**
 * Converts catalog failures into the Iceberg REST error body. This is the only place where the
 * wire representation of an error is built.
 */
@ApplicationScoped
public class IcebergErrors {
  private static final Logger LOG = Logger.getLogger(IcebergErrors.class);

  public static final String DEBUG_DETAILS_KEY = "lakewarden.errors.debug-details";
  public static final String INCLUDE_STACK_KEY = "lakewarden.errors.include-stack";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final boolean debugDetails;
  private final boolean includeStack;

  public IcebergErrors() {
    this(fetchFlag(DEBUG_DETAILS_KEY, false), fetchFlag(INCLUDE_STACK_KEY, true));
  }

  public IcebergErrors(boolean debugDetails, boolean includeStack) {
    this.debugDetails = debugDetails;
    this.includeStack = includeStack;
  }

  /** Any throwable that is not a catalog failure is reported as an unexpected backend error. */
  public IcebergErrorResponse toResponse(Throwable t) {
    if (t instanceof CatalogFailure failure) {
      return render(failure.toErrorModel(), t);
    }
    return render(CatalogBackendError.unexpected(t).toErrorModel(), t);
  }

  public String toJson(IcebergErrorResponse response) {
    try {
      return MAPPER.writeValueAsString(response);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("cannot serialize error response", e);
    }
  }

  private IcebergErrorResponse render(ErrorModel model, Throwable thrown) {
    List<String> stack = new ArrayList<>();
    if (includeStack) {
      stack.addAll(model.stack());
      model.cause().ifPresent(cause -> appendCauses(stack, cause));
    }
    if (debugDetails && thrown != null) {
      Throwable root = ErrorChains.rootCause(thrown);
      stack.add("Root cause: " + root);
    }
    if (model.code() >= 500) {
      LOG.debugf("internal error returned to client: %s", model.message());
    }
    return new IcebergErrorResponse(
        new IcebergError(model.message(), model.type(), model.code(), stack));
  }

  private static void appendCauses(List<String> stack, Throwable cause) {
    Map<Throwable, Boolean> seen = new IdentityHashMap<>();
    Throwable current = cause;
    while (current != null && seen.put(current, Boolean.TRUE) == null) {
      stack.add("Caused by: " + current);
      current = current.getCause();
    }
  }

  private static boolean fetchFlag(String key, boolean defaultValue) {
    try {
      return ConfigProvider.getConfig().getOptionalValue(key, Boolean.class).orElse(defaultValue);
    } catch (IllegalStateException e) {
      // no config implementation available
      LOG.debugf(e, "config lookup of %s failed, using %s", key, defaultValue);
      return defaultValue;
    }
  }
}
