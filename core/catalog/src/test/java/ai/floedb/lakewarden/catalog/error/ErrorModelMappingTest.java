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

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.lakewarden.catalog.model.ProjectId;
import ai.floedb.lakewarden.catalog.model.WarehouseId;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ErrorModelMappingTest {

  static Stream<Arguments> mappings() {
    return Stream.of(
        Arguments.of(
            CatalogBackendError.unexpected(new IOException("x")), "CatalogBackendError", 500),
        Arguments.of(
            CatalogBackendError.concurrentModification(new IOException("x")),
            "CatalogBackendError",
            409),
        Arguments.of(new DatabaseIntegrityError("bad"), "DatabaseIntegrityError", 500),
        Arguments.of(new WarehouseIdNotFound(WarehouseId.random()), "WarehouseNotFound", 404),
        Arguments.of(
            new WarehouseAlreadyExists("sales", ProjectId.of("p")), "WarehouseAlreadyExists", 409),
        Arguments.of(new ProjectIdNotFoundError(ProjectId.of("p")), "ProjectNotFound", 404),
        Arguments.of(
            new StorageProfileSerializationError(new JsonParseException(null, "broken")),
            "StorageProfileSerializationError",
            500),
        Arguments.of(new WarehouseHasUnfinishedTasks(), "WarehouseHasUnfinishedTasks", 409),
        Arguments.of(new WarehouseNotEmpty(), "WarehouseNotEmpty", 409),
        Arguments.of(new WarehouseProtected(), "WarehouseProtected", 409));
  }

  @ParameterizedTest
  @MethodSource("mappings")
  void mapsToTypeAndStatus(CatalogFailure failure, String type, int code) {
    failure.addDetail("ctx");
    ErrorModel model = failure.toErrorModel();

    assertThat(model.type()).isEqualTo(type);
    assertThat(model.code()).isEqualTo(code);
    assertThat(model.message()).isEqualTo(failure.asException().getMessage());
    assertThat(model.stack()).containsExactly("ctx");
  }

  @Test
  void onlySerializationErrorCarriesItsCause() {
    var parse = new JsonParseException(null, "broken");
    assertThat(new StorageProfileSerializationError(parse).toErrorModel().cause())
        .containsSame(parse);
    assertThat(CatalogBackendError.unexpected(parse).toErrorModel().cause()).isEmpty();
    assertThat(new DatabaseIntegrityError("bad").toErrorModel().cause()).isEmpty();
  }

  @Test
  void backendErrorsNeverMapTo503() {
    List<Throwable> sources =
        List.of(
            new IOException("connection refused"),
            new TimeoutException("pool exhausted"),
            new UncheckedIOException(new IOException("reset")),
            new IllegalStateException(),
            new RuntimeException("service unavailable"),
            new Error("out of memory"));
    for (Throwable source : sources) {
      for (CatalogBackendErrorType type : CatalogBackendErrorType.values()) {
        assertThat(CatalogBackendError.classify(source, type).toErrorModel().code())
            .isNotEqualTo(503)
            .isIn(409, 500);
      }
    }
  }

  @Test
  void sameMessageDifferentClassificationMapsDifferently() {
    var unexpected = CatalogBackendError.unexpected(new IOException("write failed"));
    var conflict = CatalogBackendError.concurrentModification(new IOException("write failed"));

    assertThat(unexpected.toErrorModel().code()).isEqualTo(500);
    assertThat(conflict.toErrorModel().code()).isEqualTo(409);
    assertThat(unexpected.source().getMessage()).isEqualTo(conflict.source().getMessage());
  }

  @Test
  void serializedModelOmitsSource() throws Exception {
    var model =
        new StorageProfileSerializationError(new JsonParseException(null, "broken"))
            .toErrorModel();

    String json = new ObjectMapper().writeValueAsString(model);

    assertThat(json)
        .isEqualTo(
            "{\"message\":\"Error serializing storage profile: broken\","
                + "\"type\":\"StorageProfileSerializationError\",\"code\":500,\"stack\":[]}");
  }
}
