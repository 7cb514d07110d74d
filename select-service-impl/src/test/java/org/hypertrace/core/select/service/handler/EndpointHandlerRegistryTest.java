package org.hypertrace.core.select.service.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.Set;
import org.hypertrace.core.select.service.SelectServiceTestUtils;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.handler.EndpointHandlerRegistry.Route;
import org.junit.jupiter.api.Test;

class EndpointHandlerRegistryTest {
  private final EndpointHandler labels = handler("/api/v1/labels");
  private final EndpointHandler labelValues = handler("/api/v1/label/{name}/values");
  private final EndpointHandlerRegistry registry =
      new EndpointHandlerRegistry(Set.of(labels, labelValues));

  @Test
  void routesStaticPath() {
    SelectRequest request = SelectServiceTestUtils.request("match[]", "up");

    Route route = registry.route("/api/v1/labels", request).orElseThrow();

    assertSame(labels, route.getHandler());
    assertEquals(request, route.getRequest());
  }

  @Test
  void bindsPathParameters() {
    SelectRequest request = SelectRequest.newBuilder().build();

    Route route = registry.route("/api/v1/label/job/values", request).orElseThrow();

    assertSame(labelValues, route.getHandler());
    assertEquals(Optional.of("job"), route.getRequest().getPathParam("name"));
  }

  @Test
  void rejectsUnknownPathsAndEmptyParameters() {
    SelectRequest request = SelectRequest.newBuilder().build();

    assertTrue(registry.route("/api/v1/label//values", request).isEmpty());
    assertTrue(registry.route("/api/v1/labels/extra", request).isEmpty());
    assertTrue(registry.route("/api/v1/unknown", request).isEmpty());
  }

  @Test
  void listsServedPaths() {
    assertEquals(Set.of("/api/v1/labels", "/api/v1/label/{name}/values"), registry.getPaths());
  }

  private static EndpointHandler handler(String path) {
    EndpointHandler handler = mock(EndpointHandler.class);
    when(handler.getPath()).thenReturn(path);
    return handler;
  }
}
