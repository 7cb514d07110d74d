package org.hypertrace.core.select.service.handler;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.Value;
import org.hypertrace.core.select.service.api.SelectRequest;

/** Resolves request paths to their endpoint handler. */
@Singleton
public class EndpointHandlerRegistry {
  private final List<EndpointHandler> handlers;

  @Inject
  public EndpointHandlerRegistry(Set<EndpointHandler> handlers) {
    this.handlers = List.copyOf(handlers);
  }

  /** Returns the matching handler together with the request carrying the bound path params. */
  public Optional<Route> route(String path, SelectRequest request) {
    String[] segments = split(path);
    for (EndpointHandler handler : handlers) {
      Optional<SelectRequest> bound = bind(split(handler.getPath()), segments, request);
      if (bound.isPresent()) {
        return Optional.of(new Route(handler, bound.get()));
      }
    }
    return Optional.empty();
  }

  public Set<String> getPaths() {
    return handlers.stream().map(EndpointHandler::getPath).collect(Collectors.toSet());
  }

  private static Optional<SelectRequest> bind(
      String[] template, String[] segments, SelectRequest request) {
    if (template.length != segments.length) {
      return Optional.empty();
    }
    SelectRequest bound = request;
    for (int i = 0; i < template.length; i++) {
      String part = template[i];
      if (part.startsWith("{") && part.endsWith("}")) {
        if (segments[i].isEmpty()) {
          return Optional.empty();
        }
        bound = bound.withPathParam(part.substring(1, part.length() - 1), segments[i]);
      } else if (!part.equals(segments[i])) {
        return Optional.empty();
      }
    }
    return Optional.of(bound);
  }

  private static String[] split(String path) {
    String trimmed = path.startsWith("/") ? path.substring(1) : path;
    return trimmed.split("/", -1);
  }

  @Value
  public static class Route {
    EndpointHandler handler;
    SelectRequest request;
  }
}
