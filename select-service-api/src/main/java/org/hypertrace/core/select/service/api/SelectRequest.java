package org.hypertrace.core.select.service.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;

/**
 * Parsed request arguments. Form values keep their order and multiplicity (e.g. repeated {@code
 * match[]}), path parameters carry values extracted from the route such as the label name.
 */
@EqualsAndHashCode
public class SelectRequest {
  private final Map<String, List<String>> form;
  private final Map<String, String> pathParams;

  private SelectRequest(Map<String, List<String>> form, Map<String, String> pathParams) {
    this.form = Collections.unmodifiableMap(form);
    this.pathParams = Collections.unmodifiableMap(pathParams);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns the first value of the argument or an empty string when it is missing. */
  public String getFormValue(String name) {
    List<String> values = form.get(name);
    if (values == null || values.isEmpty()) {
      return "";
    }
    return values.get(0);
  }

  public List<String> getFormValues(String name) {
    return form.getOrDefault(name, List.of());
  }

  public boolean hasFormValue(String name) {
    return !getFormValues(name).isEmpty();
  }

  public Optional<String> getPathParam(String name) {
    return Optional.ofNullable(pathParams.get(name));
  }

  /** Returns a copy of this request with the path parameter set. */
  public SelectRequest withPathParam(String name, String value) {
    Map<String, String> params = new LinkedHashMap<>(pathParams);
    params.put(name, value);
    return new SelectRequest(form, params);
  }

  @Override
  public String toString() {
    return "SelectRequest{form=" + form + ", pathParams=" + pathParams + "}";
  }

  public static class Builder {
    private final Map<String, List<String>> form = new LinkedHashMap<>();
    private final Map<String, String> pathParams = new LinkedHashMap<>();

    private Builder() {}

    public Builder addFormValue(String name, String value) {
      form.computeIfAbsent(name, unused -> new ArrayList<>()).add(value);
      return this;
    }

    public Builder setPathParam(String name, String value) {
      pathParams.put(name, value);
      return this;
    }

    public SelectRequest build() {
      Map<String, List<String>> copy = new LinkedHashMap<>();
      form.forEach((name, values) -> copy.put(name, List.copyOf(values)));
      return new SelectRequest(copy, new LinkedHashMap<>(pathParams));
    }
  }
}
