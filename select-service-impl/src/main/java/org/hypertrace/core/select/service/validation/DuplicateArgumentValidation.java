package org.hypertrace.core.select.service.validation;

import io.reactivex.rxjava3.core.Completable;
import java.util.List;
import java.util.Set;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.SelectRequest;

/** Rejects repeated single-valued arguments instead of silently using the first one. */
class DuplicateArgumentValidation implements QueryValidation {
  static final Set<String> SINGLE_VALUED_ARGS =
      Set.of(
          "query",
          "time",
          "start",
          "end",
          "step",
          "limit",
          "direction",
          "date",
          "topN",
          "format",
          "max_rows_per_line",
          "reduce_mem_usage",
          "nocache",
          "deny_partial_response",
          "timeout");

  @Override
  public Completable validate(SelectRequest request, RequestContext requestContext) {
    for (String arg : SINGLE_VALUED_ARGS) {
      List<String> values = request.getFormValues(arg);
      if (values.size() > 1) {
        return Completable.error(
            new RequestValidationException(
                String.format(
                    "duplicate `%s` arg; got %d values: %s", arg, values.size(), values)));
      }
    }
    return Completable.complete();
  }
}
