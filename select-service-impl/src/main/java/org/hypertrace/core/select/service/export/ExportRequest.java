package org.hypertrace.core.select.service.export;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.select.service.api.AuthToken;
import org.hypertrace.core.select.service.api.Deadline;
import org.hypertrace.core.select.service.api.TagFilter;

@Value
@Builder
public class ExportRequest {
  @NonNull AuthToken authToken;
  @NonNull List<List<TagFilter>> tagFilterss;
  long start;
  long end;
  @NonNull @Builder.Default ExportFormat format = ExportFormat.JSON_LINES;
  /** Zero or negative means a single line per series. */
  int maxRowsPerLine;
  boolean reduceMemUsage;
  @NonNull Deadline deadline;
  boolean denyPartialResponse;
}
