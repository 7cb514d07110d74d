package org.hypertrace.core.select.service.dispatch;

import java.io.IOException;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.export.ExportFormat;
import org.hypertrace.core.select.service.export.ExportRequest;
import org.hypertrace.core.select.service.export.SeriesExporter;
import org.hypertrace.core.select.service.params.MetricSelectorParser;

/**
 * Serves {@code selector[window] offset off} by exporting the raw samples of the window instead of
 * evaluating the query. The response uses the Prometheus HTTP API matrix format.
 */
class RawExportShapeHandler implements QueryShapeHandler {
  private static final QueryCost COST = new QueryCost(0.1);

  private final SeriesExporter seriesExporter;

  @Inject
  RawExportShapeHandler(SeriesExporter seriesExporter) {
    this.seriesExporter = seriesExporter;
  }

  @Override
  public String getName() {
    return "raw-export";
  }

  @Override
  public QueryCost canHandle(InstantQuery query) {
    return query
        .getRollupSugar()
        .filter(sugar -> !sugar.hasStep())
        .filter(sugar -> MetricSelectorParser.isSelector(sugar.getChildQuery()))
        .map(sugar -> COST)
        .orElse(QueryCost.UNSUPPORTED);
  }

  @Override
  public void handle(InstantQuery query, ResponseSink sink) throws IOException {
    RollupSugar sugar = query.getRollupSugar().orElseThrow();
    long window = RollupWindows.parseWindow(sugar.getWindow(), query.getStep());
    long offset = RollupWindows.parseOffset(sugar.getOffset(), query.getStep());
    long end = query.getTime() - offset;
    long start = end - window;
    ExportRequest exportRequest =
        ExportRequest.builder()
            .authToken(query.getContext().getAuthToken())
            .tagFilterss(MetricSelectorParser.parseMatches(List.of(sugar.getChildQuery())))
            .start(start)
            .end(end)
            .format(ExportFormat.PROMAPI)
            .deadline(query.getDeadline())
            .denyPartialResponse(query.isDenyPartialResponse())
            .build();
    seriesExporter.export(exportRequest, sink);
  }
}
