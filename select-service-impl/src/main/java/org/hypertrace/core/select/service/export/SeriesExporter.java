package org.hypertrace.core.select.service.export;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SearchQuery;
import org.hypertrace.core.select.service.api.SearchResults;
import org.hypertrace.core.select.service.api.Series;
import org.hypertrace.core.select.service.api.StorageBlock;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.api.TimeRange;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;
import org.hypertrace.core.select.service.pipeline.ExportBlock;
import org.hypertrace.core.select.service.pipeline.FragmentEmitter;
import org.hypertrace.core.select.service.pipeline.ObjectPool;
import org.hypertrace.core.select.service.pipeline.ResultBuffer;
import org.hypertrace.core.select.service.pipeline.RowsPerLineSplitter;
import org.hypertrace.core.select.service.pipeline.StreamingResultPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams raw samples of the matching series. Series are either fetched whole and serialized by
 * the fetch workers, or, in reduced memory mode, decoded block by block with every sample given
 * the {@link ExportBlock#PLACEHOLDER_VALUE placeholder value}.
 */
@Singleton
public class SeriesExporter {
  private static final Logger LOG = LoggerFactory.getLogger(SeriesExporter.class);
  private static final int MAX_IDLE_EXPORT_BLOCKS = 4 * Runtime.getRuntime().availableProcessors();

  private final StorageClient storageClient;
  private final StreamingResultPipeline pipeline;
  private final PartialResponsePolicy partialResponsePolicy;
  private final ObjectPool<ExportBlock> exportBlockPool =
      new ObjectPool<>(ExportBlock::new, MAX_IDLE_EXPORT_BLOCKS);

  @Inject
  public SeriesExporter(
      StorageClient storageClient,
      StreamingResultPipeline pipeline,
      PartialResponsePolicy partialResponsePolicy) {
    this.storageClient = storageClient;
    this.pipeline = pipeline;
    this.partialResponsePolicy = partialResponsePolicy;
  }

  public void export(ExportRequest request, ResponseSink sink) throws IOException {
    SearchQuery searchQuery = toSearchQuery(request);
    ExportFormat format = request.getFormat();
    ExportLineWriter lineWriter = format.getLineWriter();
    int maxRowsPerLine = request.getMaxRowsPerLine();

    if (!request.isReduceMemUsage()) {
      SearchResults results = search(request, searchQuery);
      partialResponsePolicy.check(
          results.isPartial(), request.isDenyPartialResponse(), results::cancel);
      sink.setContentType(format.getContentType());
      BufferedResponseWriter writer = newWriter(sink, results);
      pipeline.stream(
          writer,
          emitter ->
              results.runParallel(
                  (series, workerId) -> emitSeries(emitter, series, lineWriter, maxRowsPerLine)),
          format.getFramer(results.isPartial()));
      return;
    }

    sink.setContentType(format.getContentType());
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    AtomicBoolean isPartial = new AtomicBoolean();
    pipeline.stream(
        writer,
        emitter ->
            isPartial.set(
                storageClient.exportBlocks(
                    request.getAuthToken(),
                    searchQuery,
                    request.getDeadline(),
                    (metricName, block, timeRange) ->
                        emitBlock(
                            emitter, metricName, block, timeRange, lineWriter, maxRowsPerLine))),
        format.getFramer(false));
    partialResponsePolicy.checkAfterStreaming(isPartial.get(), request.isDenyPartialResponse());
  }

  /** Writes the native binary stream; completeness is only known once all blocks were written. */
  public void exportNative(ExportRequest request, ResponseSink sink) throws IOException {
    SearchQuery searchQuery = toSearchQuery(request);
    sink.setContentType(NativeExportEncoder.CONTENT_TYPE);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    NativeExportEncoder.writeHeader(writer, request.getStart(), request.getEnd());
    boolean isPartial;
    try {
      isPartial =
          storageClient.exportBlocks(
              request.getAuthToken(),
              searchQuery,
              request.getDeadline(),
              (metricName, block, timeRange) -> {
                writer.checkError();
                // keep each record contiguous in the shared writer
                synchronized (writer) {
                  NativeExportEncoder.writeRecord(writer, metricName, block);
                }
              });
    } catch (StorageException e) {
      throw new QueryExecutionException(
          String.format("error during data fetching for %s: %s", searchQuery, e.getMessage()), e);
    }
    partialResponsePolicy.checkAfterStreaming(isPartial, request.isDenyPartialResponse());
    writer.flush();
  }

  private void emitSeries(
      FragmentEmitter emitter, Series series, ExportLineWriter lineWriter, int maxRowsPerLine)
      throws IOException {
    emitter.checkWriter();
    ExportBlock block = exportBlockPool.claim();
    try {
      block.wrap(series);
      emitLines(emitter, block, lineWriter, maxRowsPerLine);
    } finally {
      exportBlockPool.release(block);
    }
  }

  private void emitBlock(
      FragmentEmitter emitter,
      MetricName metricName,
      StorageBlock storageBlock,
      TimeRange timeRange,
      ExportLineWriter lineWriter,
      int maxRowsPerLine)
      throws IOException {
    emitter.checkWriter();
    try {
      storageBlock.unmarshalData();
    } catch (StorageException e) {
      throw new QueryExecutionException(
          "cannot unmarshal block during export: " + e.getMessage(), e);
    }
    ExportBlock block = exportBlockPool.claim();
    try {
      block.fill(metricName, storageBlock, timeRange);
      if (!block.isEmpty()) {
        emitLines(emitter, block, lineWriter, maxRowsPerLine);
      }
    } finally {
      exportBlockPool.release(block);
    }
  }

  private static void emitLines(
      FragmentEmitter emitter, ExportBlock block, ExportLineWriter lineWriter, int maxRowsPerLine)
      throws IOException {
    RowsPerLineSplitter.forEachLine(
        block,
        maxRowsPerLine,
        line -> {
          ResultBuffer buffer = emitter.claim();
          lineWriter.writeLine(line, buffer);
          emitter.emit(buffer);
        });
  }

  private SearchResults search(ExportRequest request, SearchQuery searchQuery) {
    try {
      return storageClient.processSearchQuery(
          request.getAuthToken(), searchQuery, true, request.getDeadline());
    } catch (StorageException e) {
      throw new QueryExecutionException(
          String.format("cannot fetch data for %s: %s", searchQuery, e.getMessage()), e);
    }
  }

  private static BufferedResponseWriter newWriter(ResponseSink sink, SearchResults results)
      throws IOException {
    try {
      return new BufferedResponseWriter(sink.getOutputStream());
    } catch (IOException e) {
      LOG.debug("Cancelling fetch of {} series; transport unavailable", results.size());
      results.cancel();
      throw e;
    }
  }

  private static SearchQuery toSearchQuery(ExportRequest request) {
    return SearchQuery.of(
        request.getAuthToken(), request.getStart(), request.getEnd(), request.getTagFilterss());
  }
}
