package org.hypertrace.core.select.service.pipeline;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.SelectServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams serialized results to the transport while they are still being fetched.
 *
 * <p>The fetch task runs on the fetch executor and hands every fragment through a bounded queue to
 * the calling thread, which frames and writes them. The queue is closed when the fetch task ends,
 * successfully or not. The fetch error is reported only after the writer drained the queue and
 * flushed, so no fragment is left unreleased.
 */
@Singleton
public class StreamingResultPipeline {
  public static final String FETCH_EXECUTOR = "fetch";
  private static final Logger LOG = LoggerFactory.getLogger(StreamingResultPipeline.class);

  private final ExecutorService fetchExecutor;
  private final ResultBufferPool bufferPool;
  private final int queueCapacity;

  @Inject
  public StreamingResultPipeline(
      @Named(FETCH_EXECUTOR) ExecutorService fetchExecutor, ResultBufferPool bufferPool) {
    this(fetchExecutor, bufferPool, Runtime.getRuntime().availableProcessors());
  }

  StreamingResultPipeline(
      ExecutorService fetchExecutor, ResultBufferPool bufferPool, int queueCapacity) {
    this.fetchExecutor = fetchExecutor;
    this.bufferPool = bufferPool;
    this.queueCapacity = queueCapacity;
  }

  public void stream(BufferedResponseWriter writer, FetchTask task, ResponseFramer framer)
      throws IOException {
    HandOffQueue<ResultBuffer> queue = new HandOffQueue<>(queueCapacity, bufferPool::release);
    Future<?> producer =
        fetchExecutor.submit(
            () -> {
              try {
                task.fetch(new QueueEmitter(writer, queue));
              } finally {
                queue.close();
              }
              return null;
            });
    try {
      framer.writeResponse(writer, new QueueFragments(queue));
    } catch (IOException | RuntimeException e) {
      queue.abort();
      Throwable fetchError = waitForCompletion(producer);
      if (fetchError != null) {
        LOG.debug("Fetch error after the response writer failed", fetchError);
      }
      throw e;
    }
    writer.flush();
    Throwable fetchError = waitForCompletion(producer);
    if (fetchError == null) {
      return;
    }
    if (fetchError instanceof IOException) {
      throw (IOException) fetchError;
    }
    if (fetchError instanceof SelectServiceException) {
      throw (SelectServiceException) fetchError;
    }
    throw new QueryExecutionException(
        "error during data fetching: " + fetchError.getMessage(), fetchError);
  }

  @Nullable
  private static Throwable waitForCompletion(Future<?> producer) throws InterruptedIOException {
    try {
      producer.get();
      return null;
    } catch (InterruptedException e) {
      producer.cancel(true);
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while waiting for the fetch workers");
    } catch (ExecutionException e) {
      return e.getCause();
    }
  }

  private class QueueEmitter implements FragmentEmitter {
    private final BufferedResponseWriter writer;
    private final HandOffQueue<ResultBuffer> queue;

    private QueueEmitter(BufferedResponseWriter writer, HandOffQueue<ResultBuffer> queue) {
      this.writer = writer;
      this.queue = queue;
    }

    @Override
    public void checkWriter() throws IOException {
      writer.checkError();
    }

    @Override
    public ResultBuffer claim() {
      return bufferPool.claim();
    }

    @Override
    public void emit(ResultBuffer buffer) throws IOException {
      try {
        queue.put(buffer);
      } catch (IOException e) {
        bufferPool.release(buffer);
        throw e;
      }
    }
  }

  private class QueueFragments implements Fragments {
    private final HandOffQueue<ResultBuffer> queue;

    private QueueFragments(HandOffQueue<ResultBuffer> queue) {
      this.queue = queue;
    }

    @Override
    public void forEach(FragmentVisitor visitor) throws IOException {
      Exception firstError = null;
      int index = 0;
      for (ResultBuffer fragment = queue.take(); fragment != null; fragment = queue.take()) {
        if (firstError == null) {
          try {
            visitor.visit(fragment, index);
          } catch (IOException | RuntimeException e) {
            firstError = e;
          }
        }
        index++;
        bufferPool.release(fragment);
      }
      if (firstError instanceof IOException) {
        throw (IOException) firstError;
      }
      if (firstError != null) {
        throw (RuntimeException) firstError;
      }
    }
  }
}
