package org.hypertrace.core.select.service.partial;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.hypertrace.core.select.service.SelectServiceConfig;
import org.hypertrace.core.select.service.SelectServiceConfig.CacheResetConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks every configured select node to drop its rollup result cache, since the cache may hold
 * data of deleted series. Best effort: failures are logged and counted, never reported to the
 * caller.
 */
@Singleton
public class CacheResetBroadcaster {
  private static final Logger LOG = LoggerFactory.getLogger(CacheResetBroadcaster.class);
  private static final String RESET_CACHE_PATH = "internal/resetRollupResultCache";
  private static final String RESET_ERRORS_COUNTER = "select.service.cache.reset.errors";
  private static final String RESET_CALLS_COUNTER = "select.service.cache.reset.calls";

  private final List<String> selectNodes;
  private final OkHttpClient okHttpClient;
  private final Counter errorCounter;
  private final Counter callCounter;

  @Inject
  CacheResetBroadcaster(SelectServiceConfig config, MeterRegistry meterRegistry) {
    CacheResetConfig cacheResetConfig = config.getCacheResetConfig();
    this.selectNodes = cacheResetConfig.getSelectNodes();
    this.okHttpClient =
        new OkHttpClient.Builder().callTimeout(cacheResetConfig.getTimeout()).build();
    this.errorCounter = meterRegistry.counter(RESET_ERRORS_COUNTER);
    this.callCounter = meterRegistry.counter(RESET_CALLS_COUNTER);
  }

  /** Sends the reset calls; the returned future completes once every node answered or failed. */
  public CompletableFuture<Void> resetRollupResultCaches() {
    if (selectNodes.isEmpty()) {
      LOG.error("Cannot reset rollup result caches: no select nodes are configured");
      errorCounter.increment();
      return CompletableFuture.completedFuture(null);
    }
    List<CompletableFuture<Void>> calls =
        selectNodes.stream().map(this::resetCache).collect(Collectors.toUnmodifiableList());
    return CompletableFuture.allOf(calls.toArray(CompletableFuture[]::new))
        .whenComplete((unused, error) -> callCounter.increment());
  }

  private CompletableFuture<Void> resetCache(String selectNode) {
    String callUrl = String.format("http://%s/%s", selectNode, RESET_CACHE_PATH);
    Request request;
    try {
      request = new Request.Builder().url(callUrl).get().build();
    } catch (IllegalArgumentException e) {
      LOG.error("Invalid select node address {}", selectNode, e);
      errorCounter.increment();
      return CompletableFuture.completedFuture(null);
    }
    ResetCallback callback = new ResetCallback(callUrl);
    okHttpClient.newCall(request).enqueue(callback);
    return callback.future;
  }

  private class ResetCallback implements Callback {
    private final CompletableFuture<Void> future = new CompletableFuture<>();
    private final String callUrl;

    private ResetCallback(String callUrl) {
      this.callUrl = callUrl;
    }

    @Override
    public void onResponse(Call call, Response response) {
      try (response) {
        if (response.code() != 200) {
          LOG.error(
              "Unexpected status code at {}; got {}; want {}", callUrl, response.code(), 200);
          errorCounter.increment();
        }
      }
      future.complete(null);
    }

    @Override
    public void onFailure(Call call, IOException e) {
      LOG.error("Error when accessing {}", callUrl, e);
      errorCounter.increment();
      future.complete(null);
    }
  }
}
