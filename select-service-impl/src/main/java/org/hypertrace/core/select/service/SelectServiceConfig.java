package org.hypertrace.core.select.service;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.List;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class SelectServiceConfig {

  private static final String CONFIG_PATH_SEARCH = "search";
  private static final String CONFIG_PATH_LIMIT_VALIDATION = "validation.limit";
  private static final String CONFIG_PATH_TAIL = "tail";
  private static final String CONFIG_PATH_CACHE_RESET = "cacheReset";

  SearchConfig searchConfig;
  LimitValidationConfig limitValidationConfig;
  TailConfig tailConfig;
  CacheResetConfig cacheResetConfig;

  public SelectServiceConfig(Config config) {
    Config resolved = config.resolve();
    this.searchConfig = new SearchConfig(resolved.getConfig(CONFIG_PATH_SEARCH));
    this.limitValidationConfig =
        new LimitValidationConfig(resolved.getConfig(CONFIG_PATH_LIMIT_VALIDATION));
    this.tailConfig = new TailConfig(resolved.getConfig(CONFIG_PATH_TAIL));
    this.cacheResetConfig = new CacheResetConfig(resolved.getConfig(CONFIG_PATH_CACHE_RESET));
  }

  /** Limits and defaults applied to every search. Zero durations mean "not set". */
  @Value
  @NonFinal
  public static class SearchConfig {
    private static final String CONFIG_PATH_MAX_QUERY_LEN = "maxQueryLen";
    private static final String CONFIG_PATH_LATENCY_OFFSET = "latencyOffset";
    private static final String CONFIG_PATH_MAX_LOOKBACK = "maxLookback";
    private static final String CONFIG_PATH_MAX_STALENESS_INTERVAL = "maxStalenessInterval";
    private static final String CONFIG_PATH_MAX_POINTS_PER_TIMESERIES = "maxPointsPerTimeseries";
    private static final String CONFIG_PATH_MAX_QUERY_DURATION = "maxQueryDuration";
    private static final String CONFIG_PATH_MAX_EXPORT_DURATION = "maxExportDuration";
    private static final String CONFIG_PATH_DENY_PARTIAL_RESPONSE = "denyPartialResponse";

    int maxQueryLen;
    Duration latencyOffset;
    Duration maxLookback;
    Duration maxStalenessInterval;
    int maxPointsPerTimeseries;
    Duration maxQueryDuration;
    Duration maxExportDuration;
    boolean denyPartialResponse;

    private SearchConfig(Config config) {
      this.maxQueryLen = config.getBytes(CONFIG_PATH_MAX_QUERY_LEN).intValue();
      this.latencyOffset = config.getDuration(CONFIG_PATH_LATENCY_OFFSET);
      this.maxLookback = config.getDuration(CONFIG_PATH_MAX_LOOKBACK);
      this.maxStalenessInterval = config.getDuration(CONFIG_PATH_MAX_STALENESS_INTERVAL);
      this.maxPointsPerTimeseries = config.getInt(CONFIG_PATH_MAX_POINTS_PER_TIMESERIES);
      this.maxQueryDuration = config.getDuration(CONFIG_PATH_MAX_QUERY_DURATION);
      this.maxExportDuration = config.getDuration(CONFIG_PATH_MAX_EXPORT_DURATION);
      this.denyPartialResponse = config.getBoolean(CONFIG_PATH_DENY_PARTIAL_RESPONSE);
    }
  }

  @Value
  @NonFinal
  public static class LimitValidationConfig {
    private static final String CONFIG_PATH_MIN = "min";
    private static final String CONFIG_PATH_MAX = "max";
    private static final String CONFIG_PATH_MODE = "mode";
    long min;
    long max;
    LimitValidationMode mode;

    private LimitValidationConfig(Config config) {
      this.min = config.getLong(CONFIG_PATH_MIN);
      this.max = config.getLong(CONFIG_PATH_MAX);
      this.mode = config.getEnum(LimitValidationMode.class, CONFIG_PATH_MODE);
    }

    public enum LimitValidationMode {
      DISABLED,
      WARN,
      ERROR
    }
  }

  @Value
  @NonFinal
  public static class TailConfig {
    private static final String CONFIG_PATH_POLL_INTERVAL = "pollInterval";
    private static final String CONFIG_PATH_STEP = "step";
    Duration pollInterval;
    Duration step;

    private TailConfig(Config config) {
      this.pollInterval = config.getDuration(CONFIG_PATH_POLL_INTERVAL);
      this.step = config.getDuration(CONFIG_PATH_STEP);
    }
  }

  /** Peers whose rollup result caches are reset after series are deleted. */
  @Value
  @NonFinal
  public static class CacheResetConfig {
    private static final String CONFIG_PATH_SELECT_NODES = "selectNodes";
    private static final String CONFIG_PATH_TIMEOUT = "timeout";
    List<String> selectNodes;
    Duration timeout;

    private CacheResetConfig(Config config) {
      this.selectNodes = List.copyOf(config.getStringList(CONFIG_PATH_SELECT_NODES));
      this.timeout = config.getDuration(CONFIG_PATH_TIMEOUT);
    }
  }
}
