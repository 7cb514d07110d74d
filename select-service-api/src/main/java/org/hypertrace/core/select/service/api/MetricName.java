package org.hypertrace.core.select.service.api;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.Value;

/**
 * Identity of a series: the metric group (the {@code __name__} label) plus its ordered tags.
 *
 * <p>The portable encoding written by {@link #marshalWithoutTenant()} escapes the separator bytes
 * inside every value so the encoded tags can be concatenated and split unambiguously.
 */
@Value
public class MetricName {
  private static final byte ESCAPE_CHAR = 0;
  private static final byte TAG_SEPARATOR_CHAR = 1;
  private static final byte KV_SEPARATOR_CHAR = 2;

  @NonNull String metricGroup;
  @NonNull List<Tag> tags;

  public static MetricName of(String metricGroup, List<Tag> tags) {
    return new MetricName(metricGroup, List.copyOf(tags));
  }

  public static MetricName of(String metricGroup) {
    return new MetricName(metricGroup, List.of());
  }

  /** Returns the value for the tag, treating {@code __name__} as the metric group. */
  public Optional<String> getTagValue(String key) {
    if (TagFilter.METRIC_NAME_LABEL.equals(key)) {
      return metricGroup.isEmpty() ? Optional.empty() : Optional.of(metricGroup);
    }
    return tags.stream().filter(tag -> tag.getKey().equals(key)).map(Tag::getValue).findFirst();
  }

  public byte[] marshalWithoutTenant() {
    ByteArrayOutputStream out = new ByteArrayOutputStream(64);
    marshalTagValue(out, metricGroup);
    for (Tag tag : tags) {
      marshalTagValue(out, tag.getKey());
      marshalTagValue(out, tag.getValue());
    }
    return out.toByteArray();
  }

  private static void marshalTagValue(ByteArrayOutputStream out, String value) {
    for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
      switch (b) {
        case ESCAPE_CHAR:
          out.write(ESCAPE_CHAR);
          out.write('0');
          break;
        case TAG_SEPARATOR_CHAR:
          out.write(ESCAPE_CHAR);
          out.write('1');
          break;
        case KV_SEPARATOR_CHAR:
          out.write(ESCAPE_CHAR);
          out.write('2');
          break;
        default:
          out.write(b);
      }
    }
    out.write(TAG_SEPARATOR_CHAR);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(metricGroup).append('{');
    for (int i = 0; i < tags.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(tags.get(i).getKey()).append("=\"").append(tags.get(i).getValue()).append('"');
    }
    return sb.append('}').toString();
  }

  @Value(staticConstructor = "of")
  public static class Tag {
    @NonNull String key;
    @NonNull String value;
  }
}
