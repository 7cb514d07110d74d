package org.hypertrace.core.select.service.format;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import org.hypertrace.core.select.service.api.LabelEntry;
import org.hypertrace.core.select.service.api.TsdbStatus;
import org.hypertrace.core.select.service.api.TsdbStatus.TopEntry;

/** {@code {"status":"success","data":...}} responses of the label, series and status endpoints. */
public final class AdminResponseWriter {

  private AdminResponseWriter() {}

  /** Used for both label names and label values. */
  public static void writeStrings(OutputStream out, List<String> values, boolean isPartial)
      throws IOException {
    ArrayNode data = JsonFormats.objectMapper().createArrayNode();
    values.forEach(data::add);
    write(out, data, isPartial);
  }

  public static void writeLabelsCount(
      OutputStream out, List<LabelEntry> labelEntries, boolean isPartial) throws IOException {
    ObjectNode data = JsonFormats.objectMapper().createObjectNode();
    for (LabelEntry entry : labelEntries) {
      data.put(entry.getKey(), entry.getValues().size());
    }
    write(out, data, isPartial);
  }

  public static void writeTsdbStatus(OutputStream out, TsdbStatus status, boolean isPartial)
      throws IOException {
    ObjectNode data = JsonFormats.objectMapper().createObjectNode();
    data.set("seriesCountByMetricName", topEntries(status.getSeriesCountByMetricName()));
    data.set("labelValueCountByLabelName", topEntries(status.getLabelValueCountByLabelName()));
    data.set("seriesCountByLabelValuePair", topEntries(status.getSeriesCountByLabelValuePair()));
    write(out, data, isPartial);
  }

  public static void writeSeriesCount(OutputStream out, long count, boolean isPartial)
      throws IOException {
    ArrayNode data = JsonFormats.objectMapper().createArrayNode();
    data.add(count);
    write(out, data, isPartial);
  }

  private static ArrayNode topEntries(List<TopEntry> entries) {
    ArrayNode array = JsonFormats.objectMapper().createArrayNode();
    for (TopEntry entry : entries) {
      array.addObject().put("name", entry.getName()).put("value", entry.getCount());
    }
    return array;
  }

  private static void write(OutputStream out, JsonNode data, boolean isPartial)
      throws IOException {
    ObjectNode response = JsonFormats.objectMapper().createObjectNode();
    response.put("status", "success");
    response.put("isPartial", isPartial);
    response.set("data", data);
    try (JsonGenerator generator = JsonFormats.newGenerator(out)) {
      JsonFormats.objectMapper().writeTree(generator, response);
    }
  }
}
