package org.hypertrace.core.select.service.params;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.api.TagFilter;
import org.hypertrace.core.select.service.util.SearchQueryUtil;

/**
 * Parses series selectors such as {@code up{job="a", instance=~"host-.+"}} into tag filters.
 * Label values may be quoted with double quotes, single quotes or backticks.
 */
public class MetricSelectorParser {
  private final String selector;
  private int pos;

  private MetricSelectorParser(String selector) {
    this.selector = selector;
  }

  public static List<TagFilter> parse(String selector) {
    try {
      return new MetricSelectorParser(selector).parseSelector();
    } catch (RequestValidationException e) {
      throw new RequestValidationException(
          String.format("cannot parse %s: %s", selector, e.getMessage()), e);
    }
  }

  /** Parses every match expression into its own filter set. */
  public static List<List<TagFilter>> parseMatches(List<String> matches) {
    List<List<TagFilter>> tagFilterss = new ArrayList<>(matches.size());
    for (String match : matches) {
      tagFilterss.add(parse(match));
    }
    return tagFilterss;
  }

  public static boolean isSelector(String s) {
    try {
      new MetricSelectorParser(s).parseSelector();
      return true;
    } catch (RequestValidationException e) {
      return false;
    }
  }

  private List<TagFilter> parseSelector() {
    List<TagFilter> filters = new ArrayList<>();
    skipWhitespace();
    if (pos < selector.length() && isMetricNameStart(selector.charAt(pos))) {
      String name = readIdentifier(true);
      filters.add(SearchQueryUtil.createEqualsFilter(TagFilter.METRIC_NAME_LABEL, name));
      skipWhitespace();
    }
    if (pos < selector.length() && selector.charAt(pos) == '{') {
      pos++;
      parseMatchers(filters);
    }
    skipWhitespace();
    if (pos != selector.length()) {
      throw error("unexpected token at position " + pos);
    }
    if (filters.isEmpty()) {
      throw error("selector must contain at least one filter");
    }
    return filters;
  }

  private void parseMatchers(List<TagFilter> filters) {
    while (true) {
      skipWhitespace();
      if (pos >= selector.length()) {
        throw error("missing closing `}`");
      }
      if (selector.charAt(pos) == '}') {
        pos++;
        return;
      }
      String key = readIdentifier(false);
      skipWhitespace();
      String op = readOperator();
      skipWhitespace();
      String value = readQuoted();
      filters.add(toFilter(key, op, value));
      skipWhitespace();
      if (pos < selector.length() && selector.charAt(pos) == ',') {
        pos++;
      } else if (pos >= selector.length() || selector.charAt(pos) != '}') {
        throw error("expecting `,` or `}` at position " + pos);
      }
    }
  }

  private static TagFilter toFilter(String key, String op, String value) {
    switch (op) {
      case "=":
        return SearchQueryUtil.createEqualsFilter(key, value);
      case "!=":
        return SearchQueryUtil.createNotEqualsFilter(key, value);
      case "=~":
        return SearchQueryUtil.createRegexpFilter(key, checkRegexp(key, value));
      default:
        return SearchQueryUtil.createNotRegexpFilter(key, checkRegexp(key, value));
    }
  }

  private static String checkRegexp(String key, String value) {
    try {
      Pattern.compile(value);
    } catch (PatternSyntaxException e) {
      throw new RequestValidationException(
          String.format("invalid regexp for label %s: %s", key, e.getDescription()), e);
    }
    return value;
  }

  private String readOperator() {
    if (selector.startsWith("=~", pos)
        || selector.startsWith("!=", pos)
        || selector.startsWith("!~", pos)) {
      pos += 2;
      return selector.substring(pos - 2, pos);
    }
    if (selector.startsWith("=", pos)) {
      pos++;
      return "=";
    }
    throw error("expecting label matcher operator at position " + pos);
  }

  private String readIdentifier(boolean metricName) {
    int start = pos;
    if (pos >= selector.length()) {
      throw error("expecting identifier at position " + pos);
    }
    char first = selector.charAt(pos);
    if (!(metricName ? isMetricNameStart(first) : isLabelStart(first))) {
      throw error("expecting identifier at position " + pos);
    }
    pos++;
    while (pos < selector.length() && isIdentifierPart(selector.charAt(pos), metricName)) {
      pos++;
    }
    return selector.substring(start, pos);
  }

  private String readQuoted() {
    if (pos >= selector.length()) {
      throw error("missing label value");
    }
    char quote = selector.charAt(pos);
    if (quote != '"' && quote != '\'' && quote != '`') {
      throw error("label value must be quoted at position " + pos);
    }
    pos++;
    StringBuilder value = new StringBuilder();
    while (pos < selector.length()) {
      char c = selector.charAt(pos++);
      if (c == quote) {
        return value.toString();
      }
      if (c == '\\' && quote != '`' && pos < selector.length()) {
        c = unescape(selector.charAt(pos++));
      }
      value.append(c);
    }
    throw error("unterminated label value");
  }

  private static char unescape(char c) {
    switch (c) {
      case 'n':
        return '\n';
      case 't':
        return '\t';
      case 'r':
        return '\r';
      default:
        return c;
    }
  }

  private void skipWhitespace() {
    while (pos < selector.length() && Character.isWhitespace(selector.charAt(pos))) {
      pos++;
    }
  }

  private static boolean isMetricNameStart(char c) {
    return isLabelStart(c) || c == ':';
  }

  private static boolean isLabelStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(char c, boolean metricName) {
    return isLabelStart(c) || (c >= '0' && c <= '9') || c == '.' || (metricName && c == ':');
  }

  private static RequestValidationException error(String message) {
    return new RequestValidationException(message);
  }
}
