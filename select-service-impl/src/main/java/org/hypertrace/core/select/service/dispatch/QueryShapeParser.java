package org.hypertrace.core.select.service.dispatch;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the rollup sugar at the end of a query: a top level bracket group, optionally followed by
 * an {@code offset} modifier, e.g. {@code rate(foo[1m])[1h:5m] offset 1d}. Brackets nested in
 * parentheses or braces and characters inside quotes are ignored.
 */
public class QueryShapeParser {
  private static final Pattern OFFSET_SUFFIX = Pattern.compile("\\s*offset\\s+(-?\\S+)\\s*");

  private QueryShapeParser() {}

  public static Optional<RollupSugar> parse(String query) {
    int depth = 0;
    int groupStart = -1;
    int groupEnd = -1;
    char quote = 0;
    for (int i = 0; i < query.length(); i++) {
      char c = query.charAt(i);
      if (quote != 0) {
        if (c == '\\' && quote != '`') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      switch (c) {
        case '"':
        case '\'':
        case '`':
          quote = c;
          break;
        case '(':
        case '{':
          depth++;
          break;
        case ')':
        case '}':
          depth--;
          break;
        case '[':
          if (depth == 0) {
            groupStart = i;
            groupEnd = -1;
          }
          depth++;
          break;
        case ']':
          depth--;
          if (depth == 0 && groupStart >= 0) {
            groupEnd = i;
          }
          break;
        default:
      }
    }
    if (groupStart < 0 || groupEnd < 0) {
      return Optional.empty();
    }
    String offset = "";
    String suffix = query.substring(groupEnd + 1);
    if (!suffix.isBlank()) {
      Matcher matcher = OFFSET_SUFFIX.matcher(suffix);
      if (!matcher.matches()) {
        return Optional.empty();
      }
      offset = matcher.group(1);
    }
    String childQuery = query.substring(0, groupStart).trim();
    if (childQuery.isEmpty()) {
      return Optional.empty();
    }
    String group = query.substring(groupStart + 1, groupEnd);
    int colon = group.indexOf(':');
    if (colon < 0) {
      return Optional.of(new RollupSugar(childQuery, group.trim(), null, offset));
    }
    return Optional.of(
        new RollupSugar(
            childQuery,
            group.substring(0, colon).trim(),
            group.substring(colon + 1).trim(),
            offset));
  }

  /**
   * True when the query is a single function call such as {@code rate(foo[1m])}, so a trailing
   * bracket group applies to the whole of it.
   */
  public static boolean isFunctionCall(String query) {
    int open = query.indexOf('(');
    if (open <= 0 || !query.endsWith(")")) {
      return false;
    }
    for (int i = 0; i < open; i++) {
      char c = query.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_')) {
        return false;
      }
    }
    int depth = 0;
    char quote = 0;
    for (int i = open; i < query.length(); i++) {
      char c = query.charAt(i);
      if (quote != 0) {
        if (c == '\\' && quote != '`') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (c == '"' || c == '\'' || c == '`') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i == query.length() - 1;
        }
      }
    }
    return false;
  }
}
