package org.hypertrace.core.query.frontend.matchers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.inject.Singleton;

/**
 * Finds the stream selectors of a log or metric query without evaluating it. Each {@code {...}}
 * selector outside of string literals becomes a {@link MatcherGroup}; the first {@code [range]}
 * that follows it inside the same function call, and an {@code offset} right after that range,
 * are attached to it. Identical groups are reported once, in order of appearance.
 */
@Singleton
public class MatcherGroupExtractor {
  private static final String OFFSET_KEYWORD = "offset";

  public List<MatcherGroup> extract(String query) {
    Set<MatcherGroup> groups = new LinkedHashSet<>();
    int position = 0;
    while (position < query.length()) {
      char current = query.charAt(position);
      if (isQuote(current)) {
        position = skipString(query, position);
      } else if (current == '{') {
        int selectorEnd = findSelectorEnd(query, position);
        String selector = query.substring(position, selectorEnd + 1);
        groups.add(this.attachRange(query, selector, selectorEnd + 1));
        position = selectorEnd + 1;
      } else {
        position++;
      }
    }
    return new ArrayList<>(groups);
  }

  private MatcherGroup attachRange(String query, String selector, int from) {
    int depth = 0;
    int position = from;
    while (position < query.length()) {
      char current = query.charAt(position);
      if (isQuote(current)) {
        position = skipString(query, position);
        continue;
      }
      if (current == '{') {
        break;
      }
      if (current == '(') {
        depth++;
      } else if (current == ')') {
        if (depth == 0) {
          break;
        }
        depth--;
      } else if (current == '[') {
        int rangeEnd = query.indexOf(']', position);
        if (rangeEnd < 0) {
          throw new IllegalArgumentException("Unterminated range in query: " + query);
        }
        // subqueries carry a resolution after the colon, only the range matters
        String range = query.substring(position + 1, rangeEnd).split(":", 2)[0];
        Duration interval = PromDurations.parse(range);
        return new MatcherGroup(selector, interval, parseOffset(query, rangeEnd + 1));
      }
      position++;
    }
    return new MatcherGroup(selector, Duration.ZERO, Duration.ZERO);
  }

  private static Duration parseOffset(String query, int from) {
    int position = skipWhitespace(query, from);
    if (!query.startsWith(OFFSET_KEYWORD, position)) {
      return Duration.ZERO;
    }
    int durationStart = skipWhitespace(query, position + OFFSET_KEYWORD.length());
    int durationEnd = durationStart;
    while (durationEnd < query.length()
        && (Character.isLetterOrDigit(query.charAt(durationEnd))
            || query.charAt(durationEnd) == '-')) {
      durationEnd++;
    }
    return PromDurations.parse(query.substring(durationStart, durationEnd));
  }

  private static int findSelectorEnd(String query, int open) {
    int position = open + 1;
    while (position < query.length()) {
      char current = query.charAt(position);
      if (isQuote(current)) {
        position = skipString(query, position);
      } else if (current == '}') {
        return position;
      } else {
        position++;
      }
    }
    throw new IllegalArgumentException("Unterminated stream selector in query: " + query);
  }

  /** Returns the index just past the string literal opening at {@code open}. */
  private static int skipString(String query, int open) {
    char quote = query.charAt(open);
    int position = open + 1;
    while (position < query.length()) {
      char current = query.charAt(position);
      if (current == '\\' && quote != '`') {
        position += 2;
      } else if (current == quote) {
        return position + 1;
      } else {
        position++;
      }
    }
    throw new IllegalArgumentException("Unterminated string literal in query: " + query);
  }

  private static int skipWhitespace(String query, int from) {
    int position = from;
    while (position < query.length() && Character.isWhitespace(query.charAt(position))) {
      position++;
    }
    return position;
  }

  private static boolean isQuote(char character) {
    return character == '"' || character == '`' || character == '\'';
  }
}
