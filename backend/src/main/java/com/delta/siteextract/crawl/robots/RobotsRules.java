package com.delta.siteextract.crawl.robots;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class RobotsRules {
  private final List<Rule> rules;
  private final Duration crawlDelay;

  public RobotsRules(List<Rule> rules, Duration crawlDelay) {
    this.rules = List.copyOf(rules);
    this.crawlDelay = crawlDelay;
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), null);
  }

  public static RobotsRules disallowAll() {
    return new RobotsRules(List.of(new Rule("/", false)), null);
  }

  /** Crawl-delay declared for the matched group, or {@code null} when absent. */
  public Duration getCrawlDelay() {
    return crawlDelay;
  }

  public List<Rule> getRules() {
    return rules;
  }

  public boolean isAllowed(String pathAndQuery) {
    if (rules.isEmpty()) {
      return true;
    }

    Rule bestMatch = null;
    int bestMatchLength = -1;
    String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
    for (Rule rule : rules) {
      if (!rule.matches(subject)) {
        continue;
      }
      int length = rule.path().length();
      if (length > bestMatchLength) {
        bestMatch = rule;
        bestMatchLength = length;
      } else if (length == bestMatchLength
          && bestMatch != null
          && rule.allow()
          && !bestMatch.allow()) {
        bestMatch = rule;
      }
    }
    return bestMatch == null || bestMatch.allow();
  }

  /**
   * Parses robots.txt and keeps the group that names our user agent most specifically, falling
   * back to the {@code *} group. Groups naming the same agent are merged.
   */
  public static RobotsRules parse(String robotsText, String userAgent) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }
    String agent = userAgent == null ? "" : userAgent.toLowerCase(Locale.ROOT);

    List<Group> groups = new ArrayList<>();
    Group current = null;
    boolean lastDirectiveWasUserAgent = false;

    for (String rawLine : robotsText.split("\\R")) {
      String line = stripComment(rawLine).trim();
      if (line.isEmpty()) {
        continue;
      }
      int colonIdx = line.indexOf(':');
      if (colonIdx <= 0) {
        continue;
      }
      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      if ("user-agent".equals(key)) {
        if (current == null || !lastDirectiveWasUserAgent) {
          current = new Group();
          groups.add(current);
        }
        current.agents.add(value.toLowerCase(Locale.ROOT));
        lastDirectiveWasUserAgent = true;
        continue;
      }
      lastDirectiveWasUserAgent = false;
      if (current == null) {
        continue;
      }
      if ("allow".equals(key) || "disallow".equals(key)) {
        // An empty Disallow means "allow everything" and adds no rule.
        if (!value.isBlank()) {
          current.rules.add(new Rule(value, "allow".equals(key)));
        }
      } else if ("crawl-delay".equals(key)) {
        current.crawlDelay = parseDelay(value);
      }
    }

    int bestSpecificity = -1;
    List<Group> selected = new ArrayList<>();
    for (Group group : groups) {
      int specificity = group.specificityFor(agent);
      if (specificity < 0) {
        continue;
      }
      if (specificity > bestSpecificity) {
        bestSpecificity = specificity;
        selected.clear();
        selected.add(group);
      } else if (specificity == bestSpecificity) {
        selected.add(group);
      }
    }
    if (selected.isEmpty()) {
      return allowAll();
    }
    List<Rule> merged = new ArrayList<>();
    Duration delay = null;
    for (Group group : selected) {
      merged.addAll(group.rules);
      if (group.crawlDelay != null && (delay == null || group.crawlDelay.compareTo(delay) > 0)) {
        delay = group.crawlDelay;
      }
    }
    return new RobotsRules(merged, delay);
  }

  private static Duration parseDelay(String value) {
    try {
      double seconds = Double.parseDouble(value);
      if (seconds <= 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
        return null;
      }
      return Duration.ofMillis(Math.round(seconds * 1000));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  private static final class Group {
    private final List<String> agents = new ArrayList<>();
    private final List<Rule> rules = new ArrayList<>();
    private Duration crawlDelay;

    // -1 when the group does not apply, 0 for "*", token length for a named match.
    private int specificityFor(String userAgent) {
      int best = -1;
      for (String token : agents) {
        if ("*".equals(token)) {
          best = Math.max(best, 0);
        } else if (!token.isBlank() && userAgent.contains(token)) {
          best = Math.max(best, token.length());
        }
      }
      return best;
    }
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String normalizedPath = path.startsWith("/") || path.startsWith("*") ? path : "/" + path;
      if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
        return testPath.startsWith(normalizedPath);
      }
      StringBuilder regex = new StringBuilder("^");
      for (int i = 0; i < normalizedPath.length(); i++) {
        char c = normalizedPath.charAt(i);
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$' && i == normalizedPath.length() - 1) {
          regex.append("$");
        } else {
          regex.append(Pattern.quote(Character.toString(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
