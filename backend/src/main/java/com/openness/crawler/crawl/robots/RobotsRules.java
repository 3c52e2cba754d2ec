package com.openness.crawler.crawl.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class RobotsRules {
  private final List<Rule> rules;
  private final List<String> sitemapUrls;
  private final Double crawlDelaySeconds;

  public RobotsRules(List<Rule> rules, List<String> sitemapUrls, Double crawlDelaySeconds) {
    this.rules = List.copyOf(rules);
    this.sitemapUrls = List.copyOf(sitemapUrls);
    this.crawlDelaySeconds = crawlDelaySeconds;
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), List.of(), null);
  }

  public List<Rule> getRules() {
    return rules;
  }

  public List<String> getSitemapUrls() {
    return sitemapUrls;
  }

  /**
   * Crawl-delay of the wildcard group, or null when none is declared.
   */
  public Double getCrawlDelaySeconds() {
    return crawlDelaySeconds;
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

  public static RobotsRules parse(String robotsText) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }

    List<String> sitemaps = new ArrayList<>();
    List<Rule> parsedRules = new ArrayList<>();
    Double crawlDelay = null;

    List<String> currentAgents = new ArrayList<>();
    boolean wildcardGroup = false;
    boolean lastDirectiveWasUserAgent = false;

    for (String rawLine : robotsText.split("\\R")) {
      String line = stripComment(rawLine).trim();
      if (line.isEmpty()) {
        currentAgents.clear();
        wildcardGroup = false;
        lastDirectiveWasUserAgent = false;
        continue;
      }
      int colonIdx = line.indexOf(':');
      if (colonIdx <= 0) {
        continue;
      }

      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      if ("user-agent".equals(key)) {
        if (!lastDirectiveWasUserAgent) {
          currentAgents.clear();
        }
        currentAgents.add(value.toLowerCase(Locale.ROOT));
        wildcardGroup = currentAgents.contains("*");
        lastDirectiveWasUserAgent = true;
        continue;
      }

      lastDirectiveWasUserAgent = false;
      if ("sitemap".equals(key)) {
        if (!value.isBlank()) {
          sitemaps.add(value);
        }
        continue;
      }

      if (!wildcardGroup) {
        continue;
      }
      if (("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
        parsedRules.add(new Rule(value, "allow".equals(key)));
      } else if ("crawl-delay".equals(key) && crawlDelay == null) {
        crawlDelay = parseDelay(value);
      }
    }

    return new RobotsRules(parsedRules, sitemaps, crawlDelay);
  }

  private static Double parseDelay(String value) {
    try {
      double seconds = Double.parseDouble(value);
      return seconds >= 0 ? seconds : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String normalizedPath = path.startsWith("/") ? path : "/" + path;
      if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
        return testPath.startsWith(normalizedPath);
      }
      StringBuilder regex = new StringBuilder("^");
      for (int i = 0; i < normalizedPath.length(); i++) {
        char c = normalizedPath.charAt(i);
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$') {
          regex.append("$");
        } else {
          regex.append(Pattern.quote(Character.toString(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }

    public String describe() {
      return (allow ? "Allow: " : "Disallow: ") + path;
    }
  }
}
