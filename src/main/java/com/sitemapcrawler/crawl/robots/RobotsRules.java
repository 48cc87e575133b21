package com.sitemapcrawler.crawl.robots;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parsed robots.txt. Rules are kept per user-agent group; a lookup uses the first group whose
 * agent token appears in the requesting user-agent and falls back to the {@code *} group.
 */
public class RobotsRules {
  private final Map<String, List<Rule>> rulesByAgent;

  public RobotsRules(Map<String, List<Rule>> rulesByAgent) {
    this.rulesByAgent = rulesByAgent;
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(Map.of());
  }

  public boolean isAllowed(String userAgent, String pathAndQuery) {
    List<Rule> rules = rulesFor(userAgent);
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

  private List<Rule> rulesFor(String userAgent) {
    String token = userAgent == null ? "*" : userAgent.split("/")[0].trim().toLowerCase(Locale.ROOT);
    for (Map.Entry<String, List<Rule>> entry : rulesByAgent.entrySet()) {
      String agent = entry.getKey();
      if (!"*".equals(agent) && !token.isEmpty() && token.contains(agent)) {
        return entry.getValue();
      }
    }
    return rulesByAgent.getOrDefault("*", List.of());
  }

  public static RobotsRules parse(String robotsText) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }

    Map<String, List<Rule>> parsedRules = new LinkedHashMap<>();

    List<String> currentAgents = new ArrayList<>();
    boolean lastDirectiveWasUserAgent = false;

    String[] lines = robotsText.split("\\R");
    for (String rawLine : lines) {
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
        if (!lastDirectiveWasUserAgent) {
          currentAgents.clear();
        }
        String agent = value.toLowerCase(Locale.ROOT);
        currentAgents.add(agent);
        parsedRules.computeIfAbsent(agent, ignored -> new ArrayList<>());
        lastDirectiveWasUserAgent = true;
        continue;
      }

      lastDirectiveWasUserAgent = false;
      if (("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
        Rule rule = new Rule(value, "allow".equals(key));
        for (String agent : currentAgents) {
          parsedRules.get(agent).add(rule);
        }
      }
    }

    return new RobotsRules(parsedRules);
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
  }
}
