package com.railmadad.triage.service.extraction;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.dto.complaint.FeatureBundle;

import lombok.RequiredArgsConstructor;

/**
 * Turns a free-form reporter location into the token clusters are keyed on. "Coach B12",
 * "coach_b12" and "COACH-B12" all become {@code coach-b12}; configured aliases are applied last.
 */
@Component
@RequiredArgsConstructor
public class LocationNormalizer {

  private static final Pattern SEPARATORS = Pattern.compile("[\\s_]+");
  private static final Pattern INVALID = Pattern.compile("[^a-z0-9-]");
  private static final Pattern HYPHEN_RUNS = Pattern.compile("-{2,}");

  private final TriageProperties properties;

  public String normalize(String rawLocation) {
    String token = canonical(rawLocation);
    if (token.isEmpty()) {
      return FeatureBundle.UNKNOWN_LOCATION;
    }

    for (Map.Entry<String, String> alias : properties.getLocation().getAliases().entrySet()) {
      if (canonical(alias.getKey()).equals(token)) {
        String target = canonical(alias.getValue());
        return target.isEmpty() ? FeatureBundle.UNKNOWN_LOCATION : target;
      }
    }
    return token;
  }

  private static String canonical(String raw) {
    if (raw == null) {
      return "";
    }
    String token = SEPARATORS.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
    token = INVALID.matcher(token).replaceAll("");
    token = HYPHEN_RUNS.matcher(token).replaceAll("-");
    int start = 0;
    int end = token.length();
    while (start < end && token.charAt(start) == '-') {
      start++;
    }
    while (end > start && token.charAt(end - 1) == '-') {
      end--;
    }
    return token.substring(start, end);
  }
}
