package com.railmadad.triage.service.extraction;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

/**
 * Lowercases complaint text, strips punctuation that carries no meaning and collapses whitespace.
 * Abbreviations that matter for routing ({@code A/C}, {@code C.C.T.V.}) are folded into a single
 * token first so punctuation stripping cannot split them.
 */
@Component
public class TextNormalizer {

  private static final Map<Pattern, String> DOMAIN_TOKENS = new LinkedHashMap<>();

  static {
    DOMAIN_TOKENS.put(Pattern.compile("\\ba\\s*[./]\\s*c\\b\\.?"), " ac ");
    DOMAIN_TOKENS.put(Pattern.compile("\\bc\\.\\s*c\\.\\s*t\\.\\s*v\\b\\.?"), " cctv ");
    DOMAIN_TOKENS.put(Pattern.compile("\\bwi-fi\\b"), " wifi ");
  }

  private static final Pattern NON_SEMANTIC = Pattern.compile("[^\\p{L}\\p{N}\\s-]");
  private static final Pattern DANGLING_HYPHEN =
      Pattern.compile("(?<![\\p{L}\\p{N}])-+|-+(?![\\p{L}\\p{N}])");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public String normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      return "";
    }

    String text = raw.toLowerCase(Locale.ROOT);
    for (Map.Entry<Pattern, String> token : DOMAIN_TOKENS.entrySet()) {
      text = token.getKey().matcher(text).replaceAll(token.getValue());
    }
    text = NON_SEMANTIC.matcher(text).replaceAll(" ");
    text = DANGLING_HYPHEN.matcher(text).replaceAll(" ");
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  /** Splits already-normalized text into tokens. */
  public List<String> tokens(String normalized) {
    if (normalized == null || normalized.isEmpty()) {
      return List.of();
    }
    return Arrays.stream(normalized.split(" "))
        .filter(token -> !token.isEmpty())
        .collect(Collectors.toList());
  }
}
