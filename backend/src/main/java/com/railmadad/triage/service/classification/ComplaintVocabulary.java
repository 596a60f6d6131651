package com.railmadad.triage.service.classification;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import com.railmadad.triage.dto.complaint.Category;

/**
 * Keyword lists shared by the keyword model, the urgency scorer and the sentiment analyzer. Terms
 * are matched against normalized text on word boundaries; multi-word terms are allowed.
 */
public final class ComplaintVocabulary {

  public static final Set<String> SAFETY_TERMS =
      Set.of(
          "fire", "smoke", "smoking", "spark", "sparks", "short circuit", "accident", "derailment",
          "hazard", "danger", "dangerous", "unsafe", "emergency", "theft", "stolen", "robbery",
          "harassment", "harassed", "fight", "assault", "medical", "injury", "injured",
          "unconscious", "gas leak", "explosion", "weapon", "security");

  public static final Set<String> URGENT_TERMS =
      Set.of("urgent", "urgently", "emergency", "critical", "immediate", "immediately", "asap",
          "help");

  public static final Set<String> NEGATIVE_TERMS =
      Set.of("bad", "poor", "terrible", "awful", "horrible", "broken", "dirty", "not working",
          "rude", "filthy", "worst", "pathetic");

  public static final Set<String> POSITIVE_TERMS =
      Set.of("good", "great", "excellent", "clean", "working", "nice", "thank", "thanks",
          "helpful");

  public static final Set<String> STOP_WORDS =
      Set.of("a", "an", "the", "is", "are", "was", "were", "be", "been", "in", "on", "at", "of",
          "to", "for", "and", "or", "but", "it", "this", "that", "with", "my", "our", "i", "we",
          "there", "very", "please", "from", "by", "has", "have", "had", "no", "so", "its");

  private static final Map<Category, Set<String>> CATEGORY_TERMS;

  static {
    Map<Category, Set<String>> terms = new EnumMap<>(Category.class);
    terms.put(
        Category.CLEANLINESS,
        Set.of("dirty", "unclean", "trash", "garbage", "filthy", "messy", "smell", "smells",
            "smelly", "stink", "stinks", "stinking", "toilet", "toilets", "washroom", "bathroom",
            "cockroach", "cockroaches", "rat", "rats", "dust", "dusty", "unhygienic", "litter",
            "stain", "stained", "cleaning", "sweeping"));
    terms.put(
        Category.MAINTENANCE,
        Set.of("broken", "damaged", "damage", "cracked", "torn", "ripped", "not working", "ac",
            "fan", "fans", "light", "lights", "bulb", "charging", "socket", "plug", "leak",
            "leaking", "repair", "seat", "seats", "berth", "door", "window", "tap", "flush",
            "power", "jammed", "stuck", "cctv", "wifi"));
    terms.put(Category.SAFETY, SAFETY_TERMS);
    terms.put(
        Category.STAFF,
        Set.of("rude", "unhelpful", "impolite", "arrogant", "staff", "behavior", "behaviour",
            "attitude", "ignored", "ignoring", "tte", "attendant", "bribe", "misbehave",
            "misbehaved", "abusive", "overcharged", "overcharging"));
    CATEGORY_TERMS = Collections.unmodifiableMap(terms);
  }

  private ComplaintVocabulary() {}

  /** Keyword lists per category; {@link Category#OTHER} has none. */
  public static Map<Category, Set<String>> categoryTerms() {
    return CATEGORY_TERMS;
  }

  /** Pads normalized text with spaces so terms can be matched on word boundaries. */
  public static String pad(String normalizedText) {
    return " " + (normalizedText == null ? "" : normalizedText) + " ";
  }

  public static boolean contains(String paddedText, String term) {
    return paddedText.contains(" " + term + " ");
  }

  public static boolean containsAny(String paddedText, Collection<String> terms) {
    return terms.stream().anyMatch(term -> contains(paddedText, term));
  }

  public static long countMatches(String paddedText, Collection<String> terms) {
    return terms.stream().filter(term -> contains(paddedText, term)).count();
  }
}
