package com.railmadad.triage.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.dto.complaint.Department;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Component
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

  /** Overall latency budget for one triage when the caller does not pass one. */
  private Duration defaultBudget = Duration.ofSeconds(2);

  private Classification classification = new Classification();
  private Urgency urgency = new Urgency();
  private Ocr ocr = new Ocr();
  private Location location = new Location();
  private Clustering clustering = new Clustering();
  private Routing routing = new Routing();
  private Analytics analytics = new Analytics();

  @Data
  public static class Classification {
    /** Category model: {@code keyword} or {@code llm}. */
    private String model = "keyword";

    private double confidenceThreshold = 0.4;
    private Duration timeout = Duration.ofMillis(800);

    /** Urgency assigned when a complaint carries no text at all. */
    private double defaultUrgency = 0.5;

    private double fallbackUrgency = 0.5;
    private boolean fallbackEnabled = true;
  }

  @Data
  public static class Urgency {
    private double safetyWeight = 0.6;
    private double urgentWordWeight = 0.2;
    private double mediaWeight = 0.1;
    private double recencyWeight = 0.3;
    private Duration recencyWindow = Duration.ofHours(24);
  }

  @Data
  public static class Ocr {
    /** OCR collaborator: {@code none} or {@code textract}. */
    private String provider = "none";

    /** Capped further by what the triage budget leaves after the classifier's slice. */
    private Duration timeout = Duration.ofMillis(500);

    private String region = "us-east-1";
  }

  @Data
  public static class Location {
    /** Normalized alias to canonical token, e.g. {@code pantry=pantry-car}. */
    private Map<String, String> aliases = new HashMap<>();
  }

  @Data
  public static class Clustering {
    private int vectorDimension = 256;
    private double matchThreshold = 0.35;
    private double unknownLocationThreshold = 0.15;
    private double centroidAlpha = 0.3;
    private Duration inactivityWindow = Duration.ofHours(72);
    private Duration lockTimeout = Duration.ofMillis(200);
    private Duration sweepInterval = Duration.ofMinutes(5);
    private Duration sweepTimeout = Duration.ofSeconds(5);
  }

  @Data
  public static class Routing {
    private Map<Category, Department> departments = defaultDepartments();
    private Map<Category, Duration> baseWindows = defaultBaseWindows();

    /** Urgency tiers; the highest tier whose threshold the urgency reaches applies. */
    private List<UrgencyTier> urgencyTiers = defaultTiers();

    private int repetitionThreshold = 2;

    private static Map<Category, Department> defaultDepartments() {
      Map<Category, Department> map = new EnumMap<>(Category.class);
      map.put(Category.CLEANLINESS, Department.HOUSEKEEPING);
      map.put(Category.MAINTENANCE, Department.MAINTENANCE);
      map.put(Category.SAFETY, Department.SAFETY);
      map.put(Category.STAFF, Department.SERVICE_QUALITY);
      map.put(Category.OTHER, Department.GENERAL_ADMINISTRATION);
      return map;
    }

    private static Map<Category, Duration> defaultBaseWindows() {
      Map<Category, Duration> map = new EnumMap<>(Category.class);
      map.put(Category.CLEANLINESS, Duration.ofHours(6));
      map.put(Category.MAINTENANCE, Duration.ofHours(12));
      map.put(Category.SAFETY, Duration.ofHours(1));
      map.put(Category.STAFF, Duration.ofHours(24));
      map.put(Category.OTHER, Duration.ofHours(48));
      return map;
    }

    private static List<UrgencyTier> defaultTiers() {
      List<UrgencyTier> tiers = new ArrayList<>();
      tiers.add(new UrgencyTier("LOW", 0.0, 1.0));
      tiers.add(new UrgencyTier("MEDIUM", 0.5, 2.0));
      tiers.add(new UrgencyTier("HIGH", 0.8, 4.0));
      return tiers;
    }
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class UrgencyTier {
    private String label;
    private double threshold;
    private double multiplier;
  }

  @Data
  public static class Analytics {
    private int maxDecisions = 10_000;
  }
}
