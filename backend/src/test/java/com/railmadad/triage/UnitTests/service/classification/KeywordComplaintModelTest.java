package com.railmadad.triage.service.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.railmadad.triage.dto.complaint.Category;

@DisplayName("KeywordComplaintModel Tests")
class KeywordComplaintModelTest {

  private final KeywordComplaintModel model = new KeywordComplaintModel();

  @Test
  void shouldFavourMaintenanceForBrokenSeat() {
    // When
    Map<Category, Double> distribution = model.predict("seat broken smells bad");

    // Then
    assertThat(distribution.get(Category.MAINTENANCE)).isCloseTo(2.0 / 3.0, within(1e-9));
    assertThat(distribution.get(Category.CLEANLINESS)).isCloseTo(1.0 / 3.0, within(1e-9));
  }

  @Test
  void shouldWeightSafetyTermsDouble() {
    // When
    Map<Category, Double> distribution = model.predict("fire smell in pantry car");

    // Then
    assertThat(distribution.get(Category.SAFETY)).isCloseTo(2.0 / 3.0, within(1e-9));
    assertThat(distribution.get(Category.CLEANLINESS)).isCloseTo(1.0 / 3.0, within(1e-9));
  }

  @Test
  void shouldReturnOtherWhenNothingMatches() {
    assertThat(model.predict("when does the train reach delhi"))
        .containsExactly(Map.entry(Category.OTHER, 1.0));
  }

  @Test
  void shouldNotMatchTermsInsideLongerWords() {
    // "fan" must not match "fancy", "rat" must not match "rather"
    assertThat(model.predict("rather fancy journey")).containsOnlyKeys(Category.OTHER);
  }

  @Test
  void shouldMatchMultiWordTerms() {
    Map<Category, Double> distribution = model.predict("charging point not working");

    assertThat(distribution).containsOnlyKeys(Category.MAINTENANCE);
    assertThat(distribution.get(Category.MAINTENANCE)).isEqualTo(1.0);
  }

  @Test
  void shouldProduceDistributionSummingToOne() {
    Map<Category, Double> distribution = model.predict("rude staff and dirty toilet near broken door");

    assertThat(distribution.values().stream().mapToDouble(Double::doubleValue).sum())
        .isCloseTo(1.0, within(1e-9));
  }
}
