package com.example.burialviewer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class InputNormalizerTest {

  @Test
  void equalDistancesKeepTheirOriginalOrder() {
    var input = List.of(
        new MeasurementPoint(5, 1),
        new MeasurementPoint(2, 2),
        new MeasurementPoint(5, 3));

    assertThat(InputNormalizer.sortByDistance(input)).containsExactly(
        new MeasurementPoint(2, 2),
        new MeasurementPoint(5, 1),
        new MeasurementPoint(5, 3));
  }

  @Test
  void fractionalAndNegativeDistancesSortNumerically() {
    var input = List.of(
        new MeasurementPoint(10.5, 1),
        new MeasurementPoint(-3, 2),
        new MeasurementPoint(2.25, 3));

    assertThat(InputNormalizer.sortByDistance(input))
        .extracting(MeasurementPoint::getX)
        .containsExactly(-3.0, 2.25, 10.5);
  }

  @Test
  void inputListIsLeftUntouched() {
    var input = new ArrayList<>(List.of(new MeasurementPoint(9, 1), new MeasurementPoint(1, 2)));

    InputNormalizer.sortByDistance(input);

    assertThat(input).extracting(MeasurementPoint::getX).containsExactly(9.0, 1.0);
  }

  @Test
  void emptyInputGivesEmptyOutput() {
    assertThat(InputNormalizer.sortByDistance(List.of())).isEmpty();
  }
}
