package com.example.burialviewer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import org.junit.jupiter.api.Test;

class SearchIndexTest {

  private static DenseSeries series(int fromX, int toX) {
    var steps = new ArrayList<DepthStep>();
    for (int x = fromX; x <= toX; x++) {
      steps.add(new DepthStep(x, 100));
    }
    return new DenseSeries(steps);
  }

  @Test
  void returnsFirstRowWhoseDistanceContainsTheQuery() {
    var match = SearchIndex.find(series(0, 20), "1");

    assertThat(match).hasValue(1);
  }

  @Test
  void matchesInsideTheDistanceText() {
    var match = SearchIndex.find(series(0, 20), "5");

    assertThat(match).hasValue(5);
    assertThat(SearchIndex.find(series(0, 20), "15")).hasValue(15);
  }

  @Test
  void queryIsTrimmed() {
    assertThat(SearchIndex.find(series(0, 20), "  12 ")).hasValue(12);
  }

  @Test
  void indexIsTheRowPositionNotTheDistance() {
    assertThat(SearchIndex.find(series(100, 120), "110")).hasValue(10);
  }

  @Test
  void blankQueryMatchesNothing() {
    assertThat(SearchIndex.find(series(0, 20), "")).isEmpty();
    assertThat(SearchIndex.find(series(0, 20), "   ")).isEmpty();
    assertThat(SearchIndex.find(series(0, 20), null)).isEmpty();
  }

  @Test
  void unknownDistanceMatchesNothing() {
    assertThat(SearchIndex.find(series(0, 20), "99")).isEmpty();
    assertThat(SearchIndex.find(DenseSeries.empty(), "1")).isEmpty();
  }

  @Test
  void negativeDistancesCanBeSearched() {
    assertThat(SearchIndex.find(series(-5, 5), "-3")).hasValue(2);
  }
}
