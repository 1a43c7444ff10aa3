package com.example.burialviewer;

import static org.assertj.core.api.Assertions.assertThat;

import javafx.geometry.Point2D;
import org.junit.jupiter.api.Test;

class CoordinateMapperTest {

  @Test
  void depthIsFlippedAndDistancePassesThrough() {
    var shown = CoordinateMapper.toDisplay(new Point2D(412.5, 25));

    assertThat(shown.getX()).isEqualTo(412.5);
    assertThat(shown.getY()).isEqualTo(200.0);
  }

  @Test
  void readoutFormatsFlippedPosition() {
    assertThat(CoordinateMapper.readout(new Point2D(1000, 0))).isEqualTo("X: 1000.00, Y: 225.00");
    assertThat(CoordinateMapper.readout(new Point2D(0.125, 225))).isEqualTo("X: 0.13, Y: 0.00");
  }

  @Test
  void noPositionGivesBlankReadout() {
    assertThat(CoordinateMapper.readout(new Point2D(10, 10))).isNotEmpty();
    assertThat(CoordinateMapper.readout(null)).isEmpty();
  }
}
