package com.example.burialviewer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class ClickCoordinateMapperTest {

  @Test
  void clickAtContainerCentreOfCentredImage() {
    var coords = ClickCoordinateMapper.map(400, 300, 400, 300, 800, 600);

    assertThat(coords.getX()).isCloseTo(5000.0, within(1e-9));
    assertThat(coords.getY()).isCloseTo(112.5, within(1e-9));
  }

  @Test
  void imageCornersMapToDomainBounds() {
    var topLeft = ClickCoordinateMapper.map(200, 150, 400, 300, 800, 600);
    var bottomRight = ClickCoordinateMapper.map(600, 450, 400, 300, 800, 600);

    assertThat(topLeft.getX()).isCloseTo(0.0, within(1e-9));
    assertThat(topLeft.getY()).isCloseTo(0.0, within(1e-9));
    assertThat(bottomRight.getX()).isCloseTo(10000.0, within(1e-9));
    assertThat(bottomRight.getY()).isCloseTo(225.0, within(1e-9));
  }

  @Test
  void clicksOutsideTheImageAreNotClamped() {
    var coords = ClickCoordinateMapper.map(0, 599, 400, 300, 800, 600);

    assertThat(coords.getX()).isCloseTo(-5000.0, within(1e-9));
    assertThat(coords.getY()).isCloseTo(336.75, within(1e-9));
  }

  @Test
  void oddLeftoverSpaceUsesFloorDivision() {
    // (801 - 400) / 2 floors to 200, (-1) / 2 floors to -1
    var coords = ClickCoordinateMapper.map(200, 0, 400, 301, 801, 300);

    assertThat(coords.getX()).isCloseTo(0.0, within(1e-9));
    assertThat(coords.getY()).isCloseTo(1.0 / 301 * 225, within(1e-9));
  }

  @Test
  void readoutUsesTwoDecimals() {
    var coords = ClickCoordinateMapper.map(400, 300, 400, 300, 800, 600);

    assertThat(ClickCoordinateMapper.readout(coords)).isEqualTo("Coordinates: X=5000.00, Y=112.50");
  }
}
