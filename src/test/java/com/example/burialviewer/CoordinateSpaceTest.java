package com.example.burialviewer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class CoordinateSpaceTest {

  private static CoordinateSpace plot(boolean flipY) {
    return new CoordinateSpace(0, 1000, 0, 225, 50, 550, 20, 245, flipY);
  }

  @Test
  void imageExtentHasDepthZeroAtTheTop() {
    var space = plot(false);

    var top = space.toDomain(50, 20);
    var bottom = space.toDomain(550, 245);

    assertThat(top.getX()).isCloseTo(0.0, within(1e-9));
    assertThat(top.getY()).isCloseTo(0.0, within(1e-9));
    assertThat(bottom.getX()).isCloseTo(1000.0, within(1e-9));
    assertThat(bottom.getY()).isCloseTo(225.0, within(1e-9));
  }

  @Test
  void flippedSpaceHasDepthZeroAtTheBottom() {
    var space = plot(true);

    assertThat(space.toDomain(300, 245).getY()).isCloseTo(0.0, within(1e-9));
    assertThat(space.toDomain(300, 20).getY()).isCloseTo(225.0, within(1e-9));
    assertThat(space.toDomain(300, 20).getX()).isCloseTo(500.0, within(1e-9));
  }

  @Test
  void pixelsOutsideThePlotHaveNoPosition() {
    var space = plot(false);

    assertThat(space.toDomain(49.9, 100)).isNull();
    assertThat(space.toDomain(100, 245.1)).isNull();
    assertThat(space.containsPixel(300, 100)).isTrue();
  }

  @Test
  void toPixelInvertsToDomain() {
    for (boolean flip : new boolean[] {false, true}) {
      var space = plot(flip);
      var domain = space.toDomain(123, 77);
      var pixel = space.toPixel(domain.getX(), domain.getY());

      assertThat(pixel.getX()).isCloseTo(123.0, within(1e-9));
      assertThat(pixel.getY()).isCloseTo(77.0, within(1e-9));
    }
  }

  @Test
  void degeneratePixelRangeHasNoPosition() {
    var space = new CoordinateSpace(0, 1000, 0, 225, 10, 10, 0, 100, false);

    assertThat(space.toDomain(10, 50)).isNull();
  }
}
