package com.example.burialviewer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ThumbnailTest {

  @Test
  void smallImageKeepsItsNaturalSize() {
    var thumb = Thumbnail.fit(400, 300, 800, 600);

    assertThat(thumb.getWidth()).isEqualTo(400);
    assertThat(thumb.getHeight()).isEqualTo(300);
  }

  @Test
  void wideImageIsLimitedByWidth() {
    var thumb = Thumbnail.fit(2000, 500, 800, 600);

    assertThat(thumb.getWidth()).isEqualTo(800);
    assertThat(thumb.getHeight()).isEqualTo(200);
  }

  @Test
  void tallImageIsLimitedByHeight() {
    var thumb = Thumbnail.fit(1000, 3000, 800, 600);

    assertThat(thumb.getWidth()).isEqualTo(200);
    assertThat(thumb.getHeight()).isEqualTo(600);
  }

  @Test
  void extremeAspectRatioKeepsAtLeastOnePixel() {
    var thumb = Thumbnail.fit(10000, 2, 100, 100);

    assertThat(thumb.getWidth()).isEqualTo(100);
    assertThat(thumb.getHeight()).isEqualTo(1);
  }
}
