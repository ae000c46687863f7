package com.scholary.cog.converter.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.cog.converter.acquisition.DatasetHandle;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProfileSelectorTest {

  private static final DatasetHandle FLOAT_DEM =
      new DatasetHandle("/data/dem.tif", 1, List.of("float32"));
  private static final DatasetHandle INT_DEM =
      new DatasetHandle("/data/dem_int.tif", 1, List.of("int16"));
  private static final DatasetHandle RGB =
      new DatasetHandle("/data/ortho.tif", 3, List.of("uint8", "uint8", "uint8"));

  private ProfileSelector selector;

  @BeforeEach
  void setUp() {
    selector = new ProfileSelector();
  }

  @Test
  void select_shouldUseFloatingPointPredictorForFloatDem() {
    EncodingProfile profile =
        selector.select(new RasterClassification(true, false, false, false), FLOAT_DEM);

    assertThat(profile.profileId()).isEqualTo(CogProfiles.DEFLATE);
    assertThat(profile.option(CogProfiles.COMPRESS)).isEqualTo("DEFLATE");
    assertThat(profile.option(CogProfiles.PREDICTOR)).isEqualTo("3");
    assertThat(profile.option(CogProfiles.RESAMPLING)).isEqualTo("BILINEAR");
  }

  @Test
  void select_shouldUseHorizontalPredictorForIntegerDem() {
    EncodingProfile profile =
        selector.select(new RasterClassification(true, false, false, false), INT_DEM);

    assertThat(profile.option(CogProfiles.PREDICTOR)).isEqualTo("2");
  }

  @Test
  void select_shouldUseHorizontalPredictorWhenBandsAreMixed() {
    DatasetHandle mixed = new DatasetHandle("/data/mixed.tif", 2, List.of("float32", "uint8"));

    EncodingProfile profile =
        selector.select(new RasterClassification(true, false, false, false), mixed);

    assertThat(profile.option(CogProfiles.PREDICTOR)).isEqualTo("2");
  }

  @Test
  void select_shouldUseCubicResamplingForSmoothDem() {
    EncodingProfile profile =
        selector.select(new RasterClassification(true, false, true, false), FLOAT_DEM);

    assertThat(profile.option(CogProfiles.RESAMPLING)).isEqualTo("CUBIC");
  }

  @Test
  void select_shouldUseJpegWhenCompressing() {
    EncodingProfile profile =
        selector.select(new RasterClassification(false, true, false, false), RGB);

    assertThat(profile.profileId()).isEqualTo(CogProfiles.JPEG);
    assertThat(profile.option(CogProfiles.COMPRESS)).isEqualTo("JPEG");
    assertThat(profile.option(CogProfiles.QUALITY)).isEqualTo("85");
    assertThat(profile.option(CogProfiles.PREDICTOR)).isNull();
  }

  @Test
  void select_shouldKeepDemLosslessWhenCompressIsAlsoSet() {
    EncodingProfile profile =
        selector.select(new RasterClassification(true, true, false, false), FLOAT_DEM);

    assertThat(profile.profileId()).isEqualTo(CogProfiles.DEFLATE);
    assertThat(profile.option(CogProfiles.QUALITY)).isNull();
    assertThat(selector.profileIdFor(new RasterClassification(true, true, false, false)))
        .isEqualTo(CogProfiles.DEFLATE);
  }

  @Test
  void select_shouldReturnBaselineForPlainRaster() {
    EncodingProfile profile = selector.select(RasterClassification.lossless(), RGB);

    assertThat(profile.options()).isEqualTo(CogProfiles.baselineOptions(CogProfiles.DEFLATE));
    assertThat(profile.option(CogProfiles.BLOCKSIZE)).isEqualTo("256");
    assertThat(profile.option(CogProfiles.LEVEL)).isEqualTo("9");
  }

  @Test
  void select_shouldNeverPickWebp() {
    for (boolean dem : new boolean[] {true, false}) {
      for (boolean compress : new boolean[] {true, false}) {
        RasterClassification classification =
            new RasterClassification(dem, compress, false, false);
        assertThat(selector.select(classification, RGB).profileId())
            .isNotEqualTo(CogProfiles.WEBP);
      }
    }
  }

  @Test
  void select_shouldAddWebTilingSchemeWhenWebOptimized() {
    EncodingProfile profile =
        selector.select(new RasterClassification(false, true, false, true), RGB);

    assertThat(profile.option(CogProfiles.TILING_SCHEME)).isEqualTo("GoogleMapsCompatible");
  }

  @Test
  void select_shouldApplyExtraOptionsLast() {
    EncodingProfile profile =
        selector.select(
            new RasterClassification(false, true, false, false),
            RGB,
            Map.of("quality", "60", "OVERVIEWS", "IGNORE_EXISTING"));

    assertThat(profile.option(CogProfiles.QUALITY)).isEqualTo("60");
    assertThat(profile.option("OVERVIEWS")).isEqualTo("IGNORE_EXISTING");
  }

  @Test
  void select_shouldBeDeterministicAndNotShareOptions() {
    RasterClassification classification = new RasterClassification(true, false, true, false);

    EncodingProfile first = selector.select(classification, FLOAT_DEM);
    EncodingProfile second = selector.select(classification, FLOAT_DEM);

    assertThat(first).isEqualTo(second);
    assertThat(first.options()).isNotSameAs(second.options());
    assertThatThrownBy(() -> first.options().put(CogProfiles.LEVEL, "1"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void baselineOptions_shouldRejectUnknownProfile() {
    assertThatThrownBy(() -> CogProfiles.baselineOptions("png"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("png");
  }

  @Test
  void baselineOptions_shouldMapRawToNoCompression() {
    assertThat(CogProfiles.baselineOptions(CogProfiles.RAW).get(CogProfiles.COMPRESS))
        .isEqualTo("NONE");
  }
}
