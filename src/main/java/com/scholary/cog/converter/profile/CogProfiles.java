package com.scholary.cog.converter.profile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalogue of the COG encoding profiles and the option names the pipeline understands.
 *
 * <p>Option names follow GDAL's COG driver creation options. Every call to {@link
 * #baselineOptions(String)} returns a new mutable map owned by the caller.
 */
public final class CogProfiles {

  public static final String DEFLATE = "deflate";
  public static final String JPEG = "jpeg";
  public static final String WEBP = "webp";
  public static final String ZSTD = "zstd";
  public static final String LZW = "lzw";
  public static final String PACKBITS = "packbits";
  public static final String RAW = "raw";

  public static final String COMPRESS = "COMPRESS";
  public static final String BLOCKSIZE = "BLOCKSIZE";
  public static final String LEVEL = "LEVEL";
  public static final String QUALITY = "QUALITY";
  public static final String PREDICTOR = "PREDICTOR";
  public static final String RESAMPLING = "RESAMPLING";
  public static final String BIGTIFF = "BIGTIFF";
  public static final String NUM_THREADS = "NUM_THREADS";
  public static final String TILING_SCHEME = "TILING_SCHEME";

  /** Tile edge in pixels used by every profile. */
  public static final int TILE_SIZE = 256;

  private static final Map<String, String> COMPRESSION_BY_PROFILE =
      Map.of(
          DEFLATE, "DEFLATE",
          JPEG, "JPEG",
          WEBP, "WEBP",
          ZSTD, "ZSTD",
          LZW, "LZW",
          PACKBITS, "PACKBITS",
          RAW, "NONE");

  private CogProfiles() {}

  /**
   * Baseline options for a profile: 256x256 tiles, compression level 9, BigTIFF when needed and
   * all CPUs for the encoder, plus the profile's codec.
   *
   * @throws IllegalArgumentException if the profile is unknown
   */
  public static Map<String, String> baselineOptions(String profileId) {
    String compression = COMPRESSION_BY_PROFILE.get(profileId);
    if (compression == null) {
      throw new IllegalArgumentException("Unknown COG profile: " + profileId);
    }
    Map<String, String> options = new LinkedHashMap<>();
    options.put(COMPRESS, compression);
    options.put(BLOCKSIZE, String.valueOf(TILE_SIZE));
    options.put(LEVEL, "9");
    options.put(BIGTIFF, "IF_NEEDED");
    options.put(NUM_THREADS, "ALL_CPUS");
    return options;
  }
}
