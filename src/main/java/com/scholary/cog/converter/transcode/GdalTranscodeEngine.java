package com.scholary.cog.converter.transcode;

import com.scholary.cog.converter.acquisition.DatasetHandle;
import com.scholary.cog.converter.profile.CogProfiles;
import com.scholary.cog.converter.profile.EncodingProfile;
import com.scholary.cog.converter.transcode.GdalProcessRunner.ProcessResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Produces COGs with {@code gdal_translate -of COG}.
 *
 * <p>See https://gdal.org/drivers/raster/cog.html for the creation options. Profile options are
 * passed as {@code -co NAME=VALUE}; engine tuning goes through {@code --config} so it does not
 * influence the encoded bytes.
 *
 * <p>The COG driver spells predictors by name, so the TIFF tag values 2 and 3 are translated to
 * STANDARD and FLOATING_POINT.
 */
@Component
public class GdalTranscodeEngine implements TranscodeEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(GdalTranscodeEngine.class);

  private static final Map<String, String> COG_PREDICTORS =
      Map.of("1", "NO", "2", "STANDARD", "3", "FLOATING_POINT");

  private final GdalProcessRunner processRunner;
  private final GdalDatasetInspector inspector;
  private final TranscodeProperties properties;

  public GdalTranscodeEngine(
      GdalProcessRunner processRunner,
      GdalDatasetInspector inspector,
      TranscodeProperties properties) {
    this.processRunner = processRunner;
    this.inspector = inspector;
    this.properties = properties;
  }

  @Override
  public Path translate(
      DatasetHandle source, Path destination, EncodingProfile profile, EngineTuning tuning) {
    List<String> command = buildCommand(source, destination, profile, tuning);
    LOGGER.info(
        "Creating COG: src={}, dst={}, profile={}",
        GdalDatasetInspector.redact(source.location()),
        destination,
        profile.profileId());

    ProcessResult result;
    try {
      result = processRunner.run(command, tuning.timeout());
    } catch (IOException e) {
      throw new TranscodeException("gdal_translate failed to run for " + destination, e);
    }
    if (!result.succeeded()) {
      throw new TranscodeException(
          String.format(
              "gdal_translate exited with code %d: %s", result.exitCode(), result.stderr().trim()));
    }
    if (!Files.isRegularFile(destination)) {
      throw new TranscodeException(
          "gdal_translate reported success but wrote no file: " + destination);
    }
    return destination;
  }

  @Override
  public ValidationReport validate(Path artifact) {
    return CogStructureValidator.validate(inspector.describe(artifact.toString()));
  }

  List<String> buildCommand(
      DatasetHandle source, Path destination, EncodingProfile profile, EngineTuning tuning) {
    List<String> command = new ArrayList<>();
    command.add(properties.gdalTranslatePath());
    command.add("-of");
    command.add("COG");

    // Sorted so the same profile always yields the same command line
    for (Map.Entry<String, String> option : new TreeMap<>(profile.options()).entrySet()) {
      command.add("-co");
      command.add(option.getKey() + "=" + creationOptionValue(option.getKey(), option.getValue()));
    }

    addConfig(command, "GDAL_NUM_THREADS", tuning.numThreads());
    addConfig(command, "GDAL_TIFF_INTERNAL_MASK", tuning.internalMask() ? "YES" : "NO");
    addConfig(command, "GDAL_TIFF_OVR_BLOCKSIZE", String.valueOf(tuning.overviewBlockSize()));
    addConfig(command, "GDAL_DISABLE_READDIR_ON_OPEN", "EMPTY_DIR");

    command.add(source.location());
    command.add(destination.toString());
    return command;
  }

  private static String creationOptionValue(String name, String value) {
    if (CogProfiles.PREDICTOR.equals(name)) {
      return COG_PREDICTORS.getOrDefault(value, value);
    }
    return value;
  }

  private static void addConfig(List<String> command, String key, String value) {
    command.add("--config");
    command.add(key);
    command.add(value);
  }
}
