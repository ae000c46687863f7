package com.scholary.cog.converter.transcode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.cog.converter.acquisition.DatasetHandle;
import com.scholary.cog.converter.acquisition.DatasetOpener;
import com.scholary.cog.converter.acquisition.InvalidSourceException;
import com.scholary.cog.converter.objectstore.ObjectAccessDeniedException;
import com.scholary.cog.converter.transcode.GdalProcessRunner.ProcessResult;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Opens rasters with {@code gdalinfo -json}.
 *
 * <p>Band types are reported with GDAL's names ({@code Byte}, {@code Float32}, ...) and mapped to
 * lower-case numpy-style tags so the rest of the pipeline is independent of GDAL's vocabulary.
 */
@Component
public class GdalDatasetInspector implements DatasetOpener {

  private static final Logger LOGGER = LoggerFactory.getLogger(GdalDatasetInspector.class);

  // GDAL prints e.g. "HTTP response code: 403" when a /vsicurl/ read is refused
  private static final Pattern ACCESS_DENIED_PATTERN =
      Pattern.compile("HTTP response code:\\s*403|Access Denied|AccessDenied");

  private static final Map<String, String> DTYPE_BY_GDAL_TYPE =
      Map.ofEntries(
          Map.entry("Byte", "uint8"),
          Map.entry("Int8", "int8"),
          Map.entry("UInt16", "uint16"),
          Map.entry("Int16", "int16"),
          Map.entry("UInt32", "uint32"),
          Map.entry("Int32", "int32"),
          Map.entry("UInt64", "uint64"),
          Map.entry("Int64", "int64"),
          Map.entry("Float16", "float16"),
          Map.entry("Float32", "float32"),
          Map.entry("Float64", "float64"),
          Map.entry("CInt16", "complex_int16"),
          Map.entry("CInt32", "complex_int32"),
          Map.entry("CFloat32", "complex64"),
          Map.entry("CFloat64", "complex128"));

  private final GdalProcessRunner processRunner;
  private final TranscodeProperties properties;
  private final ObjectMapper objectMapper;

  public GdalDatasetInspector(
      GdalProcessRunner processRunner, TranscodeProperties properties, ObjectMapper objectMapper) {
    this.processRunner = processRunner;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public DatasetHandle open(String location) {
    JsonNode info = describe(location);
    List<String> dtypes = new ArrayList<>();
    for (JsonNode band : info.path("bands")) {
      dtypes.add(toDtype(band.path("type").asText()));
    }
    LOGGER.info(
        "Opened dataset: location={}, bands={}, dtypes={}",
        redact(location),
        dtypes.size(),
        dtypes);
    return new DatasetHandle(location, dtypes.size(), dtypes);
  }

  /**
   * The full {@code gdalinfo -json} description of a raster.
   *
   * @throws ObjectAccessDeniedException if a remote read was refused with 403
   * @throws InvalidSourceException if GDAL cannot open the location
   * @throws TranscodeException if gdalinfo cannot be run
   */
  public JsonNode describe(String location) {
    List<String> command =
        List.of(
            properties.gdalInfoPath(),
            "-json",
            "--config",
            "GDAL_DISABLE_READDIR_ON_OPEN",
            "EMPTY_DIR",
            location);

    ProcessResult result;
    try {
      result = processRunner.run(command, properties.tuning().timeout());
    } catch (IOException e) {
      throw new TranscodeException("Failed to run gdalinfo on " + redact(location), e);
    }

    if (!result.succeeded()) {
      if (ACCESS_DENIED_PATTERN.matcher(result.stderr()).find()) {
        throw new ObjectAccessDeniedException("Remote read refused for " + redact(location));
      }
      throw new InvalidSourceException(
          String.format("Unreadable raster %s: %s", redact(location), result.stderr().trim()));
    }

    try {
      return objectMapper.readTree(result.stdout());
    } catch (JsonProcessingException e) {
      throw new TranscodeException("Unparseable gdalinfo output for " + redact(location), e);
    }
  }

  static String toDtype(String gdalType) {
    String dtype = DTYPE_BY_GDAL_TYPE.get(gdalType);
    return dtype != null ? dtype : gdalType.toLowerCase(Locale.ROOT);
  }

  /** Presigned URLs carry credentials in their query string; keep them out of logs. */
  static String redact(String location) {
    int query = location.indexOf('?');
    return query < 0 ? location : location.substring(0, query) + "?<redacted>";
  }
}
