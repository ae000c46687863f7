package com.scholary.cog.converter.transcode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.cog.converter.acquisition.DatasetHandle;
import com.scholary.cog.converter.profile.CogProfiles;
import com.scholary.cog.converter.profile.EncodingProfile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscodeInvokerTest {

  private static final EngineTuning TUNING =
      new EngineTuning("ALL_CPUS", true, 128, Duration.ofMinutes(1));
  private static final DatasetHandle SOURCE =
      new DatasetHandle("/tmp/in.tif", 3, List.of("uint8", "uint8", "uint8"));
  private static final EncodingProfile PROFILE =
      new EncodingProfile(CogProfiles.JPEG, CogProfiles.baselineOptions(CogProfiles.JPEG));

  @Mock private TranscodeEngine engine;

  @TempDir Path tempDir;

  private TranscodeInvoker invoker;
  private Path destination;

  @BeforeEach
  void setUp() {
    invoker = new TranscodeInvoker(engine, TUNING);
    destination = tempDir.resolve("out.tif");
  }

  @Test
  void transcode_shouldReturnValidatedArtifact() throws Exception {
    when(engine.translate(SOURCE, destination, PROFILE, TUNING))
        .thenAnswer(i -> write(destination));
    when(engine.validate(destination))
        .thenReturn(
            new ValidationReport(
                List.of(), List.of("Raster is 600x600 but has no internal overviews")));

    assertThat(invoker.transcode(SOURCE, destination, PROFILE)).isEqualTo(destination);
    assertThat(destination).exists();
  }

  @Test
  void transcode_shouldDeleteArtifactThatFailsValidation() throws Exception {
    when(engine.translate(SOURCE, destination, PROFILE, TUNING))
        .thenAnswer(i -> write(destination));
    when(engine.validate(destination))
        .thenReturn(new ValidationReport(List.of("IFD layout is not COG"), List.of()));

    assertThatThrownBy(() -> invoker.transcode(SOURCE, destination, PROFILE))
        .isInstanceOf(TranscodeException.class)
        .hasMessageContaining("not a valid COG")
        .hasMessageContaining("IFD layout is not COG");
    assertThat(destination).doesNotExist();
  }

  @Test
  void transcode_shouldDeletePartialOutputWhenEngineFails() throws Exception {
    when(engine.translate(SOURCE, destination, PROFILE, TUNING))
        .thenAnswer(
            i -> {
              write(destination);
              throw new TranscodeException("gdal_translate exited with code 1");
            });

    assertThatThrownBy(() -> invoker.transcode(SOURCE, destination, PROFILE))
        .isInstanceOf(TranscodeException.class)
        .hasMessageContaining("code 1");
    assertThat(destination).doesNotExist();
    verify(engine, never()).validate(any());
  }

  @Test
  void transcode_shouldWrapUnexpectedEngineErrors() {
    when(engine.translate(eq(SOURCE), eq(destination), eq(PROFILE), eq(TUNING)))
        .thenThrow(new IllegalStateException("boom"));

    assertThatThrownBy(() -> invoker.transcode(SOURCE, destination, PROFILE))
        .isInstanceOf(TranscodeException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  private static Path write(Path path) throws Exception {
    Files.write(path, new byte[] {0x49, 0x49, 0x2A, 0x00});
    return path;
  }
}
