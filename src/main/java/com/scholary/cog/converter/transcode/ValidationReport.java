package com.scholary.cog.converter.transcode;

import java.util.List;

/** Outcome of a structural check of a COG artifact. */
public record ValidationReport(List<String> errors, List<String> warnings) {

  public ValidationReport {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public static ValidationReport valid() {
    return new ValidationReport(List.of(), List.of());
  }

  public boolean isValid() {
    return errors.isEmpty();
  }
}
