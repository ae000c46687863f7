package com.scholary.cog.converter.profile;

import java.util.Map;
import java.util.Objects;

/**
 * A named encoding profile and the COG creation options that go with it.
 *
 * <p>The option map is copied on construction and cannot be modified afterwards.
 */
public record EncodingProfile(String profileId, Map<String, String> options) {

  public EncodingProfile {
    Objects.requireNonNull(profileId, "profileId must not be null");
    options = Map.copyOf(options);
  }

  public String option(String name) {
    return options.get(name);
  }
}
