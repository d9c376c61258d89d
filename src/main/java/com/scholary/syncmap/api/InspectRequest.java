package com.scholary.syncmap.api;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/** Request for reading a sync map file and returning its JSON representation. */
public record InspectRequest(
    @NotBlank String inputPath, @NotBlank String inputFormat, Map<String, String> parameters) {

  // Provide defaults
  public InspectRequest {
    if (parameters == null) {
      parameters = Map.of();
    }
  }
}
