package com.scholary.syncmap.api;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * Request for converting a sync map file from one format to another.
 *
 * <p>Paths are resolved on the server's file system. Parameters are passed to both codecs.
 */
public record ConvertRequest(
    @NotBlank String inputPath,
    @NotBlank String inputFormat,
    @NotBlank String outputPath,
    @NotBlank String outputFormat,
    Map<String, String> parameters) {

  // Provide defaults
  public ConvertRequest {
    if (parameters == null) {
      parameters = Map.of();
    }
  }
}
