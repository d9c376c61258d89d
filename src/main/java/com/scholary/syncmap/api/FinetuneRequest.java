package com.scholary.syncmap.api;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * Request for exporting the fine-tuning HTML page of a sync map file.
 *
 * <p>The {@code output_format}, {@code smil_audio_ref} and {@code smil_page_ref} parameters
 * preconfigure how the page saves the tuned sync map.
 */
public record FinetuneRequest(
    @NotBlank String inputPath,
    @NotBlank String inputFormat,
    @NotBlank String audioPath,
    @NotBlank String outputPath,
    Map<String, String> parameters) {

  // Provide defaults
  public FinetuneRequest {
    if (parameters == null) {
      parameters = Map.of();
    }
  }
}
