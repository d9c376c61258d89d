package com.scholary.syncmap.api;

import com.scholary.syncmap.service.SyncMapService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for sync map files.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Converting a sync map file between formats
 *   <li>Inspecting a sync map file as JSON
 *   <li>Exporting the fine-tuning HTML page
 * </ul>
 *
 * <p>Errors are mapped to HTTP statuses by {@link SyncMapExceptionHandler}.
 */
@RestController
@Tag(name = "Sync maps", description = "Sync map conversion and fine-tuning API")
public class SyncMapController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyncMapController.class);

  private final SyncMapService syncMapService;

  public SyncMapController(SyncMapService syncMapService) {
    this.syncMapService = syncMapService;
  }

  @PostMapping("/api/syncmaps/convert")
  @Operation(
      summary = "Convert sync map",
      description = "Read a sync map file in one format and write it in another")
  public ResponseEntity<SyncMapResponse> convert(@Valid @RequestBody ConvertRequest request)
      throws IOException {
    LOGGER.info(
        "Convert request: {} ({}) -> {} ({})",
        request.inputPath(),
        request.inputFormat(),
        request.outputPath(),
        request.outputFormat());
    return ResponseEntity.ok(syncMapService.convert(request));
  }

  @PostMapping(value = "/api/syncmaps/inspect", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Inspect sync map",
      description = "Read a sync map file and return its JSON representation")
  public ResponseEntity<String> inspect(@Valid @RequestBody InspectRequest request)
      throws IOException {
    LOGGER.info("Inspect request: {} ({})", request.inputPath(), request.inputFormat());
    return ResponseEntity.ok(syncMapService.inspect(request));
  }

  @PostMapping("/api/syncmaps/finetune")
  @Operation(
      summary = "Export fine-tuning page",
      description = "Read a sync map file and write an HTML page for adjusting its timings")
  public ResponseEntity<SyncMapResponse> finetune(@Valid @RequestBody FinetuneRequest request)
      throws IOException {
    LOGGER.info(
        "Finetune request: {} ({}) with audio {} -> {}",
        request.inputPath(),
        request.inputFormat(),
        request.audioPath(),
        request.outputPath());
    return ResponseEntity.ok(syncMapService.finetune(request));
  }
}
