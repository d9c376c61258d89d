package com.scholary.syncmap.service;

import com.scholary.syncmap.api.ConvertRequest;
import com.scholary.syncmap.api.FinetuneRequest;
import com.scholary.syncmap.api.InspectRequest;
import com.scholary.syncmap.api.SyncMapResponse;
import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.format.SyncMapFormat;
import com.scholary.syncmap.format.SyncMapFormatRegistry;
import com.scholary.syncmap.logging.StructuredLogger;
import com.scholary.syncmap.syncmap.SyncMap;
import com.scholary.syncmap.syncmap.SyncMapParameters;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads, converts and exports sync map files.
 *
 * <p>Every call works on a fresh {@link SyncMap} built with the configured properties and format
 * registry, so calls never share state.
 */
@Service
public class SyncMapService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyncMapService.class);

  private final SyncMapProperties properties;
  private final SyncMapFormatRegistry registry;
  private final StructuredLogger structuredLogger;

  public SyncMapService(SyncMapProperties properties, SyncMapFormatRegistry registry) {
    this.properties = properties;
    this.registry = registry;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /** Create an empty sync map with the configured properties and registry. */
  public SyncMap newSyncMap() {
    return new SyncMap(properties, registry);
  }

  /**
   * Read a sync map file.
   *
   * @param inputFormat the format code of the file
   * @param inputPath the file to read
   * @param parameters additional parameters, may be empty
   * @return the populated sync map
   */
  public SyncMap read(String inputFormat, Path inputPath, Map<String, String> parameters)
      throws IOException {
    SyncMapFormat format = SyncMapFormat.fromCode(inputFormat);
    long startTime = System.currentTimeMillis();
    SyncMap syncMap = newSyncMap();
    syncMap.read(format, inputPath, parameters);
    structuredLogger.logSyncMapRead(
        format.code(),
        inputPath.toString(),
        syncMap.size(),
        syncMap.isSingleLevel(),
        System.currentTimeMillis() - startTime);
    return syncMap;
  }

  /**
   * Convert a sync map file to another format.
   *
   * @param request the conversion request
   * @return where the output was written and what it contains
   */
  public SyncMapResponse convert(ConvertRequest request) throws IOException {
    StructuredLogger.setOperationContext("convert", request.outputFormat());
    try {
      SyncMap syncMap =
          read(request.inputFormat(), Path.of(request.inputPath()), request.parameters());

      SyncMapFormat outputFormat = SyncMapFormat.fromCode(request.outputFormat());
      Path outputPath = Path.of(request.outputPath());
      long startTime = System.currentTimeMillis();
      syncMap.write(outputFormat, outputPath, request.parameters());
      structuredLogger.logSyncMapWritten(
          outputFormat.code(),
          outputPath.toString(),
          syncMap.size(),
          System.currentTimeMillis() - startTime);

      return new SyncMapResponse(request.outputPath(), syncMap.size(), syncMap.isSingleLevel());
    } catch (IOException | RuntimeException e) {
      structuredLogger.logOperationFailed("convert", e.getClass().getSimpleName(), e.getMessage());
      throw e;
    } finally {
      StructuredLogger.clearOperationContext();
    }
  }

  /**
   * Read a sync map file and return its JSON representation.
   *
   * @param request the inspect request
   * @return the JSON representation of the sync map
   */
  public String inspect(InspectRequest request) throws IOException {
    StructuredLogger.setOperationContext("inspect", request.inputFormat());
    try {
      return read(request.inputFormat(), Path.of(request.inputPath()), request.parameters())
          .jsonString();
    } catch (IOException | RuntimeException e) {
      structuredLogger.logOperationFailed("inspect", e.getClass().getSimpleName(), e.getMessage());
      throw e;
    } finally {
      StructuredLogger.clearOperationContext();
    }
  }

  /**
   * Read a sync map file and write its fine-tuning HTML page.
   *
   * @param request the export request
   * @return where the page was written and what it contains
   */
  public SyncMapResponse finetune(FinetuneRequest request) throws IOException {
    String outputFormat = request.parameters().get(SyncMapParameters.OUTPUT_FORMAT);
    StructuredLogger.setOperationContext("finetune", outputFormat);
    try {
      SyncMap syncMap =
          read(request.inputFormat(), Path.of(request.inputPath()), request.parameters());
      syncMap.outputHtmlForTuning(
          Path.of(request.audioPath()), Path.of(request.outputPath()), request.parameters());
      structuredLogger.logFinetuneExported(request.outputPath(), outputFormat, syncMap.size());
      return new SyncMapResponse(request.outputPath(), syncMap.size(), syncMap.isSingleLevel());
    } catch (IOException | RuntimeException e) {
      structuredLogger.logOperationFailed(
          "finetune", e.getClass().getSimpleName(), e.getMessage());
      throw e;
    } finally {
      StructuredLogger.clearOperationContext();
    }
  }
}
