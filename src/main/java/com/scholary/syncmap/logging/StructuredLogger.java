package com.scholary.syncmap.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log sync map events with structured fields that can be queried in the
 * log aggregator.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log sync map read event. */
  public void logSyncMapRead(
      String format, String path, int fragmentCount, boolean singleLevel, long durationMs) {
    try {
      MDC.put("event_type", "syncmap_read");
      MDC.put("path", path);
      MDC.put("fragmentCount", String.valueOf(fragmentCount));
      MDC.put("singleLevel", String.valueOf(singleLevel));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Sync map read: format={}, path={}, fragments={}, singleLevel={}, duration={}ms",
          format,
          path,
          fragmentCount,
          singleLevel,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log sync map written event. */
  public void logSyncMapWritten(String format, String path, int fragmentCount, long durationMs) {
    try {
      MDC.put("event_type", "syncmap_written");
      MDC.put("path", path);
      MDC.put("fragmentCount", String.valueOf(fragmentCount));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Sync map written: format={}, path={}, fragments={}, duration={}ms",
          format,
          path,
          fragmentCount,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log fine-tuning page exported event. */
  public void logFinetuneExported(String path, String outputFormat, int fragmentCount) {
    try {
      MDC.put("event_type", "finetune_exported");
      MDC.put("path", path);
      MDC.put("outputFormat", String.valueOf(outputFormat));
      MDC.put("fragmentCount", String.valueOf(fragmentCount));

      logger.info(
          "Fine-tuning page exported: path={}, outputFormat={}, fragments={}",
          path,
          outputFormat,
          fragmentCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log operation failure event. */
  public void logOperationFailed(String operation, String errorType, String message) {
    try {
      MDC.put("event_type", "operation_failed");
      MDC.put("errorType", errorType);

      logger.warn(
          "Operation failed: operation={}, error={}, message={}", operation, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set operation context in MDC. */
  public static void setOperationContext(String operation, String format) {
    MDC.put("operation", operation);
    MDC.put("format", format);
  }

  /** Clear operation context from MDC. */
  public static void clearOperationContext() {
    MDC.remove("operation");
    MDC.remove("format");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("path");
    MDC.remove("fragmentCount");
    MDC.remove("singleLevel");
    MDC.remove("durationMs");
    MDC.remove("outputFormat");
    MDC.remove("errorType");
  }
}
