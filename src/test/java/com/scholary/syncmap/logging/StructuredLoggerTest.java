package com.scholary.syncmap.logging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class StructuredLoggerTest {

  @Mock private Logger logger;

  private StructuredLogger structuredLogger;
  private final Map<String, String> mdcAtLogTime = new HashMap<>();

  @BeforeEach
  void setUp() {
    structuredLogger = new StructuredLogger(logger);
    MDC.clear();
  }

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  void logSyncMapRead_shouldPopulateMdcOnlyWhileLogging() {
    doAnswer(
            invocation -> {
              mdcAtLogTime.putAll(MDC.getCopyOfContextMap());
              return null;
            })
        .when(logger)
        .info(anyString(), any(), any(), any(), any(), any());

    structuredLogger.logSyncMapRead("srt", "/tmp/map.srt", 3, true, 12);

    assertThat(mdcAtLogTime)
        .containsEntry("event_type", "syncmap_read")
        .containsEntry("fragmentCount", "3")
        .containsEntry("singleLevel", "true")
        .containsEntry("durationMs", "12");
    assertThat(MDC.get("event_type")).isNull();
    assertThat(MDC.get("fragmentCount")).isNull();
  }

  @Test
  void logOperationFailed_shouldLogAtWarnAndClearFields() {
    structuredLogger.logOperationFailed("convert", "SyncMapFormatException", "Line 3");

    verify(logger)
        .warn(
            eq("Operation failed: operation={}, error={}, message={}"),
            eq("convert"),
            eq("SyncMapFormatException"),
            eq("Line 3"));
    assertThat(MDC.get("errorType")).isNull();
  }

  @Test
  void eventLogging_shouldKeepOperationContext() {
    StructuredLogger.setOperationContext("finetune", "smil");

    structuredLogger.logFinetuneExported("/tmp/page.html", "smil", 2);
    structuredLogger.logSyncMapWritten("smil", "/tmp/out.smil", 2, 5);

    assertThat(MDC.get("operation")).isEqualTo("finetune");
    assertThat(MDC.get("format")).isEqualTo("smil");
    assertThat(MDC.get("outputFormat")).isNull();

    StructuredLogger.clearOperationContext();

    assertThat(MDC.get("operation")).isNull();
    assertThat(MDC.get("format")).isNull();
  }
}
