package com.scholary.syncmap.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for sync map processing.
 *
 * <p>These are handed to every sync map and, through it, to every codec the sync map builds.
 */
@ConfigurationProperties(prefix = "syncmap")
@Validated
public record SyncMapProperties(
    @NotBlank String finetuneTemplate,
    @PositiveOrZero Integer jsonIndent,
    @NotBlank String fragmentIdPrefix) {

  public static final String DEFAULT_FINETUNE_TEMPLATE = "finetune.html";
  public static final int DEFAULT_JSON_INDENT = 1;
  public static final String DEFAULT_FRAGMENT_ID_PREFIX = "f";

  // Provide defaults
  public SyncMapProperties {
    if (finetuneTemplate == null) {
      finetuneTemplate = DEFAULT_FINETUNE_TEMPLATE;
    }
    if (jsonIndent == null) {
      jsonIndent = DEFAULT_JSON_INDENT;
    }
    if (fragmentIdPrefix == null) {
      fragmentIdPrefix = DEFAULT_FRAGMENT_ID_PREFIX;
    }
  }

  public static SyncMapProperties defaults() {
    return new SyncMapProperties(
        DEFAULT_FINETUNE_TEMPLATE, DEFAULT_JSON_INDENT, DEFAULT_FRAGMENT_ID_PREFIX);
  }
}
