package com.scholary.syncmap.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class SyncMapPropertiesTest {

  @Test
  void constructor_shouldFillMissingValuesWithDefaults() {
    SyncMapProperties properties = new SyncMapProperties(null, null, null);

    assertThat(properties.finetuneTemplate()).isEqualTo("finetune.html");
    assertThat(properties.jsonIndent()).isEqualTo(1);
    assertThat(properties.fragmentIdPrefix()).isEqualTo("f");
  }

  @Test
  void constructor_shouldKeepGivenIndent() {
    assertThat(new SyncMapProperties(null, 2, null).jsonIndent()).isEqualTo(2);
    assertThat(new SyncMapProperties(null, 0, null).jsonIndent()).isZero();
  }

  @Test
  void binding_withoutJsonIndent_shouldUseDefaultIndent() {
    Binder binder =
        new Binder(
            new MapConfigurationPropertySource(
                Map.of("syncmap.finetune-template", "custom.html")));

    SyncMapProperties properties = binder.bind("syncmap", SyncMapProperties.class).get();

    assertThat(properties.finetuneTemplate()).isEqualTo("custom.html");
    assertThat(properties.jsonIndent()).isEqualTo(1);
    assertThat(properties.fragmentIdPrefix()).isEqualTo("f");
  }

  @Test
  void defaults_shouldUseOneSpaceIndentAndPrefixF() {
    assertThat(SyncMapProperties.defaults())
        .isEqualTo(new SyncMapProperties("finetune.html", 1, "f"));
  }
}
