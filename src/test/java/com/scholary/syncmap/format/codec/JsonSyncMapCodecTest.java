package com.scholary.syncmap.format.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.syncmap.format.SyncMapFormat;
import com.scholary.syncmap.syncmap.SyncMap;
import com.scholary.syncmap.syncmap.SyncMapFormatException;
import com.scholary.syncmap.syncmap.SyncMapFragment;
import com.scholary.syncmap.text.TextFragment;
import com.scholary.syncmap.tree.Tree;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonSyncMapCodecTest {

  private final JsonSyncMapCodec codec = new JsonSyncMapCodec(SyncMapFormat.JSON, null, null);

  @Test
  void format_shouldMatchJsonString() {
    SyncMap syncMap = new SyncMap();
    syncMap.addFragment(
        new SyncMapFragment(new TextFragment("f1", "en", List.of("Hello")), 0.0, 1.0));

    assertThat(codec.format(syncMap)).isEqualTo(syncMap.jsonString());
  }

  @Test
  void parse_shouldRebuildNestedFragments() {
    SyncMap syncMap = new SyncMap();

    codec.parse(
        "{\"fragments\": [{\"id\": \"p1\", \"lines\": [\"a\", \"b\"], \"begin\": \"0.000\","
            + " \"end\": \"2.000\", \"children\": [{\"id\": \"s1\", \"language\": \"de\","
            + " \"lines\": [\"a\"], \"begin\": \"0.000\", \"end\": \"1.000\"}]}]}",
        syncMap);

    assertThat(syncMap.isSingleLevel()).isFalse();
    Tree<SyncMapFragment> paragraph = syncMap.fragmentsTree().children().get(0);
    assertThat(paragraph.value().textFragment().getLines()).containsExactly("a", "b");
    assertThat(paragraph.value().textFragment().getLanguage()).isNull();
    SyncMapFragment sentence = paragraph.children().get(0).value();
    assertThat(sentence.textFragment().getIdentifier()).isEqualTo("s1");
    assertThat(sentence.textFragment().getLanguage()).isEqualTo("de");
    assertThat(sentence.end()).isEqualTo(1.0);
  }

  @Test
  void parse_shouldRejectInvalidJson() {
    assertThatThrownBy(() -> codec.parse("{\"fragments\": [", new SyncMap()))
        .isInstanceOf(SyncMapFormatException.class)
        .hasMessageStartingWith("Invalid JSON sync map");
  }

  @Test
  void parse_shouldRequireFragmentsArray() {
    assertThatThrownBy(() -> codec.parse("{\"segments\": []}", new SyncMap()))
        .isInstanceOf(SyncMapFormatException.class)
        .hasMessageContaining("'fragments'");
  }

  @Test
  void parse_shouldRequireFragmentIdentifier() {
    assertThatThrownBy(
            () ->
                codec.parse(
                    "{\"fragments\": [{\"begin\": \"0.000\", \"end\": \"1.000\"}]}",
                    new SyncMap()))
        .isInstanceOf(SyncMapFormatException.class)
        .hasMessageContaining("without 'id'");
  }

  @Test
  void parse_shouldRejectInvalidTimes() {
    assertThatThrownBy(
            () ->
                codec.parse(
                    "{\"fragments\": [{\"id\": \"f1\", \"begin\": \"-1\", \"end\": \"1.000\"}]}",
                    new SyncMap()))
        .isInstanceOf(SyncMapFormatException.class)
        .hasMessageContaining("'f1'");
  }
}
