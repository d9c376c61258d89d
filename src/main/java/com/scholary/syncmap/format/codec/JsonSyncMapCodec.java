package com.scholary.syncmap.format.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.format.SyncMapCodec;
import com.scholary.syncmap.format.SyncMapFormat;
import com.scholary.syncmap.format.SyncMapReader;
import com.scholary.syncmap.format.SyncMapWriter;
import com.scholary.syncmap.syncmap.SyncMap;
import com.scholary.syncmap.syncmap.SyncMapFormatException;
import com.scholary.syncmap.syncmap.SyncMapFragment;
import com.scholary.syncmap.syncmap.TimeFormats;
import com.scholary.syncmap.text.TextFragment;
import com.scholary.syncmap.tree.Tree;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the JSON representation of a sync map.
 *
 * <p>Writing produces exactly {@link SyncMap#jsonString()}. Reading accepts the same document
 * and rebuilds nested {@code children}, so hierarchical maps survive a round trip.
 */
public class JsonSyncMapCodec extends SyncMapCodec implements SyncMapReader, SyncMapWriter {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public JsonSyncMapCodec(
      SyncMapFormat variant, Map<String, String> parameters, SyncMapProperties properties) {
    super(variant, parameters, properties);
  }

  @Override
  public String format(SyncMap syncMap) {
    return syncMap.jsonString();
  }

  @Override
  public void parse(String inputText, SyncMap syncMap) {
    JsonNode root;
    try {
      root = OBJECT_MAPPER.readTree(inputText);
    } catch (JsonProcessingException e) {
      throw new SyncMapFormatException("Invalid JSON sync map: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.path("fragments").isArray()) {
      throw new SyncMapFormatException("JSON sync map has no 'fragments' array");
    }
    addChildren(root.get("fragments"), syncMap.fragmentsTree());
  }

  private void addChildren(JsonNode fragments, Tree<SyncMapFragment> parent) {
    for (JsonNode entry : fragments) {
      Tree<SyncMapFragment> node = parent.addChild(new Tree<>(toFragment(entry)));
      JsonNode children = entry.path("children");
      if (children.isArray()) {
        addChildren(children, node);
      }
    }
  }

  private SyncMapFragment toFragment(JsonNode entry) {
    JsonNode id = entry.get("id");
    if (id == null || !id.isTextual()) {
      throw new SyncMapFormatException("JSON fragment without 'id': " + entry);
    }
    JsonNode languageNode = entry.get("language");
    String language =
        languageNode == null || languageNode.isNull() ? null : languageNode.asText();
    List<String> lines = new ArrayList<>();
    for (JsonNode line : entry.path("lines")) {
      lines.add(line.asText());
    }
    try {
      double begin = TimeFormats.parseSeconds(entry.path("begin").asText());
      double end = TimeFormats.parseSeconds(entry.path("end").asText());
      return new SyncMapFragment(new TextFragment(id.asText(), language, lines), begin, end);
    } catch (IllegalArgumentException e) {
      throw new SyncMapFormatException(
          "Invalid times in JSON fragment '" + id.asText() + "': " + e.getMessage(), e);
    }
  }
}
