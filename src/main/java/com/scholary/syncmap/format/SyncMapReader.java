package com.scholary.syncmap.format;

import com.scholary.syncmap.syncmap.SyncMap;

/** A codec that can populate a sync map from text. */
public interface SyncMapReader {

  /**
   * Parse the given text and add the fragments it describes to the sync map.
   *
   * @param inputText the whole input file contents
   * @param syncMap the sync map to populate
   * @throws com.scholary.syncmap.syncmap.SyncMapFormatException if the text is malformed
   */
  void parse(String inputText, SyncMap syncMap);
}
