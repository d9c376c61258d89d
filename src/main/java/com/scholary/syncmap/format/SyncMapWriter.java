package com.scholary.syncmap.format;

import com.scholary.syncmap.syncmap.SyncMap;

/** A codec that can render a sync map as text. */
public interface SyncMapWriter {

  /**
   * Render the whole sync map.
   *
   * @param syncMap the sync map to render
   * @return the rendered text
   */
  String format(SyncMap syncMap);
}
