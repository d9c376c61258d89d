package com.scholary.syncmap.syncmap;

import com.scholary.syncmap.text.TextFragment;

/**
 * A text fragment with its time interval in the audio.
 *
 * <p>This is the payload of every value-bearing node of a {@link SyncMap} tree.
 */
public record SyncMapFragment(TextFragment textFragment, TimeRange interval) {

  public SyncMapFragment {
    if (textFragment == null) {
      throw new IllegalArgumentException("Text fragment cannot be null");
    }
    if (interval == null) {
      throw new IllegalArgumentException("Time interval cannot be null");
    }
  }

  public SyncMapFragment(TextFragment textFragment, double begin, double end) {
    this(textFragment, new TimeRange(begin, end));
  }

  public double begin() {
    return interval.begin();
  }

  public double end() {
    return interval.end();
  }

  @Override
  public String toString() {
    return textFragment.getIdentifier() + " " + interval + " " + textFragment.getText();
  }
}
