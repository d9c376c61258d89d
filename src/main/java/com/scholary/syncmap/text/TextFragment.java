package com.scholary.syncmap.text;

import java.util.List;
import java.util.Objects;

/**
 * A unit of text: an identifier, an optional language and one or more lines.
 *
 * <p>The language is the only mutable field, so that a caller-supplied language can be applied
 * after a sync map has been read.
 */
public class TextFragment {

  private final String identifier;
  private final List<String> lines;
  private String language;

  public TextFragment(String identifier, String language, List<String> lines) {
    if (identifier == null) {
      throw new IllegalArgumentException("Text fragment identifier cannot be null");
    }
    this.identifier = identifier;
    this.language = language;
    this.lines = lines == null ? List.of() : List.copyOf(lines);
  }

  public String getIdentifier() {
    return identifier;
  }

  public String getLanguage() {
    return language;
  }

  public void setLanguage(String language) {
    this.language = language;
  }

  public List<String> getLines() {
    return lines;
  }

  /** The lines joined with a single space. */
  public String getText() {
    return String.join(" ", lines);
  }

  /** Identity is the identifier and the lines; the language can be overridden after reading. */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TextFragment other)) {
      return false;
    }
    return identifier.equals(other.identifier) && lines.equals(other.lines);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, lines);
  }

  @Override
  public String toString() {
    return identifier + " " + getText();
  }
}
