package com.scholary.syncmap.format.codec;

import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.format.SyncMapCodec;
import com.scholary.syncmap.format.SyncMapFormat;
import com.scholary.syncmap.format.SyncMapReader;
import com.scholary.syncmap.format.SyncMapWriter;
import com.scholary.syncmap.syncmap.SyncMap;
import com.scholary.syncmap.syncmap.SyncMapFormatException;
import com.scholary.syncmap.syncmap.SyncMapFragment;
import com.scholary.syncmap.syncmap.TimeFormats;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads and writes one-fragment-per-line formats.
 *
 * <ul>
 *   <li>csv: {@code f000001,0.000,1.000,"Hello world"}
 *   <li>ssv: {@code 0.000 1.000 f000001 "Hello world"}
 *   <li>tsv: {@code 0.000<TAB>1.000<TAB>f000001} (no text)
 *   <li>txt: {@code f000001 0.000 1.000 "Hello world"}
 * </ul>
 *
 * <p>Multi-line text is written on one line, joined with a space. Quotes inside the text are
 * doubled.
 */
public class DelimitedSyncMapCodec extends SyncMapCodec implements SyncMapReader, SyncMapWriter {

  private enum Layout {
    CSV(",", true, true),
    SSV(" ", false, true),
    TSV("\t", false, false),
    TXT(" ", true, true);

    private final String separator;
    private final boolean identifierFirst;
    private final boolean withText;

    Layout(String separator, boolean identifierFirst, boolean withText) {
      this.separator = separator;
      this.identifierFirst = identifierFirst;
      this.withText = withText;
    }

    int columns() {
      return withText ? 4 : 3;
    }
  }

  private final Layout layout;

  public DelimitedSyncMapCodec(
      SyncMapFormat variant, Map<String, String> parameters, SyncMapProperties properties) {
    super(variant, parameters, properties);
    this.layout = layoutOf(variant);
  }

  private static Layout layoutOf(SyncMapFormat variant) {
    if (variant == null) {
      throw new IllegalArgumentException("Not a delimited format: null");
    }
    switch (variant) {
      case CSV:
        return Layout.CSV;
      case SSV:
        return Layout.SSV;
      case TSV:
        return Layout.TSV;
      case TXT:
        return Layout.TXT;
      default:
        throw new IllegalArgumentException("Not a delimited format: " + variant);
    }
  }

  @Override
  public String format(SyncMap syncMap) {
    StringBuilder output = new StringBuilder();
    for (SyncMapFragment fragment : syncMap.fragments()) {
      String identifier = fragment.textFragment().getIdentifier();
      String begin = TimeFormats.toSeconds(fragment.begin());
      String end = TimeFormats.toSeconds(fragment.end());
      String row =
          layout.identifierFirst
              ? String.join(layout.separator, identifier, begin, end)
              : String.join(layout.separator, begin, end, identifier);
      output.append(row);
      if (layout.withText) {
        output.append(layout.separator).append(quote(fragment.textFragment().getText()));
      }
      output.append("\n");
    }
    return output.toString();
  }

  @Override
  public void parse(String inputText, SyncMap syncMap) {
    int lineNumber = 0;
    for (String line : inputText.split("\r?\n")) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      String[] columns = line.strip().split(Pattern.quote(layout.separator), layout.columns());
      if (columns.length < 3) {
        throw new SyncMapFormatException(
            String.format(
                "Line %d: expected %d columns: '%s'", lineNumber, layout.columns(), line));
      }
      String identifier = layout.identifierFirst ? columns[0] : columns[2];
      String begin = layout.identifierFirst ? columns[1] : columns[0];
      String end = layout.identifierFirst ? columns[2] : columns[1];
      String text = layout.withText && columns.length > 3 ? unquote(columns[3]) : "";
      // a fragment without lines is written as ""
      List<String> lines = text.isEmpty() ? List.of() : List.of(text);
      try {
        syncMap.addFragment(
            newFragment(
                identifier.strip(),
                lines,
                TimeFormats.parseSeconds(begin),
                TimeFormats.parseSeconds(end)));
      } catch (IllegalArgumentException e) {
        throw new SyncMapFormatException(
            String.format("Line %d: invalid times: '%s'", lineNumber, line), e);
      }
    }
  }

  private static String quote(String text) {
    return "\"" + text.replace("\"", "\"\"") + "\"";
  }

  private static String unquote(String text) {
    String value = text.strip();
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      value = value.substring(1, value.length() - 1).replace("\"\"", "\"");
    }
    return value;
  }
}
