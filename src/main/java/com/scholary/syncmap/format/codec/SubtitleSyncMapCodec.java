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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes subtitle formats: SRT (SubRip) and VTT (WebVTT).
 *
 * <p>SRT format:
 *
 * <pre>
 * 1
 * 00:00:00,000 --> 00:00:05,200
 * Hello world
 *
 * 2
 * 00:00:05,200 --> 00:00:10,300
 * This is a test
 * </pre>
 *
 * <p>VTT is the same apart from a {@code WEBVTT} header and a dot before the milliseconds.
 * Written cues are numbered from 1; on reading, the cue identifier becomes the fragment
 * identifier.
 */
public class SubtitleSyncMapCodec extends SyncMapCodec implements SyncMapReader, SyncMapWriter {

  private static final String VTT_HEADER = "WEBVTT";
  private static final String ARROW = "-->";

  public SubtitleSyncMapCodec(
      SyncMapFormat variant, Map<String, String> parameters, SyncMapProperties properties) {
    super(variant, parameters, properties);
    if (variant != SyncMapFormat.SRT && variant != SyncMapFormat.VTT) {
      throw new IllegalArgumentException("Not a subtitle format: " + variant);
    }
  }

  private boolean isVtt() {
    return getVariant() == SyncMapFormat.VTT;
  }

  @Override
  public String format(SyncMap syncMap) {
    StringBuilder output = new StringBuilder();
    if (isVtt()) {
      output.append(VTT_HEADER).append("\n\n");
    }

    List<SyncMapFragment> fragments = syncMap.fragments();
    for (int i = 0; i < fragments.size(); i++) {
      SyncMapFragment fragment = fragments.get(i);

      // Sequence number
      output.append(i + 1).append("\n");

      // Timecodes
      output
          .append(formatTime(fragment.begin()))
          .append(" ")
          .append(ARROW)
          .append(" ")
          .append(formatTime(fragment.end()))
          .append("\n");

      // Text
      for (String line : fragment.textFragment().getLines()) {
        output.append(line).append("\n");
      }

      // Blank line between entries
      output.append("\n");
    }
    return output.toString();
  }

  private String formatTime(double seconds) {
    return isVtt() ? TimeFormats.toClock(seconds) : TimeFormats.toSrt(seconds);
  }

  @Override
  public void parse(String inputText, SyncMap syncMap) {
    String normalized = inputText.replace("\r\n", "\n").replace('\r', '\n');
    if (normalized.startsWith("\uFEFF")) {
      normalized = normalized.substring(1);
    }

    int index = 0;
    for (String block : normalized.split("\n\\s*\n")) {
      List<String> lines = new ArrayList<>(Arrays.asList(block.strip().split("\n")));
      if (lines.isEmpty() || lines.get(0).isBlank() || isVttMetadata(lines.get(0))) {
        continue;
      }

      int timingLine = findTimingLine(lines);
      String identifier =
          timingLine > 0 ? lines.get(timingLine - 1).strip() : generatedIdentifier(index);
      double[] times = parseTiming(lines.get(timingLine));
      List<String> text = new ArrayList<>();
      for (String line : lines.subList(timingLine + 1, lines.size())) {
        text.add(line.strip());
      }

      syncMap.addFragment(newFragment(identifier, text, times[0], times[1]));
      index++;
    }
  }

  private boolean isVttMetadata(String firstLine) {
    return isVtt()
        && (firstLine.startsWith(VTT_HEADER)
            || firstLine.startsWith("NOTE")
            || firstLine.startsWith("STYLE")
            || firstLine.startsWith("REGION"));
  }

  private int findTimingLine(List<String> lines) {
    // A cue identifier, if present, takes exactly one line before the timing line
    for (int i = 0; i < Math.min(2, lines.size()); i++) {
      if (lines.get(i).contains(ARROW)) {
        return i;
      }
    }
    throw new SyncMapFormatException("Cue without timing line: '" + lines.get(0) + "'");
  }

  private double[] parseTiming(String line) {
    String[] parts = line.split(ARROW, 2);
    // VTT cue settings may follow the end time
    String end = parts[1].strip().split("\\s+")[0];
    try {
      double beginSeconds = TimeFormats.parseClock(parts[0]);
      double endSeconds = TimeFormats.parseClock(end);
      if (endSeconds < beginSeconds) {
        throw new SyncMapFormatException("Cue ends before it begins: '" + line + "'");
      }
      return new double[] {beginSeconds, endSeconds};
    } catch (IllegalArgumentException e) {
      throw new SyncMapFormatException("Invalid timing line: '" + line + "'", e);
    }
  }
}
