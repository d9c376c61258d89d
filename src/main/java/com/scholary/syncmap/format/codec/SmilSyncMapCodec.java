package com.scholary.syncmap.format.codec;

import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.format.SyncMapCodec;
import com.scholary.syncmap.format.SyncMapFormat;
import com.scholary.syncmap.format.SyncMapWriter;
import com.scholary.syncmap.syncmap.SyncMap;
import com.scholary.syncmap.syncmap.SyncMapFragment;
import com.scholary.syncmap.syncmap.SyncMapParameters;
import com.scholary.syncmap.syncmap.TimeFormats;
import com.scholary.syncmap.tree.Tree;
import java.util.Locale;
import java.util.Map;

/**
 * Writes SMIL 3.0 media overlays, as used by EPUB 3.
 *
 * <p>Every fragment with children becomes a {@code seq}, every leaf fragment a {@code par}
 * pointing at the page and the audio clip. Output only; both {@link
 * SyncMapParameters#SMIL_AUDIO_REF} and {@link SyncMapParameters#SMIL_PAGE_REF} are required.
 */
public class SmilSyncMapCodec extends SyncMapCodec implements SyncMapWriter {

  private static final String INDENT = " ";

  private final String audioRef;
  private final String pageRef;
  private int seqCounter;
  private int parCounter;

  public SmilSyncMapCodec(
      SyncMapFormat variant, Map<String, String> parameters, SyncMapProperties properties) {
    super(variant, parameters, properties);
    this.audioRef = requireParameter(SyncMapParameters.SMIL_AUDIO_REF);
    this.pageRef = requireParameter(SyncMapParameters.SMIL_PAGE_REF);
  }

  @Override
  public String format(SyncMap syncMap) {
    seqCounter = 0;
    parCounter = 0;
    StringBuilder output = new StringBuilder();
    output.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
    output.append(
        "<smil xmlns=\"http://www.w3.org/ns/SMIL\""
            + " xmlns:epub=\"http://www.idpf.org/2007/ops\" version=\"3.0\">\n");
    output.append(INDENT).append("<body>\n");
    appendSeq(output, syncMap.fragmentsTree(), null, 2);
    output.append(INDENT).append("</body>\n");
    output.append("</smil>\n");
    return output.toString();
  }

  private void appendSeq(
      StringBuilder output, Tree<SyncMapFragment> node, SyncMapFragment fragment, int depth) {
    String indent = INDENT.repeat(depth);
    seqCounter++;
    output
        .append(indent)
        .append("<seq id=\"")
        .append(String.format(Locale.ROOT, "seq%06d", seqCounter))
        .append("\" epub:textref=\"")
        .append(escape(fragment == null ? pageRef : textRef(fragment)))
        .append("\">\n");
    for (Tree<SyncMapFragment> child : node.childrenNotEmpty()) {
      if (!child.hasValue()) {
        appendSeq(output, child, null, depth + 1);
      } else if (child.childrenNotEmpty().isEmpty()) {
        appendPar(output, child.value(), depth + 1);
      } else {
        appendSeq(output, child, child.value(), depth + 1);
      }
    }
    output.append(indent).append("</seq>\n");
  }

  private void appendPar(StringBuilder output, SyncMapFragment fragment, int depth) {
    String indent = INDENT.repeat(depth);
    parCounter++;
    output
        .append(indent)
        .append("<par id=\"")
        .append(String.format(Locale.ROOT, "par%06d", parCounter))
        .append("\">\n");
    output
        .append(indent)
        .append(INDENT)
        .append("<text src=\"")
        .append(escape(textRef(fragment)))
        .append("\"/>\n");
    output
        .append(indent)
        .append(INDENT)
        .append("<audio clipBegin=\"")
        .append(TimeFormats.toClock(fragment.begin()))
        .append("\" clipEnd=\"")
        .append(TimeFormats.toClock(fragment.end()))
        .append("\" src=\"")
        .append(escape(audioRef))
        .append("\"/>\n");
    output.append(indent).append("</par>\n");
  }

  private String textRef(SyncMapFragment fragment) {
    return pageRef + "#" + fragment.textFragment().getIdentifier();
  }

  private static String escape(String value) {
    return value
        .replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;");
  }
}
