package com.scholary.syncmap.syncmap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.format.SyncMapCodec;
import com.scholary.syncmap.format.SyncMapFormat;
import com.scholary.syncmap.format.SyncMapFormatRegistry;
import com.scholary.syncmap.format.SyncMapReader;
import com.scholary.syncmap.format.SyncMapWriter;
import com.scholary.syncmap.text.TextFragment;
import com.scholary.syncmap.tree.Tree;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

/**
 * A synchronization map: a tree of {@link SyncMapFragment}s, each pairing a text fragment with
 * its time interval in the audio.
 *
 * <p>The root node carries no value. A single-level map is a flat list of fragments under the
 * root; a hierarchical map nests fragments (e.g. paragraph, sentence, word).
 *
 * <p>Reading and writing files is delegated to the codec registered for the requested format.
 * The fine-tuning HTML export is self-contained and does not use the registry.
 *
 * <p>Instances are not thread-safe.
 */
public class SyncMap {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyncMap.class);

  /** Literal replacements applied to the fine-tuning template, in this order. */
  static final List<String[]> FINETUNE_REPLACEMENTS =
      List.of(
          new String[] {
            "<!-- SYNCMAP_REPLACE_COMMENT_BEGIN -->", "<!-- SYNCMAP_REPLACE_COMMENT_BEGIN"
          },
          new String[] {"<!-- SYNCMAP_REPLACE_COMMENT_END -->", "SYNCMAP_REPLACE_COMMENT_END -->"},
          new String[] {
            "<!-- SYNCMAP_REPLACE_UNCOMMENT_BEGIN", "<!-- SYNCMAP_REPLACE_UNCOMMENT_BEGIN -->"
          },
          new String[] {
            "SYNCMAP_REPLACE_UNCOMMENT_END -->", "<!-- SYNCMAP_REPLACE_UNCOMMENT_END -->"
          },
          new String[] {"// SYNCMAP_REPLACE_SHOW_ID", "showID = true;"},
          new String[] {"// SYNCMAP_REPLACE_ALIGN_TEXT", "alignText = \"left\""},
          new String[] {"// SYNCMAP_REPLACE_CONTINUOUS_PLAY", "continuousPlay = true;"},
          new String[] {"// SYNCMAP_REPLACE_TIME_FORMAT", "timeFormatHHMMSSmmm = true;"});

  static final String FINETUNE_REPLACE_AUDIOFILEPATH = "// SYNCMAP_REPLACE_AUDIOFILEPATH";
  static final String FINETUNE_REPLACE_FRAGMENTS = "// SYNCMAP_REPLACE_FRAGMENTS";
  static final String FINETUNE_REPLACE_OUTPUT_FORMAT = "// SYNCMAP_REPLACE_OUTPUT_FORMAT";
  static final String FINETUNE_REPLACE_SMIL_AUDIOREF = "// SYNCMAP_REPLACE_SMIL_AUDIOREF";
  static final String FINETUNE_REPLACE_SMIL_PAGEREF = "// SYNCMAP_REPLACE_SMIL_PAGEREF";

  /** Output formats the fine-tuning page can save to. */
  public static final List<String> FINETUNE_ALLOWED_FORMATS =
      List.of("csv", "json", "smil", "srt", "ssv", "ttml", "tsv", "txt", "vtt", "xml");

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final SyncMapProperties properties;
  private final SyncMapFormatRegistry registry;
  private Tree<SyncMapFragment> fragmentsTree = new Tree<>();

  public SyncMap() {
    this(SyncMapProperties.defaults(), SyncMapFormatRegistry.defaults());
  }

  public SyncMap(SyncMapProperties properties, SyncMapFormatRegistry registry) {
    this.properties = properties == null ? SyncMapProperties.defaults() : properties;
    this.registry = registry == null ? SyncMapFormatRegistry.defaults() : registry;
  }

  /** The whole tree. Codecs that build nested structure attach nodes here directly. */
  public Tree<SyncMapFragment> fragmentsTree() {
    return fragmentsTree;
  }

  /**
   * Replace the whole tree, e.g. with one a codec assembled on its own.
   *
   * @throws IllegalArgumentException if the tree is null or is not a root
   */
  public void fragmentsTree(Tree<SyncMapFragment> fragmentsTree) {
    if (fragmentsTree == null) {
      throw new IllegalArgumentException("Fragments tree cannot be null");
    }
    if (!fragmentsTree.isRoot()) {
      throw new IllegalArgumentException("Fragments tree must be a root node");
    }
    this.fragmentsTree = fragmentsTree;
  }

  /**
   * True if no fragment has fragments below it.
   *
   * <p>Nodes without a value do not count as a level, as in {@link #fragments()}.
   */
  public boolean isSingleLevel() {
    for (Tree<SyncMapFragment> child : visibleChildren(fragmentsTree)) {
      if (!visibleChildren(child).isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /**
   * The top-level fragments, in document order.
   *
   * <p>Computed on every call. Nodes without a value are transparent: their non-empty children
   * are listed in their place.
   */
  public List<SyncMapFragment> fragments() {
    return visibleChildren(fragmentsTree).stream().map(Tree::value).collect(Collectors.toList());
  }

  /** Number of top-level fragments. */
  public int size() {
    return fragments().size();
  }

  /**
   * Add a fragment as the first or last child of the root.
   *
   * @param fragment the fragment to add
   * @param asLast if true append the fragment, otherwise prepend it
   * @throws IllegalArgumentException if the fragment is null
   */
  public void addFragment(SyncMapFragment fragment, boolean asLast) {
    if (fragment == null) {
      throw new IllegalArgumentException("fragment is not an instance of SyncMapFragment");
    }
    fragmentsTree.addChild(new Tree<>(fragment), asLast);
  }

  public void addFragment(SyncMapFragment fragment) {
    addFragment(fragment, true);
  }

  /** Remove all fragments. */
  public void clear() {
    LOGGER.debug("Clearing sync map");
    fragmentsTree = new Tree<>();
  }

  /**
   * JSON representation of the sync map.
   *
   * <p>Format:
   *
   * <pre>
   * {
   *  "fragments" : [
   *   {
   *    "begin" : "0.000",
   *    "children" : [ ],
   *    "end" : "1.000",
   *    "id" : "f000001",
   *    "language" : "en",
   *    "lines" : [
   *     "Hello world"
   *    ]
   *   }
   *  ]
   * }
   * </pre>
   *
   * <p>Keys are sorted and the output is identical for identical trees.
   */
  public String jsonString() {
    Map<String, Object> document = new TreeMap<>();
    document.put("fragments", jsonFragments(fragmentsTree));
    DefaultIndenter indenter = new DefaultIndenter(" ".repeat(properties.jsonIndent()), "\n");
    DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
    printer.indentObjectsWith(indenter);
    printer.indentArraysWith(indenter);
    try {
      return OBJECT_MAPPER.writer(printer).writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new SyncMapFormatException("Cannot render sync map as JSON", e);
    }
  }

  private static List<Map<String, Object>> jsonFragments(Tree<SyncMapFragment> node) {
    List<Map<String, Object>> output = new ArrayList<>();
    for (Tree<SyncMapFragment> child : visibleChildren(node)) {
      SyncMapFragment fragment = child.value();
      TextFragment text = fragment.textFragment();
      Map<String, Object> entry = new TreeMap<>();
      entry.put("id", text.getIdentifier());
      entry.put("language", text.getLanguage());
      entry.put("lines", text.getLines());
      entry.put("begin", TimeFormats.toSeconds(fragment.begin()));
      entry.put("end", TimeFormats.toSeconds(fragment.end()));
      entry.put("children", jsonFragments(child));
      output.add(entry);
    }
    return output;
  }

  private static List<Tree<SyncMapFragment>> visibleChildren(Tree<SyncMapFragment> node) {
    List<Tree<SyncMapFragment>> result = new ArrayList<>();
    for (Tree<SyncMapFragment> child : node.childrenNotEmpty()) {
      if (child.hasValue()) {
        result.add(child);
      } else {
        result.addAll(visibleChildren(child));
      }
    }
    return result;
  }

  /**
   * Read fragments from a file and add them to this sync map.
   *
   * @param formatCode the format code, e.g. {@code "srt"}
   * @see #read(SyncMapFormat, Path, Map)
   */
  public void read(String formatCode, Path inputPath, Map<String, String> parameters)
      throws IOException {
    read(SyncMapFormat.fromCode(formatCode), inputPath, parameters);
  }

  /**
   * Read fragments from a file in the given format and add them to this sync map.
   *
   * <p>If the parameters carry a {@link SyncMapParameters#LANGUAGE}, every fragment gets that
   * language once the codec is done. A codec failing halfway leaves what it already added.
   *
   * @param format the format of the file
   * @param inputPath the file to read
   * @param parameters additional parameters, may be null
   * @throws IllegalArgumentException if the format is null, not registered or cannot be read
   * @throws AccessDeniedException if the file does not exist or cannot be read
   * @throws SyncMapMissingParameterException if the format requires an absent parameter
   * @throws IOException if reading the file fails
   */
  public void read(SyncMapFormat format, Path inputPath, Map<String, String> parameters)
      throws IOException {
    checkFormat(format);
    if (!canBeRead(inputPath)) {
      throw new AccessDeniedException(
          String.valueOf(inputPath), null, "Cannot read sync map file. Wrong permissions?");
    }

    LOGGER.debug("Input format: '{}'", format);
    LOGGER.debug("Input path: '{}'", inputPath);
    LOGGER.debug("Input parameters: '{}'", parameters);

    SyncMapCodec codec = registry.create(format, parameters, properties);
    if (!(codec instanceof SyncMapReader reader)) {
      throw new IllegalArgumentException("Sync map format '" + format + "' cannot be read");
    }

    LOGGER.debug("Reading input file with {}", codec.getCodecName());
    String inputText = Files.readString(inputPath, StandardCharsets.UTF_8);
    reader.parse(inputText, this);
    LOGGER.debug("Reading input file... done");

    String language = parameters == null ? null : parameters.get(SyncMapParameters.LANGUAGE);
    if (language != null) {
      LOGGER.debug("Overwriting language to '{}'", language);
      for (SyncMapFragment fragment : fragmentsTree.preOrderValues()) {
        fragment.textFragment().setLanguage(language);
      }
    }
  }

  /**
   * Write this sync map to a file.
   *
   * @param formatCode the format code, e.g. {@code "srt"}
   * @see #write(SyncMapFormat, Path, Map)
   */
  public void write(String formatCode, Path outputPath, Map<String, String> parameters)
      throws IOException {
    write(SyncMapFormat.fromCode(formatCode), outputPath, parameters);
  }

  /**
   * Write this sync map to a file in the given format, creating parent directories as needed.
   *
   * @param format the output format
   * @param outputPath the file to write
   * @param parameters additional parameters (e.g. the SMIL references), may be null
   * @throws IllegalArgumentException if the format is null, not registered or cannot be written
   * @throws AccessDeniedException if the file cannot be written
   * @throws SyncMapMissingParameterException if the format requires an absent parameter
   * @throws IOException if writing the file fails
   */
  public void write(SyncMapFormat format, Path outputPath, Map<String, String> parameters)
      throws IOException {
    checkFormat(format);
    if (!canBeWritten(outputPath)) {
      throw new AccessDeniedException(
          String.valueOf(outputPath), null, "Cannot write sync map file. Wrong permissions?");
    }

    LOGGER.debug("Output format: '{}'", format);
    LOGGER.debug("Output path: '{}'", outputPath);
    LOGGER.debug("Output parameters: '{}'", parameters);

    // the codec checks its required parameters on construction
    SyncMapCodec codec = registry.create(format, parameters, properties);
    if (!(codec instanceof SyncMapWriter writer)) {
      throw new IllegalArgumentException("Sync map format '" + format + "' cannot be written");
    }

    ensureParentDirectory(outputPath);

    LOGGER.debug("Writing output file with {}", codec.getCodecName());
    writeText(outputPath, writer.format(this));
    LOGGER.debug("Writing output file... done");
  }

  /**
   * Write an HTML page for fine tuning the sync map manually.
   *
   * <p>The page embeds the JSON representation of this sync map and plays the given audio file.
   * If the parameters carry an {@link SyncMapParameters#OUTPUT_FORMAT} the page can save to, it
   * is preselected; for SMIL the audio and page references are embedded when present.
   *
   * @param audioPath the audio file the sync map refers to
   * @param outputPath the HTML file to write
   * @param parameters additional parameters, may be null
   * @throws AccessDeniedException if the file cannot be written
   * @throws IOException if loading the template or writing the file fails
   */
  public void outputHtmlForTuning(Path audioPath, Path outputPath, Map<String, String> parameters)
      throws IOException {
    if (!canBeWritten(outputPath)) {
      throw new AccessDeniedException(
          String.valueOf(outputPath), null, "Cannot output HTML file. Wrong permissions?");
    }
    Map<String, String> params = parameters == null ? Map.of() : parameters;

    String audioPathAbsolute =
        audioPath.toAbsolutePath().normalize().toString().replace('\\', '/');
    String template = loadTemplate();
    for (String[] replacement : FINETUNE_REPLACEMENTS) {
      template = template.replace(replacement[0], replacement[1]);
    }
    template =
        template.replace(
            FINETUNE_REPLACE_AUDIOFILEPATH,
            "audioFilePath = \"file://" + audioPathAbsolute + "\";");
    template =
        template.replace(
            FINETUNE_REPLACE_FRAGMENTS, "fragments = (" + jsonString() + ").fragments;");

    String outputFormat = params.get(SyncMapParameters.OUTPUT_FORMAT);
    if (outputFormat != null && FINETUNE_ALLOWED_FORMATS.contains(outputFormat)) {
      template =
          template.replace(
              FINETUNE_REPLACE_OUTPUT_FORMAT, "outputFormat = \"" + outputFormat + "\";");
      if ("smil".equals(outputFormat)) {
        String audioRef = params.get(SyncMapParameters.SMIL_AUDIO_REF);
        if (audioRef != null) {
          template =
              template.replace(FINETUNE_REPLACE_SMIL_AUDIOREF, "audioref = \"" + audioRef + "\";");
        }
        String pageRef = params.get(SyncMapParameters.SMIL_PAGE_REF);
        if (pageRef != null) {
          template =
              template.replace(FINETUNE_REPLACE_SMIL_PAGEREF, "pageref = \"" + pageRef + "\";");
        }
      }
    }

    ensureParentDirectory(outputPath);
    writeText(outputPath, template);
    LOGGER.debug("Fine-tuning page written to '{}'", outputPath);
  }

  private String loadTemplate() throws IOException {
    ClassPathResource resource = new ClassPathResource(properties.finetuneTemplate());
    try (InputStream inputStream = resource.getInputStream()) {
      return StreamUtils.copyToString(inputStream, StandardCharsets.UTF_8);
    }
  }

  private void checkFormat(SyncMapFormat format) {
    if (format == null) {
      throw new IllegalArgumentException("Sync map format is null");
    }
    if (!registry.supports(format)) {
      throw new IllegalArgumentException("Sync map format '" + format + "' is not allowed");
    }
  }

  static boolean canBeRead(Path path) {
    return path != null && Files.isRegularFile(path) && Files.isReadable(path);
  }

  /**
   * An existing path must be a writable file; a missing one must have a writable directory as
   * its nearest existing ancestor. Nothing is created on disk.
   */
  static boolean canBeWritten(Path path) {
    if (path == null) {
      return false;
    }
    Path absolute = path.toAbsolutePath();
    if (Files.exists(absolute)) {
      return Files.isRegularFile(absolute) && Files.isWritable(absolute);
    }
    Path ancestor = absolute.getParent();
    while (ancestor != null && !Files.exists(ancestor)) {
      ancestor = ancestor.getParent();
    }
    return ancestor != null && Files.isDirectory(ancestor) && Files.isWritable(ancestor);
  }

  private static void ensureParentDirectory(Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }

  private static void writeText(Path path, String text) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      writer.write(text);
    }
  }

  @Override
  public String toString() {
    return fragments().stream().map(SyncMapFragment::toString).collect(Collectors.joining("\n"));
  }
}
