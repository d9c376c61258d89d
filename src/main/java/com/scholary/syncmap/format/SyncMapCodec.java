package com.scholary.syncmap.format;

import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.syncmap.SyncMapFragment;
import com.scholary.syncmap.syncmap.SyncMapMissingParameterException;
import com.scholary.syncmap.text.TextFragment;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base class of the built-in codecs.
 *
 * <p>A codec is bound to one format variant and to the parameters and properties it was built
 * with. Concrete codecs implement {@link SyncMapReader}, {@link SyncMapWriter} or both.
 */
public abstract class SyncMapCodec {

  private final SyncMapFormat variant;
  private final Map<String, String> parameters;
  private final SyncMapProperties properties;

  protected SyncMapCodec(
      SyncMapFormat variant, Map<String, String> parameters, SyncMapProperties properties) {
    this.variant = variant;
    this.parameters =
        parameters == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(parameters));
    this.properties = properties == null ? SyncMapProperties.defaults() : properties;
  }

  public SyncMapFormat getVariant() {
    return variant;
  }

  public Map<String, String> getParameters() {
    return parameters;
  }

  public SyncMapProperties getProperties() {
    return properties;
  }

  /** Name of the codec for logging and debugging. */
  public String getCodecName() {
    return getClass().getSimpleName() + "[" + variant + "]";
  }

  /**
   * Get a parameter this codec cannot work without.
   *
   * @throws SyncMapMissingParameterException if the parameter is absent or blank
   */
  protected String requireParameter(String key) {
    String value = parameters.get(key);
    if (value == null || value.isBlank()) {
      throw new SyncMapMissingParameterException(
          key,
          String.format(
              "Format '%s' requires parameter '%s', but it was not provided", variant, key));
    }
    return value;
  }

  /** Identifier for the fragment at the given zero-based position, e.g. {@code f000001}. */
  protected String generatedIdentifier(int index) {
    return String.format(Locale.ROOT, "%s%06d", properties.fragmentIdPrefix(), index + 1);
  }

  protected SyncMapFragment newFragment(
      String identifier, List<String> lines, double begin, double end) {
    return new SyncMapFragment(new TextFragment(identifier, null, lines), begin, end);
  }
}
