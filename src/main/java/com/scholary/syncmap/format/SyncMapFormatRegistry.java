package com.scholary.syncmap.format;

import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.format.codec.DelimitedSyncMapCodec;
import com.scholary.syncmap.format.codec.JsonSyncMapCodec;
import com.scholary.syncmap.format.codec.SmilSyncMapCodec;
import com.scholary.syncmap.format.codec.SubtitleSyncMapCodec;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps each supported format to the factory of its codec.
 *
 * <p>The registry is immutable once built. A format without a factory is treated the same as an
 * unknown format.
 */
public class SyncMapFormatRegistry {

  private final Map<SyncMapFormat, SyncMapCodecFactory> factories;

  public SyncMapFormatRegistry(Map<SyncMapFormat, SyncMapCodecFactory> factories) {
    EnumMap<SyncMapFormat, SyncMapCodecFactory> copy = new EnumMap<>(SyncMapFormat.class);
    copy.putAll(factories);
    this.factories = Collections.unmodifiableMap(copy);
  }

  /** Registry with the built-in codecs for every {@link SyncMapFormat}. */
  public static SyncMapFormatRegistry defaults() {
    Map<SyncMapFormat, SyncMapCodecFactory> factories = new EnumMap<>(SyncMapFormat.class);
    factories.put(SyncMapFormat.CSV, DelimitedSyncMapCodec::new);
    factories.put(SyncMapFormat.JSON, JsonSyncMapCodec::new);
    factories.put(SyncMapFormat.SMIL, SmilSyncMapCodec::new);
    factories.put(SyncMapFormat.SRT, SubtitleSyncMapCodec::new);
    factories.put(SyncMapFormat.SSV, DelimitedSyncMapCodec::new);
    factories.put(SyncMapFormat.TSV, DelimitedSyncMapCodec::new);
    factories.put(SyncMapFormat.TXT, DelimitedSyncMapCodec::new);
    factories.put(SyncMapFormat.VTT, SubtitleSyncMapCodec::new);
    return new SyncMapFormatRegistry(factories);
  }

  public boolean supports(SyncMapFormat format) {
    return format != null && factories.containsKey(format);
  }

  public Set<SyncMapFormat> formats() {
    return factories.keySet();
  }

  /**
   * Build the codec for a format.
   *
   * @throws IllegalArgumentException if the format is null or not registered
   * @throws com.scholary.syncmap.syncmap.SyncMapMissingParameterException if the codec requires
   *     a parameter that is absent
   */
  public SyncMapCodec create(
      SyncMapFormat format, Map<String, String> parameters, SyncMapProperties properties) {
    if (!supports(format)) {
      throw new IllegalArgumentException("Sync map format '" + format + "' is not allowed");
    }
    return factories.get(format).create(format, parameters, properties);
  }
}
