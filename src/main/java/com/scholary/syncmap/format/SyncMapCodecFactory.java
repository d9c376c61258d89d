package com.scholary.syncmap.format;

import com.scholary.syncmap.config.SyncMapProperties;
import java.util.Map;

/**
 * Builds a codec for one format.
 *
 * <p>Implementations check the parameters their format requires and throw {@link
 * com.scholary.syncmap.syncmap.SyncMapMissingParameterException} when one is absent.
 */
@FunctionalInterface
public interface SyncMapCodecFactory {

  SyncMapCodec create(
      SyncMapFormat variant, Map<String, String> parameters, SyncMapProperties properties);
}
