package com.scholary.syncmap.syncmap;

/**
 * Keys of the parameter map passed to read, write and fine-tuning export.
 *
 * <p>Keys not listed here are passed through untouched to the codecs.
 */
public final class SyncMapParameters {

  /** Language applied to every fragment after reading. */
  public static final String LANGUAGE = "language";

  /** Output format preselected in the fine-tuning page. */
  public static final String OUTPUT_FORMAT = "output_format";

  /** Value of the {@code src} attribute of SMIL audio elements. */
  public static final String SMIL_AUDIO_REF = "smil_audio_ref";

  /** Value of the {@code src} attribute of SMIL text elements. */
  public static final String SMIL_PAGE_REF = "smil_page_ref";

  private SyncMapParameters() {}
}
