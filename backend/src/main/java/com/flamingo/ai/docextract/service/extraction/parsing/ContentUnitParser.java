package com.flamingo.ai.docextract.service.extraction.parsing;

import com.flamingo.ai.docextract.service.extraction.model.ContentUnit;
import java.io.InputStream;
import java.util.List;

/**
 * Turns a raw document byte-stream into the ordered {@link ContentUnit}s the extraction pipeline
 * works on.
 *
 * <p>Implementations are format-specific and stateless, so one instance can be shared across
 * concurrent extractions.
 */
public interface ContentUnitParser {

  /**
   * Parses the given document stream.
   *
   * <p>The caller retains ownership of {@code inputStream}; implementations must not close it.
   *
   * @param inputStream raw document bytes
   * @param mimeType MIME type of the document (e.g. {@code application/pdf})
   * @return units in document order, positions starting at 0
   */
  List<ContentUnit> parse(InputStream inputStream, String mimeType);

  /**
   * Returns {@code true} if this parser can handle the given MIME type.
   *
   * @param mimeType document MIME type
   * @return {@code true} if supported
   */
  boolean supports(String mimeType);
}
