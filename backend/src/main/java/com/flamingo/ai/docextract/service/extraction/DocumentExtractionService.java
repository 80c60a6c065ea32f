package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.service.extraction.model.ContentUnit;
import com.flamingo.ai.docextract.service.extraction.model.DocumentResult;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionRequest;
import com.flamingo.ai.docextract.service.extraction.parsing.ContentUnitParserRouter;
import io.micrometer.core.annotation.Timed;
import java.io.InputStream;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the extraction core: turns a document into text with per-unit provenance.
 *
 * <p>Calls are synchronous for the caller and internally concurrent. Content problems never
 * surface as exceptions from {@code process}; only parsing in {@link #extract} can fail with a
 * {@link com.flamingo.ai.docextract.exception.DocumentExtractionException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentExtractionService {

  private final ContentUnitParserRouter parserRouter;
  private final DocumentAssembler documentAssembler;

  @Timed(value = "extraction.document", description = "Time to extract text from a document")
  public DocumentResult process(List<ContentUnit> document, boolean useOcr, boolean useVision) {
    return process(document, ExtractionRequest.of(useOcr, useVision));
  }

  @Timed(value = "extraction.document", description = "Time to extract text from a document")
  public DocumentResult process(List<ContentUnit> document, ExtractionRequest request) {
    ExtractionRequest effective = request != null ? request : ExtractionRequest.of(true, true);
    log.info(
        "Extracting {} units (ocr={}, vision={})",
        document == null ? 0 : document.size(),
        effective.useOcr(),
        effective.useVision());
    return documentAssembler.assemble(document, effective);
  }

  /**
   * Parses a raw document and extracts its text.
   *
   * @param inputStream document bytes; not closed
   * @param mimeType document MIME type, {@code image/*} for a standalone image
   * @param request channel choices and adapter options
   * @return the document result
   */
  @Timed(value = "extraction.document", description = "Time to extract text from a document")
  public DocumentResult extract(
      InputStream inputStream, String mimeType, ExtractionRequest request) {
    List<ContentUnit> units = parserRouter.parse(inputStream, mimeType);
    return process(units, request);
  }
}
