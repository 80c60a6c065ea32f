package com.flamingo.ai.docextract.service.extraction.parsing;

import com.flamingo.ai.docextract.exception.DocumentExtractionException;
import com.flamingo.ai.docextract.service.extraction.model.ContentUnit;
import java.io.InputStream;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Dispatches a document to the first parser, in {@code @Order}, that supports its MIME type. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentUnitParserRouter {

  private final List<ContentUnitParser> parsers;

  public List<ContentUnit> parse(InputStream inputStream, String mimeType) {
    ContentUnitParser parser =
        parsers.stream()
            .filter(p -> p.supports(mimeType))
            .findFirst()
            .orElseThrow(
                () ->
                    new DocumentExtractionException(
                        mimeType,
                        "No parser for MIME type " + mimeType,
                        "Unsupported file type: " + mimeType));
    log.debug("Parsing {} with {}", mimeType, parser.getClass().getSimpleName());
    List<ContentUnit> units = parser.parse(inputStream, mimeType);
    log.info("Parsed {} document into {} units", mimeType, units.size());
    return units;
  }
}
