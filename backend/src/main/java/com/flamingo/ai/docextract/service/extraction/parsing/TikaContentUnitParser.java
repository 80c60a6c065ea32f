package com.flamingo.ai.docextract.service.extraction.parsing;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.exception.DocumentExtractionException;
import com.flamingo.ai.docextract.service.extraction.model.ContentUnit;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.extractor.EmbeddedDocumentExtractor;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.mime.MediaType;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;

/**
 * {@link ContentUnitParser} for Office documents (DOC, DOCX, PPTX, XLSX, ODF, RTF, …).
 *
 * <p>Uses Apache Tika's {@link AutoDetectParser}. Unit 0 ({@code body}) holds the body text; every
 * embedded image becomes its own image unit ({@code img_<n>}) in the order Tika reports it.
 * Embedded non-image attachments are ignored.
 */
@Service
@Order(2)
@Slf4j
public class TikaContentUnitParser implements ContentUnitParser {

  static final String BODY_UNIT_ID = "body";

  private static final Set<String> SUPPORTED_MIME_PREFIXES =
      Set.of(
          "application/vnd.openxmlformats",
          "application/vnd.ms-",
          "application/msword",
          "application/vnd.oasis",
          "application/rtf");

  private final long maxImageBytes;

  public TikaContentUnitParser(ExtractionConfig extractionConfig) {
    this.maxImageBytes = extractionConfig.getParsing().getMaxImageBytes();
  }

  @Override
  public List<ContentUnit> parse(InputStream inputStream, String mimeType) {
    AutoDetectParser tikaParser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    if (mimeType != null) {
      metadata.set(Metadata.CONTENT_TYPE, mimeType);
    }
    EmbeddedImageCollector collector = new EmbeddedImageCollector(tikaParser);
    ParseContext context = new ParseContext();
    context.set(EmbeddedDocumentExtractor.class, collector);

    try {
      tikaParser.parse(inputStream, handler, metadata, context);
    } catch (IOException | SAXException | TikaException e) {
      log.error("TikaContentUnitParser failed for mimeType={}: {}", mimeType, e.getMessage());
      throw new DocumentExtractionException(
          mimeType, "Failed to parse document: " + e.getMessage(), e);
    }

    List<ContentUnit> units = new ArrayList<>();
    units.add(new ContentUnit(BODY_UNIT_ID, 0, handler.toString(), List.of(), Map.of()));
    for (byte[] image : collector.images) {
      int position = units.size();
      units.add(ContentUnit.image("img_" + position, position, image));
    }
    log.debug("Tika produced body text and {} embedded images", collector.images.size());
    return units;
  }

  @Override
  public boolean supports(String mimeType) {
    if (mimeType == null) {
      return false;
    }
    String lower = mimeType.toLowerCase();
    return SUPPORTED_MIME_PREFIXES.stream().anyMatch(lower::startsWith);
  }

  /** Keeps the bytes of embedded images instead of parsing them. */
  private final class EmbeddedImageCollector implements EmbeddedDocumentExtractor {

    private final AutoDetectParser detectorSource;
    private final List<byte[]> images = new ArrayList<>();

    EmbeddedImageCollector(AutoDetectParser detectorSource) {
      this.detectorSource = detectorSource;
    }

    @Override
    public boolean shouldParseEmbedded(Metadata metadata) {
      return true;
    }

    @Override
    public void parseEmbedded(
        InputStream stream, ContentHandler handler, Metadata metadata, boolean outputHtml)
        throws IOException {
      byte[] bytes = stream.readAllBytes();
      if (bytes.length == 0) {
        return;
      }
      MediaType type;
      try (TikaInputStream tis = TikaInputStream.get(bytes)) {
        type = detectorSource.getDetector().detect(tis, metadata);
      }
      if (!"image".equals(type.getType())) {
        log.debug("Ignoring embedded {} resource", type);
        return;
      }
      if (bytes.length > maxImageBytes) {
        log.warn("Skipping oversized embedded image ({} bytes)", bytes.length);
        return;
      }
      images.add(bytes);
    }
  }
}
