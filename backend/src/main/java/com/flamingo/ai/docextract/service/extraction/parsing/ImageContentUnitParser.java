package com.flamingo.ai.docextract.service.extraction.parsing;

import com.flamingo.ai.docextract.exception.DocumentExtractionException;
import com.flamingo.ai.docextract.service.extraction.model.ContentUnit;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/** Wraps a standalone image file in a single image unit. */
@Service
@Order(3)
@Slf4j
public class ImageContentUnitParser implements ContentUnitParser {

  static final String UNIT_ID = "image_1";

  @Override
  public List<ContentUnit> parse(InputStream inputStream, String mimeType) {
    byte[] bytes;
    try {
      bytes = inputStream.readAllBytes();
    } catch (IOException e) {
      log.error("Reading image failed: {}", e.getMessage());
      throw new DocumentExtractionException(mimeType, "Failed to read image: " + e.getMessage(), e);
    }
    if (bytes.length == 0) {
      throw new DocumentExtractionException(mimeType, "Image is empty", "The image file is empty");
    }
    return List.of(ContentUnit.image(UNIT_ID, 0, bytes));
  }

  @Override
  public boolean supports(String mimeType) {
    return mimeType != null && mimeType.toLowerCase().startsWith("image/");
  }
}
