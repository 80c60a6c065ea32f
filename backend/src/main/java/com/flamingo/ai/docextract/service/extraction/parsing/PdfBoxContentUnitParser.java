package com.flamingo.ai.docextract.service.extraction.parsing;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.exception.DocumentExtractionException;
import com.flamingo.ai.docextract.service.extraction.model.ContentUnit;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.OperatorProcessor;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * {@link ContentUnitParser} for PDF documents, backed by Apache PDFBox 3.x.
 *
 * <p>Each page becomes one unit ({@code page_<n>}) carrying the page's text layer, the images
 * drawn on it (re-encoded as PNG, in drawing order) and its geometry: {@code pageNumber},
 * {@code width}, {@code height} and {@code rotation}.
 */
@Service
@Order(1)
@Slf4j
public class PdfBoxContentUnitParser implements ContentUnitParser {

  private final long maxImageBytes;

  public PdfBoxContentUnitParser(ExtractionConfig extractionConfig) {
    this.maxImageBytes = extractionConfig.getParsing().getMaxImageBytes();
  }

  @Override
  public List<ContentUnit> parse(InputStream inputStream, String mimeType) {
    try {
      byte[] bytes = inputStream.readAllBytes();
      try (PDDocument pdfDoc = Loader.loadPDF(bytes)) {
        return toUnits(pdfDoc);
      }
    } catch (IOException e) {
      log.error("PDFBox parsing failed: {}", e.getMessage());
      throw new DocumentExtractionException(mimeType, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return "application/pdf".equalsIgnoreCase(mimeType);
  }

  private List<ContentUnit> toUnits(PDDocument pdfDoc) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setSortByPosition(true);

    List<ContentUnit> units = new ArrayList<>();
    int pageIndex = 0;
    for (PDPage page : pdfDoc.getPages()) {
      stripper.setStartPage(pageIndex + 1);
      stripper.setEndPage(pageIndex + 1);
      String text = stripper.getText(pdfDoc);
      List<byte[]> images = extractImages(page, pageIndex);
      units.add(ContentUnit.page(pageIndex, text, images, geometry(page, pageIndex)));
      pageIndex++;
    }
    log.debug("PDF split into {} page units", units.size());
    return units;
  }

  private List<byte[]> extractImages(PDPage page, int pageIndex) {
    ImageCollector collector = new ImageCollector(pageIndex);
    try {
      collector.processPage(page);
    } catch (IOException e) {
      log.warn("Could not process page {} for image extraction: {}", pageIndex + 1, e.getMessage());
    }
    return collector.images;
  }

  private static Map<String, Object> geometry(PDPage page, int pageIndex) {
    PDRectangle box = page.getMediaBox();
    return Map.of(
        "pageNumber", pageIndex + 1,
        "width", box.getWidth(),
        "height", box.getHeight(),
        "rotation", page.getRotation());
  }

  private byte[] toPng(PDImageXObject imageXObject, int pageIndex) {
    try {
      BufferedImage bufferedImage = imageXObject.getImage();
      if (bufferedImage == null) {
        return null;
      }
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      ImageIO.write(bufferedImage, "png", baos);
      byte[] data = baos.toByteArray();
      if (data.length > maxImageBytes) {
        log.warn("Skipping oversized image on page {} ({} bytes)", pageIndex + 1, data.length);
        return null;
      }
      return data;
    } catch (IOException e) {
      log.warn("Could not extract image on page {}: {}", pageIndex + 1, e.getMessage());
      return null;
    }
  }

  /** Collects images as the page content stream draws them, descending into form XObjects. */
  private final class ImageCollector extends PDFStreamEngine {

    private final List<byte[]> images = new ArrayList<>();
    private final int pageIndex;

    ImageCollector(int pageIndex) {
      this.pageIndex = pageIndex;
      addOperator(new DrawObject(this));
    }

    private final class DrawObject extends OperatorProcessor {

      DrawObject(PDFStreamEngine context) {
        super(context);
      }

      @Override
      public void process(Operator operator, List<COSBase> operands) throws IOException {
        if (operands.isEmpty() || !(operands.get(0) instanceof COSName objectName)) {
          return;
        }
        PDXObject xObject = getResources().getXObject(objectName);
        if (xObject instanceof PDImageXObject imageXObject) {
          byte[] png = toPng(imageXObject, pageIndex);
          if (png != null) {
            images.add(png);
          }
        } else if (xObject instanceof PDFormXObject form) {
          showForm(form);
        }
      }

      @Override
      public String getName() {
        return OperatorName.DRAW_OBJECT;
      }
    }
  }
}
