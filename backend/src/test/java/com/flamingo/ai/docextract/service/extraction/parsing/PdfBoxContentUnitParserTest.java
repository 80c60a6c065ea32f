package com.flamingo.ai.docextract.service.extraction.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.exception.DocumentExtractionException;
import com.flamingo.ai.docextract.service.extraction.model.ContentUnit;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import javax.imageio.ImageIO;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PdfBoxContentUnitParser Tests")
class PdfBoxContentUnitParserTest {

  private ExtractionConfig config;
  private PdfBoxContentUnitParser parser;

  @BeforeEach
  void setUp() {
    config = new ExtractionConfig();
    parser = new PdfBoxContentUnitParser(config);
  }

  @Test
  @DisplayName("Should produce one unit per page with text, images and geometry")
  void shouldProduceOneUnitPerPage() throws IOException {
    byte[] pdf = textAndImagePdf();

    List<ContentUnit> units = parser.parse(new ByteArrayInputStream(pdf), "application/pdf");

    assertThat(units).hasSize(2);

    ContentUnit first = units.get(0);
    assertThat(first.id()).isEqualTo("page_1");
    assertThat(first.position()).isZero();
    assertThat(first.nativeText()).contains("Invoice 4521 total 230.00");
    assertThat(first.images()).isEmpty();
    assertThat(first.geometry())
        .containsEntry("pageNumber", 1)
        .containsEntry("rotation", 0)
        .containsKeys("width", "height");

    ContentUnit second = units.get(1);
    assertThat(second.id()).isEqualTo("page_2");
    assertThat(second.nativeText()).isBlank();
    assertThat(second.images()).hasSize(1);
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(second.images().get(0)));
    assertThat(image.getWidth()).isEqualTo(40);
    assertThat(image.getHeight()).isEqualTo(20);
  }

  @Test
  @DisplayName("Should skip images above the configured size limit")
  void shouldSkipOversizedImages() throws IOException {
    config.getParsing().setMaxImageBytes(10);
    PdfBoxContentUnitParser strict = new PdfBoxContentUnitParser(config);

    List<ContentUnit> units =
        strict.parse(new ByteArrayInputStream(textAndImagePdf()), "application/pdf");

    assertThat(units.get(1).images()).isEmpty();
  }

  @Test
  @DisplayName("Should raise an extraction exception for corrupt input")
  void shouldRaiseForCorruptInput() {
    ByteArrayInputStream corrupt = new ByteArrayInputStream("not a pdf".getBytes());

    assertThatThrownBy(() -> parser.parse(corrupt, "application/pdf"))
        .isInstanceOf(DocumentExtractionException.class)
        .hasMessageStartingWith("Failed to parse PDF");
  }

  @Test
  @DisplayName("Should support only PDF")
  void shouldSupportOnlyPdf() {
    assertThat(parser.supports("application/pdf")).isTrue();
    assertThat(parser.supports("APPLICATION/PDF")).isTrue();
    assertThat(parser.supports("image/png")).isFalse();
    assertThat(parser.supports(null)).isFalse();
  }

  private static byte[] textAndImagePdf() throws IOException {
    try (PDDocument doc = new PDDocument()) {
      PDPage textPage = new PDPage(PDRectangle.A4);
      doc.addPage(textPage);
      try (PDPageContentStream content = new PDPageContentStream(doc, textPage)) {
        content.beginText();
        content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
        content.newLineAtOffset(50, 700);
        content.showText("Invoice 4521 total 230.00");
        content.endText();
      }

      PDPage imagePage = new PDPage(PDRectangle.A4);
      doc.addPage(imagePage);
      BufferedImage scan = new BufferedImage(40, 20, BufferedImage.TYPE_INT_RGB);
      PDImageXObject xObject = LosslessFactory.createFromImage(doc, scan);
      try (PDPageContentStream content = new PDPageContentStream(doc, imagePage)) {
        content.drawImage(xObject, 50, 500);
      }

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      doc.save(out);
      return out.toByteArray();
    }
  }
}
