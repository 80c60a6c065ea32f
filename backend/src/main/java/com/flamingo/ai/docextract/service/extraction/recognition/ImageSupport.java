package com.flamingo.ai.docextract.service.extraction.recognition;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/** Image decoding and resizing shared by the recognition adapters. */
final class ImageSupport {

  private ImageSupport() {}

  /**
   * Decodes encoded image bytes.
   *
   * @throws IOException if the bytes are not a readable image
   */
  static BufferedImage decode(byte[] image) throws IOException {
    if (image == null || image.length == 0) {
      throw new IOException("empty image payload");
    }
    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image));
    if (decoded == null) {
      throw new IOException("unsupported or corrupt image format");
    }
    return decoded;
  }

  /** Converts to RGB and shrinks so the longest side is at most {@code maxSide}. */
  static BufferedImage toRgbWithin(BufferedImage source, int maxSide) {
    int width = source.getWidth();
    int height = source.getHeight();
    int longest = Math.max(width, height);
    double ratio = longest > maxSide ? (double) maxSide / longest : 1;
    int targetWidth = Math.max(1, (int) (width * ratio));
    int targetHeight = Math.max(1, (int) (height * ratio));

    if (ratio == 1 && source.getType() == BufferedImage.TYPE_INT_RGB) {
      return source;
    }

    BufferedImage target = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = target.createGraphics();
    try {
      g.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
      g.drawImage(source, 0, 0, targetWidth, targetHeight, null);
    } finally {
      g.dispose();
    }
    return target;
  }

  static byte[] toPng(BufferedImage image) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ImageIO.write(image, "png", out);
    return out.toByteArray();
  }
}
