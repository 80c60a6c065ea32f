package com.flamingo.ai.docextract.service.extraction.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One atomic extraction target: a document page or a single embedded image.
 *
 * <p>Produced by a format parser and never modified afterwards. The image payloads are shared
 * read-only between the recognition channels.
 *
 * @param id identifier, unique within the document
 * @param position 0-based ordinal position within the document
 * @param nativeText text already present in the document structure (never null, may be empty)
 * @param images embedded image payloads (never null)
 * @param geometry optional layout metadata, passed through untouched
 */
public record ContentUnit(
    String id, int position, String nativeText, List<byte[]> images, Map<String, Object> geometry) {

  public ContentUnit {
    Objects.requireNonNull(id, "id");
    nativeText = nativeText == null ? "" : nativeText;
    images = images == null ? List.of() : images.stream().filter(Objects::nonNull).toList();
    geometry = geometry == null ? Map.of() : Map.copyOf(geometry);
  }

  /**
   * Creates a page unit.
   *
   * @param pageIndex 0-based page index, also used as position
   * @param nativeText the page's text layer
   * @param images images drawn on the page
   * @param geometry page geometry
   * @return the unit, identified as {@code page_<n>} with n 1-based
   */
  public static ContentUnit page(
      int pageIndex, String nativeText, List<byte[]> images, Map<String, Object> geometry) {
    return new ContentUnit("page_" + (pageIndex + 1), pageIndex, nativeText, images, geometry);
  }

  /** Creates a unit for one standalone or embedded image with no text of its own. */
  public static ContentUnit image(String id, int position, byte[] image) {
    return new ContentUnit(id, position, "", List.of(image), Map.of());
  }

  public int imageCount() {
    return images.size();
  }
}
