package com.flamingo.ai.docextract.service.extraction.sanitize;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns fused recognition output into user-facing text.
 *
 * <p>Line filters, in order: drop-list patterns (failure markers, "no visible text" boilerplate,
 * internal method tags), blank lines, lines shorter than the minimum length, lines made only of
 * digits/punctuation/symbols, and lines that are a single token repeated. The whole unit is then
 * discarded if one token dominates a long text (degenerate repetition from a vision model), and
 * the remaining lines are de-duplicated in first-seen order. The repetition check runs again on
 * the de-duplicated lines. An empty result means "no usable text".
 *
 * <p>Sanitizing is idempotent.
 */
@Component
@Slf4j
public class TextSanitizer {

  /** Built-in drop list, matched anywhere in a line (case-insensitive). */
  static final List<String> DEFAULT_DROP_PATTERNS =
      List.of(
          // failure markers
          "\\[[^\\]]*(failed|failure|error|exception)[^\\]]*\\]",
          "\\[[^\\]]*(处理失败|识别失败|处理异常|融合决策失败)[^\\]]*\\]",
          "(OCR|Qwen-VL|Vision)\\s*[:：].*(未执行|not executed|not attempted)",
          // internal method tags
          "\\[[^\\]]*(supplement|补充)[^\\]]*\\]",
          "\\[[^\\]]*(识别结果|增强结果)[^\\]]*\\]",
          "\\[(image text|recognition result)\\]",
          // no-visible-text boilerplate
          "图中没有可见文字",
          "图中(所有)?(可见)?文字[:：]",
          "no (visible|readable|legible) text",
          "(does not|doesn't) contain any (visible |readable )?text",
          "^(无|none|n/a)$");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[\\s，。、；：！？]+");
  private static final Pattern DIGITS_AND_PUNCTUATION =
      Pattern.compile("^[\\p{Nd}\\p{P}\\p{S}\\s]+$");

  private final ExtractionConfig.Sanitizer settings;
  private final List<Pattern> dropPatterns;

  public TextSanitizer(ExtractionConfig extractionConfig) {
    this.settings = extractionConfig.getSanitizer();
    List<String> configured = settings.getDropPatterns();
    List<String> sources =
        configured == null || configured.isEmpty() ? DEFAULT_DROP_PATTERNS : configured;
    this.dropPatterns =
        sources.stream()
            .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
            .toList();
  }

  /**
   * Sanitizes raw text.
   *
   * @param text raw fused text, may be null
   * @return sanitized text, empty when nothing meaningful remains
   */
  public String sanitize(String text) {
    if (text == null || text.isBlank()) {
      return "";
    }

    List<String> filtered = new ArrayList<>();
    for (String rawLine : text.split("\\R")) {
      String line = rawLine.strip();
      if (isMeaningful(line)) {
        filtered.add(line);
      }
    }
    if (isDegenerateRepetition(filtered)) {
      log.info("Discarding unit text: one token dominates {} lines", filtered.size());
      return "";
    }

    // a de-duplicated text must pass the same check on its next pass
    List<String> lines = new ArrayList<>(new LinkedHashSet<>(filtered));
    if (isDegenerateRepetition(lines)) {
      log.info("Discarding unit text: one token dominates {} distinct lines", lines.size());
      return "";
    }
    return String.join("\n", lines);
  }

  private boolean isMeaningful(String line) {
    if (line.isEmpty() || matchesDropList(line)) {
      return false;
    }
    if (line.codePointCount(0, line.length()) < settings.getMinLineLength()) {
      return false;
    }
    if (DIGITS_AND_PUNCTUATION.matcher(line).matches()) {
      return false;
    }
    return !isRepeatedSingleToken(line);
  }

  private boolean matchesDropList(String line) {
    return dropPatterns.stream().anyMatch(p -> p.matcher(line).find());
  }

  private boolean isRepeatedSingleToken(String line) {
    String[] tokens = WHITESPACE.split(line);
    return tokens.length > settings.getMaxRepeatedTokenRun()
        && Arrays.stream(tokens).distinct().count() == 1;
  }

  /** True if the unit has enough tokens and a single token exceeds the allowed share. */
  private boolean isDegenerateRepetition(List<String> lines) {
    Map<String, Integer> frequencies = new HashMap<>();
    int total = 0;
    for (String line : lines) {
      for (String token : TOKEN_SEPARATORS.split(line)) {
        if (!token.isEmpty()) {
          frequencies.merge(token, 1, Integer::sum);
          total++;
        }
      }
    }
    if (total <= settings.getRepetitionMinTokens()) {
      return false;
    }
    int top = frequencies.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    return top > total * settings.getRepetitionMaxShare();
  }
}
