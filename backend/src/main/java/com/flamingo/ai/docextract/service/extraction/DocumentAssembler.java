package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.service.extraction.model.ContentType;
import com.flamingo.ai.docextract.service.extraction.model.ContentUnit;
import com.flamingo.ai.docextract.service.extraction.model.DocumentResult;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionRequest;
import com.flamingo.ai.docextract.service.extraction.model.ProcessingStatistics;
import com.flamingo.ai.docextract.service.extraction.model.UnitResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the unit processor over every unit of a document and assembles the document result.
 *
 * <p>Units are processed in parallel on the unit pool; results are stored by input index, so the
 * output order always matches the input order regardless of completion order. A failing or
 * rejected unit becomes an ERROR result and never affects its siblings.
 */
@Service
@Slf4j
public class DocumentAssembler {

  private final UnitProcessor unitProcessor;
  private final Executor unitProcessingExecutor;

  public DocumentAssembler(
      UnitProcessor unitProcessor,
      @Qualifier("unitProcessingExecutor") Executor unitProcessingExecutor) {
    this.unitProcessor = unitProcessor;
    this.unitProcessingExecutor = unitProcessingExecutor;
  }

  /**
   * Processes all units of one document.
   *
   * @param units the document's units in document order
   * @param request channel choices and adapter options
   * @return one result per unit in input order, the joined full text and statistics
   */
  public DocumentResult assemble(List<ContentUnit> units, ExtractionRequest request) {
    long start = System.currentTimeMillis();
    List<ContentUnit> input = units == null ? List.of() : units;

    List<CompletableFuture<UnitResult>> futures = new ArrayList<>(input.size());
    for (int i = 0; i < input.size(); i++) {
      futures.add(submit(input.get(i), i, request));
    }

    UnitResult[] results = new UnitResult[input.size()];
    for (int i = 0; i < futures.size(); i++) {
      results[i] = await(futures.get(i), input.get(i), i);
    }
    List<UnitResult> ordered = Arrays.asList(results);

    String fullText =
        ordered.stream()
            .map(UnitResult::finalText)
            .collect(Collectors.joining(DocumentResult.UNIT_SEPARATOR));
    ProcessingStatistics statistics =
        ProcessingStatistics.of(ordered, System.currentTimeMillis() - start);
    boolean scanned =
        statistics.count(ContentType.NATIVE_TEXT_ONLY) == 0
            && statistics.count(ContentType.MIXED) == 0;

    if (scanned && !ordered.isEmpty()) {
      log.warn("Document has no text layer on any of its {} units (scanned)", ordered.size());
    }
    log.info(
        "Assembled {} units ({} images) in {} ms: {}",
        statistics.totalUnits(),
        statistics.totalImages(),
        statistics.elapsedMillis(),
        statistics.contentTypeCounts());

    return new DocumentResult(ordered, fullText, statistics, scanned, !scanned);
  }

  private CompletableFuture<UnitResult> submit(
      ContentUnit unit, int index, ExtractionRequest request) {
    if (unit == null) {
      return CompletableFuture.completedFuture(
          UnitResult.error(fallbackId(index), index, 0, "missing content unit"));
    }
    try {
      return CompletableFuture.supplyAsync(
          () -> unitProcessor.process(unit, request), unitProcessingExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("Unit {} rejected by unit pool: {}", unit.id(), e.getMessage());
      return CompletableFuture.completedFuture(
          UnitResult.error(
              unit.id(), unit.position(), unit.imageCount(), "rejected: " + e.getMessage()));
    }
  }

  private static UnitResult await(
      CompletableFuture<UnitResult> future, ContentUnit unit, int index) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      String id = unit != null ? unit.id() : fallbackId(index);
      log.error("Unit task {} failed: {}", id, cause.toString());
      return UnitResult.error(
          id,
          unit != null ? unit.position() : index,
          unit != null ? unit.imageCount() : 0,
          UnitProcessor.errorMessage(cause));
    }
  }

  private static String fallbackId(int index) {
    return "unit_" + (index + 1);
  }
}
