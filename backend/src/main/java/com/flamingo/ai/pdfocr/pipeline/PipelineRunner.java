package com.flamingo.ai.pdfocr.pipeline;

import com.flamingo.ai.pdfocr.artifact.ArtifactStore;
import com.flamingo.ai.pdfocr.artifact.OcrOutputs;
import com.flamingo.ai.pdfocr.config.OcrConfig;
import com.flamingo.ai.pdfocr.domain.entity.JobUpdate;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.exception.IllegalJobTransitionException;
import com.flamingo.ai.pdfocr.exception.JobNotFoundException;
import com.flamingo.ai.pdfocr.exception.StageFailureException;
import com.flamingo.ai.pdfocr.store.TaskStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one job through rasterization, page inference, output assembly and publishing.
 *
 * <p>Every failure is contained here: the job ends {@code FAILED} with a readable message and the
 * exception never reaches the worker thread. A JVM {@link Error} is recorded the same way and then
 * rethrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineRunner {

  private final TaskStore taskStore;
  private final ArtifactStore artifactStore;
  private final PdfRasterizer rasterizer;
  private final OcrEngine ocrEngine;
  private final OutputAssembler outputAssembler;
  private final OcrConfig ocrConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "job.pipeline", description = "Time to process one job end to end")
  public void run(String jobId) {
    try {
      taskStore.update(jobId, JobUpdate.status(JobStatus.PROCESSING));
    } catch (JobNotFoundException e) {
      log.warn("Job {} was deleted before processing started", jobId);
      return;
    } catch (IllegalJobTransitionException e) {
      log.warn("Job {} cannot start: {}", jobId, e.getMessage());
      return;
    } catch (RuntimeException e) {
      fail(jobId, e);
      return;
    } catch (Error e) {
      fail(jobId, e);
      throw e;
    }
    log.info("Processing job {}", jobId);

    try {
      List<BufferedImage> pages = rasterize(jobId);
      List<RecognizedPage> recognized = recognize(jobId, pages);
      OcrOutputs outputs =
          inStage(jobId, PipelineStage.ASSEMBLE, () -> outputAssembler.assemble(recognized));
      inStage(
          jobId,
          PipelineStage.PUBLISH,
          () -> {
            artifactStore.writeOutputs(jobId, outputs);
            return null;
          });
      taskStore.update(jobId, JobUpdate.status(JobStatus.COMPLETED));
      meterRegistry.counter("job.completed").increment();
      log.info("Job {} completed: {} pages", jobId, pages.size());
    } catch (Exception e) {
      fail(jobId, e);
    } catch (Error e) {
      fail(jobId, e);
      throw e;
    }
  }

  private List<BufferedImage> rasterize(String jobId) {
    List<BufferedImage> pages =
        inStage(
            jobId,
            PipelineStage.RASTERIZE,
            () -> rasterizer.rasterize(artifactStore.readInput(jobId)));
    if (pages.isEmpty()) {
      throw new StageFailureException(jobId, PipelineStage.RASTERIZE, "document has no pages");
    }
    taskStore.update(jobId, JobUpdate.totalPages(pages.size()));
    inStage(
        jobId,
        PipelineStage.RASTERIZE,
        () -> {
          artifactStore.writePageImages(jobId, pages);
          return null;
        });
    log.info("Job {} rasterized into {} pages", jobId, pages.size());
    return pages;
  }

  private List<RecognizedPage> recognize(String jobId, List<BufferedImage> pages) {
    boolean skipIncomplete = ocrConfig.getInference().isSkipIncompletePages();
    List<RecognizedPage> recognized = new ArrayList<>(pages.size());
    for (int i = 0; i < pages.size(); i++) {
      int pageIndex = i;
      BufferedImage page = pages.get(i);
      OcrPageResult result =
          inStage(
              jobId,
              PipelineStage.INFERENCE,
              () -> {
                try {
                  return ocrEngine.infer(page);
                } catch (RuntimeException e) {
                  throw new StageFailureException(
                      jobId,
                      PipelineStage.INFERENCE,
                      "page " + (pageIndex + 1) + " of " + pages.size() + ": " + describe(e),
                      e);
                }
              });
      inStage(
          jobId,
          PipelineStage.INFERENCE,
          () -> {
            artifactStore.writePageResult(jobId, pageIndex, result.text());
            return null;
          });

      boolean included = result.complete() || !skipIncomplete;
      if (!included) {
        log.warn("Job {} page {} was not fully recognized, leaving it out", jobId, pageIndex + 1);
      }
      recognized.add(new RecognizedPage(pageIndex, page, result, included));
      taskStore.update(jobId, JobUpdate.processedPages(pageIndex + 1));
      meterRegistry.counter("job.pages.processed").increment();
      log.debug("Job {} page {}/{} done", jobId, pageIndex + 1, pages.size());
    }
    return recognized;
  }

  private void fail(String jobId, Throwable cause) {
    if (cause instanceof JobNotFoundException) {
      log.warn("Job {} was deleted while processing, stopping", jobId);
      return;
    }
    String message;
    String stage;
    if (cause instanceof StageFailureException stageFailure) {
      message = stageFailure.getUserMessage();
      stage = stageFailure.getStage().name();
    } else {
      message = "Processing failed: " + describe(cause);
      stage = "UNKNOWN";
    }
    log.error("Job {} failed: {}", jobId, message, cause);
    meterRegistry.counter("job.failed", "stage", stage).increment();
    try {
      taskStore.update(jobId, JobUpdate.failed(message));
    } catch (JobNotFoundException e) {
      log.warn("Job {} was deleted before its failure could be recorded", jobId);
    } catch (RuntimeException e) {
      log.error("Could not mark job {} as failed", jobId, e);
    }
  }

  // Wraps stage work so any error carries the stage it came from.
  private static <T> T inStage(String jobId, PipelineStage stage, Callable<T> work) {
    try {
      return work.call();
    } catch (StageFailureException | JobNotFoundException e) {
      throw e;
    } catch (Exception e) {
      throw new StageFailureException(jobId, stage, describe(e), e);
    }
  }

  static String describe(Throwable e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }
}
