package com.flamingo.ai.pdfocr.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pdfocr.artifact.ArtifactKind;
import com.flamingo.ai.pdfocr.artifact.ArtifactStore;
import com.flamingo.ai.pdfocr.artifact.FileSystemArtifactStore;
import com.flamingo.ai.pdfocr.artifact.OcrOutputs;
import com.flamingo.ai.pdfocr.config.OcrConfig;
import com.flamingo.ai.pdfocr.domain.entity.OcrJob;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.exception.ArtifactStorageException;
import com.flamingo.ai.pdfocr.exception.OcrInferenceException;
import com.flamingo.ai.pdfocr.store.InMemoryTaskStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PipelineRunnerTest {

  private static final String JOB_ID = "job-1";

  @TempDir Path tempDir;

  @Mock private PdfRasterizer rasterizer;

  @Mock private OcrEngine ocrEngine;

  @Mock private LayoutRenderer layoutRenderer;

  private InMemoryTaskStore taskStore;
  private ArtifactStore artifactStore;
  private OcrConfig ocrConfig;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() throws Exception {
    ocrConfig = new OcrConfig();
    ocrConfig.getStorage().setBasePath(tempDir.toString());
    taskStore = new InMemoryTaskStore();
    artifactStore = spy(new FileSystemArtifactStore(ocrConfig));
    meterRegistry = new SimpleMeterRegistry();

    when(rasterizer.rasterize(any())).thenReturn(pages(3));
    when(ocrEngine.infer(any())).thenAnswer(invocation -> completePage("text"));
    when(layoutRenderer.renderLayout(any(BufferedImage.class), anyList()))
        .thenAnswer(invocation -> invocation.getArgument(0));

    taskStore.create(JOB_ID, "paper.pdf");
    artifactStore.allocate(JOB_ID);
    artifactStore.writeInput(JOB_ID, "%PDF-1.4".getBytes(StandardCharsets.US_ASCII));
  }

  private PipelineRunner runner() {
    OutputAssembler assembler = new OutputAssembler(layoutRenderer, new LayoutPdfWriter());
    return new PipelineRunner(
        taskStore, artifactStore, rasterizer, ocrEngine, assembler, ocrConfig, meterRegistry);
  }

  private static List<BufferedImage> pages(int count) {
    BufferedImage[] pages = new BufferedImage[count];
    for (int i = 0; i < count; i++) {
      pages[i] = new BufferedImage(60, 80, BufferedImage.TYPE_INT_RGB);
    }
    return List.of(pages);
  }

  private static OcrPageResult completePage(String text) {
    return new OcrPageResult(text, List.of(), true);
  }

  @Test
  @DisplayName("three page document completes with progress 1, 2, 3 and all outputs")
  void shouldCompleteThreePageDocument() {
    AtomicInteger page = new AtomicInteger();
    when(ocrEngine.infer(any()))
        .thenAnswer(invocation -> completePage("page " + page.incrementAndGet()));

    runner().run(JOB_ID);

    OcrJob job = taskStore.get(JOB_ID);
    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.getTotalPages()).isEqualTo(3);
    assertThat(job.getProcessedPages()).isEqualTo(3);

    List<OcrJob> history = taskStore.history(JOB_ID);
    assertThat(history)
        .extracting(OcrJob::getStatus)
        .containsExactly(
            JobStatus.PENDING,
            JobStatus.PROCESSING,
            JobStatus.PROCESSING,
            JobStatus.PROCESSING,
            JobStatus.PROCESSING,
            JobStatus.PROCESSING,
            JobStatus.COMPLETED);
    assertThat(history).extracting(OcrJob::getProcessedPages).containsSubsequence(1, 2, 3);
    assertThat(history.get(2).getTotalPages()).isEqualTo(3);
    assertThat(history.get(2).getProcessedPages()).isZero();

    String markdown =
        new String(artifactStore.readOutput(JOB_ID, ArtifactKind.MARKDOWN), StandardCharsets.UTF_8);
    assertThat(markdown).contains("page 1").contains("page 2").contains("page 3");
    assertThat(artifactStore.readOutput(JOB_ID, ArtifactKind.MARKDOWN_DET)).isNotEmpty();
    assertThat(artifactStore.readOutput(JOB_ID, ArtifactKind.LAYOUT_PDF)).isNotEmpty();
    assertThat(artifactStore.listImages(JOB_ID)).isEmpty();
    assertThat(meterRegistry.counter("job.completed").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("job.pages.processed").count()).isEqualTo(3.0);
  }

  @Test
  @DisplayName("inference error on page 2 fails the job after one processed page")
  void shouldFailWhenSecondPageInferenceFails() {
    when(ocrEngine.infer(any()))
        .thenReturn(completePage("page 1"))
        .thenThrow(new OcrInferenceException("model crashed"));

    runner().run(JOB_ID);

    OcrJob job = taskStore.get(JOB_ID);
    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.getProcessedPages()).isEqualTo(1);
    assertThat(job.getErrorMessage())
        .startsWith("Inference failed")
        .contains("page 2 of 3")
        .contains("model crashed");
    assertThat(artifactStore.hasOutputs(JOB_ID)).isFalse();
    assertThat(meterRegistry.counter("job.failed", "stage", "INFERENCE").count()).isEqualTo(1.0);
  }

  @Test
  void shouldFailWhenRasterizationFails() throws Exception {
    when(rasterizer.rasterize(any())).thenThrow(new IOException("not a PDF"));

    runner().run(JOB_ID);

    OcrJob job = taskStore.get(JOB_ID);
    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.getErrorMessage()).isEqualTo("Rasterization failed: not a PDF");
    assertThat(job.getTotalPages()).isZero();
  }

  @Test
  void shouldFailDocumentWithoutPages() throws Exception {
    when(rasterizer.rasterize(any())).thenReturn(List.of());

    runner().run(JOB_ID);

    assertThat(taskStore.get(JOB_ID).getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(taskStore.get(JOB_ID).getErrorMessage()).contains("no pages");
  }

  @Test
  void shouldFailWhenAssemblyFails() {
    when(layoutRenderer.renderLayout(any(BufferedImage.class), anyList()))
        .thenThrow(new IllegalStateException("renderer broke"));

    runner().run(JOB_ID);

    OcrJob job = taskStore.get(JOB_ID);
    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.getErrorMessage()).isEqualTo("Output assembly failed: renderer broke");
    assertThat(job.getProcessedPages()).isEqualTo(3);
    assertThat(artifactStore.hasOutputs(JOB_ID)).isFalse();
  }

  @Test
  @DisplayName("failure while publishing leaves a failed job and no partial outputs")
  void shouldFailWhenPublishFails() {
    doThrow(new ArtifactStorageException(JOB_ID, "Cannot publish outputs", new IOException()))
        .when(artifactStore)
        .writeOutputs(eq(JOB_ID), any(OcrOutputs.class));

    runner().run(JOB_ID);

    OcrJob job = taskStore.get(JOB_ID);
    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.getErrorMessage()).startsWith("Publishing failed");
    assertThat(artifactStore.hasOutputs(JOB_ID)).isFalse();
  }

  @Test
  @DisplayName("a JVM error during inference still marks the job failed before propagating")
  void shouldRecordFailureWhenEngineThrowsError() {
    when(ocrEngine.infer(any()))
        .thenReturn(completePage("page 1"))
        .thenThrow(new OutOfMemoryError("Java heap space"));

    assertThatThrownBy(() -> runner().run(JOB_ID))
        .isInstanceOf(OutOfMemoryError.class)
        .hasMessage("Java heap space");

    OcrJob job = taskStore.get(JOB_ID);
    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.getErrorMessage()).isEqualTo("Processing failed: Java heap space");
    assertThat(job.getProcessedPages()).isEqualTo(1);
    assertThat(artifactStore.hasOutputs(JOB_ID)).isFalse();
    assertThat(meterRegistry.counter("job.failed", "stage", "UNKNOWN").count()).isEqualTo(1.0);
  }

  @Test
  void shouldFailWhenInputIsMissing() {
    artifactStore.remove(JOB_ID);

    runner().run(JOB_ID);

    assertThat(taskStore.get(JOB_ID).getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(taskStore.get(JOB_ID).getErrorMessage()).startsWith("Rasterization failed");
  }

  @Test
  @DisplayName("incomplete pages are skipped but still count as processed")
  void shouldSkipIncompletePages() throws IOException {
    when(ocrEngine.infer(any()))
        .thenReturn(completePage("first"))
        .thenReturn(new OcrPageResult("trailing garbage", List.of(), false))
        .thenReturn(completePage("third"));

    runner().run(JOB_ID);

    OcrJob job = taskStore.get(JOB_ID);
    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.getProcessedPages()).isEqualTo(3);
    String markdown =
        new String(artifactStore.readOutput(JOB_ID, ArtifactKind.MARKDOWN), StandardCharsets.UTF_8);
    assertThat(markdown).contains("first").contains("third").doesNotContain("trailing garbage");
    try (PDDocument layout =
        Loader.loadPDF(artifactStore.readOutput(JOB_ID, ArtifactKind.LAYOUT_PDF))) {
      assertThat(layout.getNumberOfPages()).isEqualTo(2);
    }
  }

  @Test
  void shouldKeepIncompletePagesWhenSkippingIsOff() {
    ocrConfig.getInference().setSkipIncompletePages(false);
    when(ocrEngine.infer(any())).thenReturn(new OcrPageResult("partial", List.of(), false));

    runner().run(JOB_ID);

    String markdown =
        new String(artifactStore.readOutput(JOB_ID, ArtifactKind.MARKDOWN), StandardCharsets.UTF_8);
    assertThat(markdown).contains("partial");
  }

  @Test
  void shouldStopQuietlyWhenJobIsDeletedMidRun() {
    when(ocrEngine.infer(any()))
        .thenAnswer(
            invocation -> {
              taskStore.delete(JOB_ID);
              artifactStore.remove(JOB_ID);
              return completePage("late");
            });

    runner().run(JOB_ID);

    assertThat(taskStore.exists(JOB_ID)).isFalse();
    assertThat(artifactStore.listNamespaces()).doesNotContain(JOB_ID);
  }

  @Test
  void shouldNotRunJobThatIsNotPending() {
    runner().run(JOB_ID);
    int updates = taskStore.history(JOB_ID).size();

    runner().run(JOB_ID);

    assertThat(taskStore.history(JOB_ID)).hasSize(updates);
    assertThat(taskStore.get(JOB_ID).getStatus()).isEqualTo(JobStatus.COMPLETED);
  }

  @Test
  void progressShouldStayWithinBounds() {
    runner().run(JOB_ID);

    for (OcrJob snapshot : taskStore.history(JOB_ID)) {
      if (snapshot.getTotalPages() > 0) {
        assertThat(snapshot.getProcessedPages()).isBetween(0, snapshot.getTotalPages());
      }
    }
  }
}
