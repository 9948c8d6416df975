package com.flamingo.ai.pdfocr.artifact;

import java.awt.image.BufferedImage;
import java.net.URI;
import java.util.List;
import java.util.Set;

/**
 * Per-job namespace holding the input document, page renders, partial page results and the
 * published outputs.
 *
 * <p>Outputs are all-or-nothing: until {@link #writeOutputs} returns, readers see no output at
 * all.
 */
public interface ArtifactStore {

  /**
   * Creates an empty namespace for a job.
   *
   * @return location of the namespace
   * @throws com.flamingo.ai.pdfocr.exception.ArtifactAlreadyExistsException if it already exists
   */
  URI allocate(String jobId);

  /** Stores the submitted document. Write-once. */
  void writeInput(String jobId, byte[] document);

  byte[] readInput(String jobId);

  /** Stores the rasterized pages in page order. */
  void writePageImages(String jobId, List<BufferedImage> pages);

  /** Stores the recognizer output of one page as soon as it is available. */
  void writePageResult(String jobId, int pageIndex, String text);

  /** Publishes the complete output set atomically. Write-once. */
  void writeOutputs(String jobId, OcrOutputs outputs);

  boolean hasOutputs(String jobId);

  /**
   * Reads one published output file.
   *
   * @throws com.flamingo.ai.pdfocr.exception.ArtifactNotFoundException if the namespace or the
   *     output is missing, or {@code kind} is a collection
   */
  byte[] readOutput(String jobId, ArtifactKind kind);

  /** Names of the published images, sorted. */
  Set<String> listImages(String jobId);

  byte[] readImage(String jobId, String imageName);

  /** Deletes the whole namespace. Idempotent. */
  void remove(String jobId);

  /** Ids of all namespaces currently present. */
  Set<String> listNamespaces();
}
