package com.flamingo.ai.pdfocr.artifact;

import com.flamingo.ai.pdfocr.exception.ArtifactNotFoundException;

/** Named outputs a completed job publishes. */
public enum ArtifactKind {
  /** Markdown with image links, grounding tags removed. */
  MARKDOWN("markdown", "output.mmd", "text/markdown"),

  /** Raw recognizer output including grounding tags. */
  MARKDOWN_DET("markdown_det", "output_det.mmd", "text/markdown"),

  /** Page renders with the detected layout drawn on top. */
  LAYOUT_PDF("layout_pdf", "output_layouts.pdf", "application/pdf"),

  /** Collection of regions cropped from the pages. */
  IMAGES("images", "images", "image/jpeg");

  private final String pathName;
  private final String fileName;
  private final String mediaType;

  ArtifactKind(String pathName, String fileName, String mediaType) {
    this.pathName = pathName;
    this.fileName = fileName;
    this.mediaType = mediaType;
  }

  public String getPathName() {
    return pathName;
  }

  public String getFileName() {
    return fileName;
  }

  public String getMediaType() {
    return mediaType;
  }

  public boolean isCollection() {
    return this == IMAGES;
  }

  /**
   * Resolves the kind named in a result URL.
   *
   * @throws ArtifactNotFoundException if no kind has that name
   */
  public static ArtifactKind fromPathName(String jobId, String pathName) {
    for (ArtifactKind kind : values()) {
      if (kind.pathName.equals(pathName)) {
        return kind;
      }
    }
    throw new ArtifactNotFoundException(jobId, pathName);
  }
}
