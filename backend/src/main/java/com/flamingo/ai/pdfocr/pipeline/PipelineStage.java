package com.flamingo.ai.pdfocr.pipeline;

/** Ordered steps a job goes through. */
public enum PipelineStage {
  RASTERIZE("Rasterization"),
  INFERENCE("Inference"),
  ASSEMBLE("Output assembly"),
  PUBLISH("Publishing");

  private final String displayName;

  PipelineStage(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
