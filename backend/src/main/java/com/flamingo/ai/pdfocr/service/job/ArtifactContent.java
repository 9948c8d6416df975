package com.flamingo.ai.pdfocr.service.job;

/**
 * A published artifact ready to be served.
 *
 * @param fileName name the client should save the content under
 */
public record ArtifactContent(byte[] bytes, String mediaType, String fileName) {}
