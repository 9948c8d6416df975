package com.flamingo.ai.pdfocr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the PDF OCR job service. */
@SpringBootApplication
public class PdfOcrApplication {

  public static void main(String[] args) {
    SpringApplication.run(PdfOcrApplication.class, args);
  }
}
