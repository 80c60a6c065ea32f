package com.flamingo.ai.docextract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the document text extraction backend. */
@SpringBootApplication
public class DocumentExtractionApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocumentExtractionApplication.class, args);
  }
}
