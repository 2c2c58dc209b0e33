package com.flamingo.pdfstructure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the document structure service. */
@SpringBootApplication
public class PdfStructureApplication {

  public static void main(String[] args) {
    SpringApplication.run(PdfStructureApplication.class, args);
  }
}
