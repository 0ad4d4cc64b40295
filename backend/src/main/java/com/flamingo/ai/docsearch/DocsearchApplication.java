package com.flamingo.ai.docsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Entry point for the document retrieval service. */
@SpringBootApplication
@EnableScheduling
public class DocsearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocsearchApplication.class, args);
  }
}
