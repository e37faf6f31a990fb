package com.docgram;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Docgram backend entry point. */
@SpringBootApplication
public class DocgramApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocgramApplication.class, args);
  }
}
