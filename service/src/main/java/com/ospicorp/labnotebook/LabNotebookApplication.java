package com.ospicorp.labnotebook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LabNotebookApplication {

  public static void main(String[] args) {
    SpringApplication.run(LabNotebookApplication.class, args);
  }
}
