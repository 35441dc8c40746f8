package com.mk.fx.qa.load.reporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoadReporterApplication {

  public static void main(String[] args) {
    SpringApplication.run(LoadReporterApplication.class, args);
  }
}
