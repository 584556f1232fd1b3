package com.aiadvent.canvas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CanvasCompilerApplication {

  public static void main(String[] args) {
    SpringApplication.run(CanvasCompilerApplication.class, args);
  }
}
