package com.executionengine.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExecutionWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(ExecutionWorkerApplication.class, args);
  }
}
