package com.ospicorp.loadshape;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoadshapeApplication {

  public static void main(String[] args) {
    SpringApplication.run(LoadshapeApplication.class, args);
  }
}
