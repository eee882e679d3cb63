package com.cactisynth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CactiSynthApplication {

  public static void main(String[] args) {
    SpringApplication.run(CactiSynthApplication.class, args);
  }
}
