package com.scholary.cog.converter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CogConverterApplication {

  public static void main(String[] args) {
    SpringApplication.run(CogConverterApplication.class, args);
  }
}
