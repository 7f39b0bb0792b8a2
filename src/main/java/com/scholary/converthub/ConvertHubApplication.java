package com.scholary.converthub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ConvertHubApplication {

  public static void main(String[] args) {
    SpringApplication.run(ConvertHubApplication.class, args);
  }
}
