package com.scholary.videogen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VideoGenApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoGenApplication.class, args);
  }
}
