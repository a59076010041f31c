package com.sundayedge.live;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SundayEdgeApplication {
  public static void main(String[] args) {
    SpringApplication.run(SundayEdgeApplication.class, args);
  }
}
