package com.mirrorwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MirrorWatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(MirrorWatchApplication.class, args);
  }
}
