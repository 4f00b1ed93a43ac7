package com.mirrorsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MirrorSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(MirrorSyncApplication.class, args);
  }
}
