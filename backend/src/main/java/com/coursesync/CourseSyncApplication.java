package com.coursesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CourseSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(CourseSyncApplication.class, args);
  }
}
