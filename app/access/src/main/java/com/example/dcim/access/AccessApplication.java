package com.example.dcim.access;

import com.example.dcim.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@Import(TimeConfig.class)
@EnableScheduling
public class AccessApplication {

  public static void main(String[] args) {
    SpringApplication.run(AccessApplication.class, args);
  }
}
