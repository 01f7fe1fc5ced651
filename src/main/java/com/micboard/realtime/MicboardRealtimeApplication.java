package com.micboard.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MicboardRealtimeApplication {

  public static void main(String[] args) {
    SpringApplication.run(MicboardRealtimeApplication.class, args);
  }
}
