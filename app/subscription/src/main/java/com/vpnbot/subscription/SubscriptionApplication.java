package com.vpnbot.subscription;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SubscriptionApplication {

  public static void main(String[] args) {
    SpringApplication.run(SubscriptionApplication.class, args);
  }
}
