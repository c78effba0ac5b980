package com.festivalplatform.webhookservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WebhookServiceApplication {
  public static void main(String[] args) {
    SpringApplication.run(WebhookServiceApplication.class, args);
  }
}
