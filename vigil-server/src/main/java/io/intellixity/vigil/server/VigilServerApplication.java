package io.intellixity.vigil.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VigilServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(VigilServerApplication.class, args);
  }
}
