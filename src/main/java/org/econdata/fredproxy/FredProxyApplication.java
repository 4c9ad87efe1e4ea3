package org.econdata.fredproxy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FredProxyApplication {

  public static void main(String[] args) {
    SpringApplication.run(FredProxyApplication.class, args);
  }
}
