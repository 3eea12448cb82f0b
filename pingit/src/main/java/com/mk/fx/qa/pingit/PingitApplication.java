package com.mk.fx.qa.pingit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PingitApplication {

  public static void main(String[] args) {
    SpringApplication.run(PingitApplication.class, args);
  }
}
