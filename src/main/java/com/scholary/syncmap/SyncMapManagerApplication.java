package com.scholary.syncmap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SyncMapManagerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SyncMapManagerApplication.class, args);
  }
}
