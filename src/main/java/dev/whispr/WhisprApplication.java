package dev.whispr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Whispr retrieval and ranking service.
 *
 * <p>Serves the personalized review feed and multi-entity search over the read side of the review
 * platform. Accounts, moderation and all writes belong to the CRUD application sharing the same
 * PostgreSQL database.
 */
@SpringBootApplication
public class WhisprApplication {
  public static void main(String[] args) {
    SpringApplication.run(WhisprApplication.class, args);
  }
}
