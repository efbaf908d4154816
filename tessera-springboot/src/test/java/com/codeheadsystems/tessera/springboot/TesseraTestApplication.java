package com.codeheadsystems.tessera.springboot;

import com.codeheadsystems.tessera.auth.SessionAuthenticator;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * The type Tessera test application.
 */
@SpringBootApplication
public class TesseraTestApplication {

  static final Map<Long, TestUser> USERS = Map.of(
      1L, new TestUser(1L, "alice"),
      2L, new TestUser(2L, "bob"));

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(TesseraTestApplication.class, args);
  }

  @Bean
  public SessionAuthenticator<TestUser, Long> sessionAuthenticator() {
    return new SessionAuthenticator<TestUser, Long>(id -> Optional.ofNullable(USERS.get(id)), Long.class);
  }
}
