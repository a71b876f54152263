package io.buildflow.backend.setup;

import java.security.SecureRandom;
import org.springframework.stereotype.Component;

/** Temporary first-login passwords, without look-alike characters. */
@Component
public class PasswordGenerator {

  static final String ALPHABET =
      "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghjkmnpqrstuvwxyz23456789!@#$%^&*";
  static final int LENGTH = 14;

  private final SecureRandom random = new SecureRandom();

  public String generate() {
    var password = new StringBuilder(LENGTH);
    for (int i = 0; i < LENGTH; i++) {
      password.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return password.toString();
  }
}
