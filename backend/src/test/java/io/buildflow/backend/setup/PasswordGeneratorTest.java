package io.buildflow.backend.setup;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PasswordGeneratorTest {

  private final PasswordGenerator generator = new PasswordGenerator();

  @Test
  void generate_usesFixedLengthAndUnambiguousAlphabet() {
    String password = generator.generate();

    assertThat(password).hasSize(PasswordGenerator.LENGTH);
    assertThat(password.chars()).allMatch(c -> PasswordGenerator.ALPHABET.indexOf(c) >= 0);
    assertThat(PasswordGenerator.ALPHABET).doesNotContain("0", "O", "1", "l", "I");
  }

  @Test
  void generate_producesDistinctPasswords() {
    Set<String> passwords = new HashSet<>();
    for (int i = 0; i < 200; i++) {
      passwords.add(generator.generate());
    }

    assertThat(passwords).hasSize(200);
  }
}
