package io.buildflow.backend.provisioning;

import java.util.Arrays;
import java.util.List;

/**
 * Splits a free-text address into parts. Understands {@code Street, City, State ZIP, Country} and
 * {@code Street, City, State, Country}; extra leading segments stay in the street.
 */
public final class AddressParser {

  private AddressParser() {}

  public static PostalAddress parse(String address) {
    if (address == null || address.isBlank()) {
      return PostalAddress.empty();
    }
    List<String> parts =
        Arrays.stream(address.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();

    return switch (parts.size()) {
      case 0 -> PostalAddress.empty();
      case 1 -> new PostalAddress(parts.get(0), null, null, null, null);
      case 2 -> new PostalAddress(parts.get(0), parts.get(1), null, null, null);
      case 3 -> withStateAndZip(parts.get(0), parts.get(1), parts.get(2), null);
      default ->
          withStateAndZip(
              String.join(", ", parts.subList(0, parts.size() - 3)),
              parts.get(parts.size() - 3),
              parts.get(parts.size() - 2),
              parts.get(parts.size() - 1));
    };
  }

  private static PostalAddress withStateAndZip(
      String street, String city, String stateSegment, String country) {
    String[] tokens = stateSegment.split("\\s+");
    String last = tokens[tokens.length - 1];
    if (tokens.length > 1 && last.chars().anyMatch(Character::isDigit)) {
      String state = String.join(" ", Arrays.copyOf(tokens, tokens.length - 1));
      return new PostalAddress(street, city, state, last, country);
    }
    if (tokens.length == 1 && last.chars().allMatch(Character::isDigit)) {
      return new PostalAddress(street, city, null, last, country);
    }
    return new PostalAddress(street, city, stateSegment, null, country);
  }
}
