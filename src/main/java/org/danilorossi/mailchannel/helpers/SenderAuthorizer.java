package org.danilorossi.mailchannel.helpers;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.NonNull;

/** Allow-list dei mittenti: "*" ammette tutti, altrimenti confronto esatto senza maiuscole. */
public class SenderAuthorizer {

  public static final String WILDCARD = "*";

  private final List<String> allowed;

  public SenderAuthorizer(@NonNull final List<String> allowed) {
    this.allowed = allowed.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
  }

  public boolean isAllowed(final String sender) {
    if (allowed.contains(WILDCARD)) return true;
    if (sender == null) return false;
    return allowed.stream().anyMatch(a -> equalsIgnoreAsciiCase(a, sender));
  }

  /** Solo A-Z/a-z: niente case folding Unicode. */
  static boolean equalsIgnoreAsciiCase(final String a, final String b) {
    if (a.length() != b.length()) return false;
    for (int i = 0; i < a.length(); i++) {
      if (toAsciiLower(a.charAt(i)) != toAsciiLower(b.charAt(i))) return false;
    }
    return true;
  }

  private static char toAsciiLower(final char c) {
    return (c >= 'A' && c <= 'Z') ? (char) (c + ('a' - 'A')) : c;
  }
}
