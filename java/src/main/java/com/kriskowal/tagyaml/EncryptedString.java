package com.kriskowal.tagyaml;

import java.util.Objects;

/**
 * Vault ciphertext read from a {@code !vault} node. Decryption happens elsewhere; this type only
 * keeps the ciphertext text.
 */
public final class EncryptedString {

  private final String ciphertext;

  public EncryptedString(String ciphertext) {
    this.ciphertext = Objects.requireNonNull(ciphertext, "ciphertext");
  }

  public String getCiphertext() {
    return ciphertext;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EncryptedString && ciphertext.equals(((EncryptedString) o).ciphertext);
  }

  @Override
  public int hashCode() {
    return ciphertext.hashCode();
  }

  // never render the ciphertext
  @Override
  public String toString() {
    return "EncryptedString(<" + ciphertext.length() + " chars>)";
  }
}
