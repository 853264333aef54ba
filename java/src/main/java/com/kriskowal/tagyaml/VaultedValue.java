package com.kriskowal.tagyaml;

import java.util.Objects;

/** Tag identifying a value that was loaded from vault ciphertext. */
public final class VaultedValue implements DataTag {

  private final String ciphertext;

  public VaultedValue(String ciphertext) {
    this.ciphertext = Objects.requireNonNull(ciphertext, "ciphertext");
  }

  public String getCiphertext() {
    return ciphertext;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof VaultedValue && ciphertext.equals(((VaultedValue) o).ciphertext);
  }

  @Override
  public int hashCode() {
    return ciphertext.hashCode();
  }

  @Override
  public String toString() {
    return "VaultedValue";
  }
}
