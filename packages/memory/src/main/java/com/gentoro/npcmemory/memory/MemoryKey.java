package com.gentoro.npcmemory.memory;

import java.util.Locale;
import java.util.Objects;

/**
 * Case-insensitive identity for string keyed memory (world state keys, belief ids, relationship
 * endpoints).
 *
 * <p>Keys are normalized with {@link Locale#ROOT} lower casing, so identity never depends on the
 * host's default locale. Ordering of normalized keys is ordinal.
 */
public final class MemoryKey implements Comparable<MemoryKey> {
  private final String original;
  private final String normalized;

  private MemoryKey(String original) {
    this.original = original;
    this.normalized = normalize(original);
  }

  public static MemoryKey of(String raw) {
    return new MemoryKey(Objects.requireNonNull(raw, "key"));
  }

  public static String normalize(String raw) {
    return raw == null ? "" : raw.toLowerCase(Locale.ROOT);
  }

  /** Case-insensitive equality without allocating keys. */
  public static boolean matches(String a, String b) {
    if (a == null || b == null) return a == b;
    return normalize(a).equals(normalize(b));
  }

  public String original() {
    return original;
  }

  public String normalized() {
    return normalized;
  }

  @Override
  public int compareTo(MemoryKey o) {
    return normalized.compareTo(o.normalized);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MemoryKey that)) return false;
    return normalized.equals(that.normalized);
  }

  @Override
  public int hashCode() {
    return normalized.hashCode();
  }

  @Override
  public String toString() {
    return original;
  }
}
