package com.gentoro.npcmemory.memory;

import java.util.Objects;

/**
 * Immutable world truth defined by designers, e.g. "Dragons breathe fire". Never decays; can only
 * leave the store through explicit removal.
 */
public final class CanonicalFact extends MemoryEntry {
  private final String content;
  private final String domain;

  public CanonicalFact(String id, String content, String domain) {
    this(id, content, domain, NO_TIMESTAMP);
  }

  /** Used when rebuilding a fact from persisted data with its original timestamp. */
  public CanonicalFact(String id, String content, String domain, long createdAtTicks) {
    super(Objects.requireNonNull(id, "id"), createdAtTicks, MutationSource.DESIGNER);
    this.content = Objects.requireNonNull(content, "content");
    this.domain = domain;
  }

  private CanonicalFact(CanonicalFact other) {
    super(other);
    this.content = other.content;
    this.domain = other.domain;
  }

  /** Optional domain such as "world", "character" or "lore"; may be null. */
  public String getDomain() {
    return domain;
  }

  @Override
  public MemoryAuthority getAuthority() {
    return MemoryAuthority.CANONICAL;
  }

  @Override
  public String getContent() {
    return content;
  }

  @Override
  public CanonicalFact copy() {
    return new CanonicalFact(this);
  }
}
