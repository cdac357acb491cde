package com.gentoro.npcmemory.memory;

import com.gentoro.npcmemory.exception.ValidationException;

/**
 * Base class for all entries held by {@link AuthoritativeMemoryStore}.
 *
 * <p>Provenance fields (timestamp, sequence number, source) are written by the store only. A
 * sequence number of {@link #UNASSIGNED_SEQUENCE} means the entry has not been stored yet.
 */
public abstract class MemoryEntry {
  /** Marker for "no timestamp supplied"; the store substitutes its clock. */
  public static final long NO_TIMESTAMP = Long.MIN_VALUE;

  public static final long UNASSIGNED_SEQUENCE = 0L;

  private String id;
  private long createdAtTicks;
  private long sequenceNumber;
  private MutationSource source;

  protected MemoryEntry(String id, long createdAtTicks, MutationSource source) {
    this.id = id;
    this.createdAtTicks = createdAtTicks;
    this.sequenceNumber = UNASSIGNED_SEQUENCE;
    this.source = source;
  }

  /** Copy constructor used by {@link #copy()} implementations. */
  protected MemoryEntry(MemoryEntry other) {
    this.id = other.id;
    this.createdAtTicks = other.createdAtTicks;
    this.sequenceNumber = other.sequenceNumber;
    this.source = other.source;
  }

  public String getId() {
    return id;
  }

  public long getCreatedAtTicks() {
    return createdAtTicks;
  }

  public boolean hasCreatedAtTicks() {
    return createdAtTicks != NO_TIMESTAMP;
  }

  public long getSequenceNumber() {
    return sequenceNumber;
  }

  public MutationSource getSource() {
    return source;
  }

  public abstract MemoryAuthority getAuthority();

  /** Text injected into prompts for this entry. */
  public abstract String getContent();

  /** Detached copy carrying the same provenance. */
  public abstract MemoryEntry copy();

  void assignId(String id) {
    this.id = id;
  }

  void assignCreatedAtTicks(long ticks) {
    this.createdAtTicks = ticks;
  }

  void assignSequenceNumber(long sequenceNumber) {
    this.sequenceNumber = sequenceNumber;
  }

  void assignSource(MutationSource source) {
    this.source = source;
  }

  /** Finite values are clamped into [min, max]; NaN and infinities are rejected. */
  static double checkedRange(String field, double value, double min, double max) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new ValidationException(
          "%s must be a finite number but was %s".formatted(field, value));
    }
    return Math.max(min, Math.min(max, value));
  }

  @Override
  public String toString() {
    return getContent();
  }
}
