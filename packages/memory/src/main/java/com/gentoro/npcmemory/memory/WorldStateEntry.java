package com.gentoro.npcmemory.memory;

import java.util.Objects;

/**
 * Mutable key/value game state such as "door_castle_main: open". Identity is the case-insensitive
 * key; the store overwrites the value in place.
 */
public final class WorldStateEntry extends MemoryEntry {
  private final String key;
  private String value;
  private int modificationCount;
  private long modifiedAtTicks;

  public WorldStateEntry(String key, String value) {
    super(null, NO_TIMESTAMP, MutationSource.GAME_SYSTEM);
    this.key = Objects.requireNonNull(key, "key");
    this.value = Objects.requireNonNull(value, "value");
    this.modifiedAtTicks = NO_TIMESTAMP;
  }

  /** Rebuild an entry from persisted data, keeping its identity and modification history. */
  public static WorldStateEntry restored(
      String id,
      String key,
      String value,
      MutationSource source,
      long createdAtTicks,
      int modificationCount,
      long modifiedAtTicks) {
    WorldStateEntry entry = new WorldStateEntry(key, value);
    entry.assignId(Objects.requireNonNull(id, "id"));
    entry.assignSource(source == null ? MutationSource.GAME_SYSTEM : source);
    entry.assignCreatedAtTicks(createdAtTicks);
    entry.modificationCount = modificationCount;
    entry.modifiedAtTicks = modifiedAtTicks;
    return entry;
  }

  private WorldStateEntry(WorldStateEntry other) {
    super(other);
    this.key = other.key;
    this.value = other.value;
    this.modificationCount = other.modificationCount;
    this.modifiedAtTicks = other.modifiedAtTicks;
  }

  public String getKey() {
    return key;
  }

  public String getValue() {
    return value;
  }

  /** Number of overwrites after the initial set. */
  public int getModificationCount() {
    return modificationCount;
  }

  public long getModifiedAtTicks() {
    return modifiedAtTicks;
  }

  /** Source of the most recent write. */
  public MutationSource getLastMutationSource() {
    return getSource();
  }

  @Override
  public MemoryAuthority getAuthority() {
    return MemoryAuthority.WORLD_STATE;
  }

  @Override
  public String getContent() {
    return key + ": " + value;
  }

  @Override
  public WorldStateEntry copy() {
    return new WorldStateEntry(this);
  }

  void overwrite(String newValue, MutationSource source, long ticks) {
    this.value = Objects.requireNonNull(newValue, "value");
    this.modificationCount++;
    this.modifiedAtTicks = ticks;
    assignSource(source);
  }

  void assignModifiedAtTicks(long ticks) {
    this.modifiedAtTicks = ticks;
  }
}
