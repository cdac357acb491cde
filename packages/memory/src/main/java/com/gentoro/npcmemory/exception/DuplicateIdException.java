package com.gentoro.npcmemory.exception;

import java.util.Map;

/** An entry with the same identifier is already present in the store. */
public class DuplicateIdException extends NpcMemoryException {
  private final String entryId;

  public DuplicateIdException(String kind, String entryId) {
    super(
        NpcMemoryErrorCode.ALREADY_EXISTS,
        "%s '%s' already exists and cannot be replaced.".formatted(kind, entryId),
        Map.of("kind", kind, "id", entryId));
    this.entryId = entryId;
  }

  public String getEntryId() {
    return entryId;
  }
}
