package com.gentoro.npcmemory.exception;

import java.util.Map;

/** The acting party is not allowed to change the targeted memory entry. */
public class MutationAuthorityException extends NpcMemoryException {
  public MutationAuthorityException(String message) {
    super(NpcMemoryErrorCode.PERMISSION_DENIED, message);
  }

  public MutationAuthorityException(String message, Map<String, ?> context) {
    super(NpcMemoryErrorCode.PERMISSION_DENIED, message, context);
  }
}
