package com.gentoro.npcmemory.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends NpcMemoryException {
  public ValidationException(String message) {
    super(NpcMemoryErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(NpcMemoryErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
