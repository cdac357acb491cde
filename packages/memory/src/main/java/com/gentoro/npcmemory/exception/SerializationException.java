package com.gentoro.npcmemory.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends NpcMemoryException {
  public SerializationException(String message) {
    super(NpcMemoryErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(NpcMemoryErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
