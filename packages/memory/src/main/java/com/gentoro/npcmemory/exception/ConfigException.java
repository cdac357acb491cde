package com.gentoro.npcmemory.exception;

/** Configuration or environment related problem detected while loading settings. */
public class ConfigException extends NpcMemoryException {
  public ConfigException(String message) {
    super(NpcMemoryErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(NpcMemoryErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
