package com.gentoro.npcmemory.exception;

/**
 * Stable error codes for the NPC memory core. Codes are suitable for logs and for callers that map
 * failures onto their own responses. Prefer the most specific code that reflects the failure origin.
 */
public enum NpcMemoryErrorCode {
  // Generic
  INVALID_ARGUMENT,
  ALREADY_EXISTS,
  PERMISSION_DENIED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
}
