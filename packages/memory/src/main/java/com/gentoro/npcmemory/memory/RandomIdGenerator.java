package com.gentoro.npcmemory.memory;

import java.util.UUID;

/** Eight lowercase hex characters taken from a random UUID. */
public final class RandomIdGenerator implements IdGenerator {
  @Override
  public String generateId() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
  }
}
