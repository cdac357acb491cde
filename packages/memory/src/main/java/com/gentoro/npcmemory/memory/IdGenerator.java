package com.gentoro.npcmemory.memory;

/** Produces identifiers for entries stored without an explicit id. */
@FunctionalInterface
public interface IdGenerator {
  String generateId();
}
