package com.gentoro.npcmemory.memory;

import com.gentoro.npcmemory.exception.MutationAuthorityException;
import java.util.Map;

/** Owner-based mutation rule for relationship entries. */
public final class RelationshipAuthority {
  private RelationshipAuthority() {}

  /** True iff {@code npcId} names the owner of the relationship, ignoring case. */
  public static boolean canModify(RelationshipEntry relationship, String npcId) {
    if (relationship == null || npcId == null || npcId.isEmpty()) return false;
    return MemoryKey.matches(relationship.getOwnerNpcId(), npcId);
  }

  static void requireOwner(String ownerNpcId, String actingNpcId) {
    if (actingNpcId == null || actingNpcId.isEmpty() || !MemoryKey.matches(ownerNpcId, actingNpcId)) {
      throw new MutationAuthorityException(
          "NPC '%s' cannot modify relationship owned by '%s'".formatted(actingNpcId, ownerNpcId),
          Map.of("owner", ownerNpcId, "actor", String.valueOf(actingNpcId)));
    }
  }
}
