package com.gentoro.npcmemory.memory;

import java.util.Objects;

/**
 * Directed relationship owned by one NPC, e.g. owner "guard_captain", target "player", label
 * "distrusts". Only the owner may change it; see {@link RelationshipAuthority}.
 */
public final class RelationshipEntry {
  private final String ownerNpcId;
  private final String targetId;
  private final String relationshipLabel;

  public RelationshipEntry(String ownerNpcId, String targetId, String relationshipLabel) {
    this.ownerNpcId = Objects.requireNonNull(ownerNpcId, "ownerNpcId");
    this.targetId = Objects.requireNonNull(targetId, "targetId");
    this.relationshipLabel = Objects.requireNonNull(relationshipLabel, "relationshipLabel");
  }

  public String getOwnerNpcId() {
    return ownerNpcId;
  }

  public String getTargetId() {
    return targetId;
  }

  public String getRelationshipLabel() {
    return relationshipLabel;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RelationshipEntry that)) return false;
    return ownerNpcId.equals(that.ownerNpcId)
        && targetId.equals(that.targetId)
        && relationshipLabel.equals(that.relationshipLabel);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ownerNpcId, targetId, relationshipLabel);
  }

  @Override
  public String toString() {
    return ownerNpcId + " -> " + targetId + ": " + relationshipLabel;
  }
}
