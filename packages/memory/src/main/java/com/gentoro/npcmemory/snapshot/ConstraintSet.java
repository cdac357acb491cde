package com.gentoro.npcmemory.snapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of constraints for one interaction. Adding a constraint whose id is already
 * present, or an id-less constraint equal to one already present, is a no-op.
 */
public final class ConstraintSet {
  private final List<Constraint> constraints = new ArrayList<>();

  public ConstraintSet() {}

  public ConstraintSet(Collection<Constraint> constraints) {
    addAll(constraints);
  }

  /**
   * @return true if the constraint was added
   */
  public boolean add(Constraint constraint) {
    Objects.requireNonNull(constraint, "constraint");
    if (contains(constraint)) return false;
    constraints.add(constraint);
    return true;
  }

  public ConstraintSet addAll(Collection<Constraint> others) {
    if (others != null) {
      for (Constraint c : others) add(c);
    }
    return this;
  }

  public boolean contains(Constraint constraint) {
    for (Constraint existing : constraints) {
      if (constraint.getId() != null
          ? constraint.getId().equals(existing.getId())
          : constraint.equals(existing)) {
        return true;
      }
    }
    return false;
  }

  public int size() {
    return constraints.size();
  }

  public boolean isEmpty() {
    return constraints.isEmpty();
  }

  public List<Constraint> all() {
    return Collections.unmodifiableList(constraints);
  }

  public List<Constraint> prohibitions() {
    return ofType(ConstraintType.PROHIBITION);
  }

  public List<Constraint> requirements() {
    return ofType(ConstraintType.REQUIREMENT);
  }

  public List<Constraint> permissions() {
    return ofType(ConstraintType.PERMISSION);
  }

  private List<Constraint> ofType(ConstraintType type) {
    return constraints.stream().filter(c -> c.getType() == type).toList();
  }

  /** New set holding this set's constraints followed by those of {@code other} not yet present. */
  public ConstraintSet merge(ConstraintSet other) {
    ConstraintSet merged = copy();
    if (other != null) merged.addAll(other.constraints);
    return merged;
  }

  public ConstraintSet copy() {
    return new ConstraintSet(constraints);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ConstraintSet that)) return false;
    return constraints.equals(that.constraints);
  }

  @Override
  public int hashCode() {
    return constraints.hashCode();
  }

  @Override
  public String toString() {
    return "ConstraintSet" + constraints;
  }
}
