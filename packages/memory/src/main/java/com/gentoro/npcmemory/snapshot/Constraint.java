package com.gentoro.npcmemory.snapshot;

import java.util.List;
import java.util.Objects;

/**
 * A behavioural rule attached to one interaction, e.g. "do not reveal the password".
 *
 * <p>{@code promptInjection} is the text handed to the prompt builder; {@code validationPatterns}
 * are checked against the generated reply by the (external) validator.
 */
public final class Constraint {
  private final String id;
  private final ConstraintType type;
  private final ConstraintSeverity severity;
  private final String description;
  private final String promptInjection;
  private final List<String> validationPatterns;

  public Constraint(
      String id,
      ConstraintType type,
      ConstraintSeverity severity,
      String description,
      String promptInjection,
      List<String> validationPatterns) {
    this.id = id;
    this.type = Objects.requireNonNull(type, "type");
    this.severity = severity == null ? ConstraintSeverity.HARD : severity;
    this.description = description;
    this.promptInjection = promptInjection;
    this.validationPatterns = validationPatterns == null ? List.of() : List.copyOf(validationPatterns);
  }

  public static Constraint prohibition(
      String id, String description, String promptInjection, String... patterns) {
    return new Constraint(
        id,
        ConstraintType.PROHIBITION,
        ConstraintSeverity.HARD,
        description,
        promptInjection,
        List.of(patterns));
  }

  public static Constraint requirement(String id, String description, String promptInjection) {
    return new Constraint(
        id, ConstraintType.REQUIREMENT, ConstraintSeverity.HARD, description, promptInjection, null);
  }

  public static Constraint permission(String id, String description, String promptInjection) {
    return new Constraint(
        id, ConstraintType.PERMISSION, ConstraintSeverity.HARD, description, promptInjection, null);
  }

  public Constraint withSeverity(ConstraintSeverity severity) {
    return new Constraint(id, type, severity, description, promptInjection, validationPatterns);
  }

  /** May be null for ad-hoc constraints. */
  public String getId() {
    return id;
  }

  public ConstraintType getType() {
    return type;
  }

  public ConstraintSeverity getSeverity() {
    return severity;
  }

  public String getDescription() {
    return description;
  }

  public String getPromptInjection() {
    return promptInjection;
  }

  public List<String> getValidationPatterns() {
    return validationPatterns;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Constraint that)) return false;
    return Objects.equals(id, that.id)
        && type == that.type
        && severity == that.severity
        && Objects.equals(description, that.description)
        && Objects.equals(promptInjection, that.promptInjection)
        && validationPatterns.equals(that.validationPatterns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, type, severity, description, promptInjection, validationPatterns);
  }

  @Override
  public String toString() {
    return "[" + type + ":" + severity + "] " + description;
  }
}
