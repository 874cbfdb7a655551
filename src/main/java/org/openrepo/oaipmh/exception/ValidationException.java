package org.openrepo.oaipmh.exception;

/**
 * Thrown when a raw value cannot become a domain value: the string does not match the grammar of
 * the value object, or a collection of values breaks its uniqueness rules.
 */
public class ValidationException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public enum Kind {
    INVALID_FORMAT,
    EMPTY_COLLECTION,
    DUPLICATE_VALUE
  }

  private final Kind kind;
  private final String field;
  private final String value;

  public ValidationException(Kind kind, String field, String value) {
    super(buildMessage(kind, field, value));
    this.kind = kind;
    this.field = field;
    this.value = value;
  }

  public static ValidationException invalidFormat(String field, String value) {
    return new ValidationException(Kind.INVALID_FORMAT, field, value);
  }

  public static ValidationException emptyCollection(String field) {
    return new ValidationException(Kind.EMPTY_COLLECTION, field, null);
  }

  public static ValidationException duplicateValue(String field, String value) {
    return new ValidationException(Kind.DUPLICATE_VALUE, field, value);
  }

  public Kind getKind() {
    return kind;
  }

  public String getField() {
    return field;
  }

  public String getValue() {
    return value;
  }

  private static String buildMessage(Kind kind, String field, String value) {
    switch (kind) {
      case EMPTY_COLLECTION:
        return String.format("At least one '%s' must be provided", field);
      case DUPLICATE_VALUE:
        return String.format("Duplicate '%s' found: %s", field, value);
      default:
        return String.format("Invalid '%s' format: '%s'", field, value);
    }
  }
}
