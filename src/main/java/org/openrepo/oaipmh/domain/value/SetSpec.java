package org.openrepo.oaipmh.domain.value;

import java.util.Objects;
import java.util.regex.Pattern;

import org.openrepo.oaipmh.exception.ValidationException;

/**
 * Colon separated set path, e.g. {@code science:physics}. Empty segments are not allowed.
 */
public final class SetSpec {

  private static final Pattern PATTERN = Pattern.compile("^[A-Za-z0-9\\-_.]+(:[A-Za-z0-9\\-_.]+)*$");

  private final String value;

  public SetSpec(String value) {
    if (value == null || !PATTERN.matcher(value).matches()) {
      throw ValidationException.invalidFormat("setSpec", value);
    }
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SetSpec)) {
      return false;
    }
    return value.equals(((SetSpec) o).value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
