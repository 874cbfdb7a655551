package org.openrepo.oaipmh.domain.value;

import java.util.Objects;
import java.util.regex.Pattern;

import org.openrepo.oaipmh.exception.ValidationException;

/**
 * Administrator e-mail address, {@code local-part@domain}. The domain needs at least one dot and its labels may
 * not start or end with a hyphen.
 */
public final class Email {

  private static final Pattern PATTERN = Pattern.compile(
    "^[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+(\\.[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+)*"
      + "@[A-Za-z0-9]([A-Za-z0-9-]*[A-Za-z0-9])?(\\.[A-Za-z0-9]([A-Za-z0-9-]*[A-Za-z0-9])?)+$");

  private final String value;

  public Email(String value) {
    if (value == null || !PATTERN.matcher(value).matches()) {
      throw ValidationException.invalidFormat("email", value);
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
    if (!(o instanceof Email)) {
      return false;
    }
    return value.equals(((Email) o).value);
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
