package org.openrepo.oaipmh.domain.value;

import java.util.Objects;
import java.util.regex.Pattern;

import org.openrepo.oaipmh.exception.ValidationException;

/**
 * Prefix bound to a namespace URI in a metadata format declaration, e.g. {@code oai_dc} or {@code dc}.
 */
public final class NamespacePrefix {

  private static final Pattern PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.-]*$");

  private final String value;

  public NamespacePrefix(String value) {
    if (value == null || !PATTERN.matcher(value).matches()) {
      throw ValidationException.invalidFormat("namespacePrefix", value);
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
    if (!(o instanceof NamespacePrefix)) {
      return false;
    }
    return value.equals(((NamespacePrefix) o).value);
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
