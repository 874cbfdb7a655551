package org.openrepo.oaipmh.validator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.openrepo.oaipmh.model.OaiPmhError;
import org.openrepo.oaipmh.model.OaiPmhErrorCode;

/**
 * Ordered collection of OAI-PMH errors grouped by error code. Codes keep the order in which they were first
 * reported and messages keep the order in which they were added under their code.
 */
public class ErrorAccumulator {

  private final Map<OaiPmhErrorCode, List<String>> errors = new LinkedHashMap<>();

  public ErrorAccumulator add(OaiPmhErrorCode code, String message) {
    Objects.requireNonNull(code, "code");
    errors.computeIfAbsent(code, c -> new ArrayList<>()).add(message);
    return this;
  }

  public ErrorAccumulator addAll(ErrorAccumulator other) {
    other.errors.forEach((code, messages) -> messages.forEach(message -> add(code, message)));
    return this;
  }

  public ErrorAccumulator copy() {
    return new ErrorAccumulator().addAll(this);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public boolean contains(OaiPmhErrorCode code) {
    return errors.containsKey(code);
  }

  /**
   * @return messages reported under the code, empty list if there are none
   */
  public List<String> getMessages(OaiPmhErrorCode code) {
    return Collections.unmodifiableList(errors.getOrDefault(code, Collections.emptyList()));
  }

  public Map<OaiPmhErrorCode, List<String>> asMap() {
    Map<OaiPmhErrorCode, List<String>> view = new LinkedHashMap<>();
    errors.forEach((code, messages) -> view.put(code, Collections.unmodifiableList(new ArrayList<>(messages))));
    return Collections.unmodifiableMap(view);
  }

  /**
   * Flattens the collection into one {@link OaiPmhError} per message, grouped by code.
   */
  public List<OaiPmhError> toErrorTypes() {
    List<OaiPmhError> result = new ArrayList<>();
    errors.forEach((code, messages) -> messages.forEach(message ->
      result.add(new OaiPmhError().withCode(code).withValue(message))));
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ErrorAccumulator)) {
      return false;
    }
    return errors.equals(((ErrorAccumulator) o).errors);
  }

  @Override
  public int hashCode() {
    return errors.hashCode();
  }

  @Override
  public String toString() {
    return errors.toString();
  }
}
