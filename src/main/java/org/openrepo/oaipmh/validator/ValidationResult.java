package org.openrepo.oaipmh.validator;

import java.util.Objects;

import org.openrepo.oaipmh.Request;
import org.openrepo.oaipmh.exception.OaiPmhException;

/**
 * Outcome of the request validation: either a {@link Request} or the errors that rejected the query, never both.
 */
public final class ValidationResult {

  private final Request request;
  private final ErrorAccumulator errors;

  private ValidationResult(Request request, ErrorAccumulator errors) {
    this.request = request;
    this.errors = errors;
  }

  public static ValidationResult valid(Request request) {
    return new ValidationResult(Objects.requireNonNull(request, "request"), new ErrorAccumulator());
  }

  public static ValidationResult invalid(ErrorAccumulator errors) {
    if (!errors.hasErrors()) {
      throw new IllegalArgumentException("Invalid result requires at least one error");
    }
    return new ValidationResult(null, errors.copy());
  }

  public boolean isValid() {
    return request != null;
  }

  /**
   * @return the validated request, {@code null} if the result is invalid
   */
  public Request getRequest() {
    return request;
  }

  public ErrorAccumulator getErrors() {
    return errors.copy();
  }

  /**
   * @return the validated request
   * @throws OaiPmhException carrying the errors if the result is invalid
   */
  public Request orElseThrow() {
    if (!isValid()) {
      throw new OaiPmhException(errors);
    }
    return request;
  }

  @Override
  public String toString() {
    return isValid() ? "ValidationResult{valid, " + request + "}" : "ValidationResult{invalid, " + errors + "}";
  }
}
