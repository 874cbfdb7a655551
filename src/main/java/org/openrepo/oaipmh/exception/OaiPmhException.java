package org.openrepo.oaipmh.exception;

import static java.lang.String.format;

import org.openrepo.oaipmh.model.OaiPmhErrorCode;
import org.openrepo.oaipmh.validator.ErrorAccumulator;

/**
 * Carries every protocol error collected for one request. Raised once per processing stage, after all
 * checks of that stage completed, so that the response can list all problems at once.
 */
public class OaiPmhException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final transient ErrorAccumulator errors;

  public OaiPmhException(ErrorAccumulator errors) {
    super(format("OAI-PMH request rejected: %s", errors));
    this.errors = errors.copy();
  }

  public OaiPmhException(OaiPmhErrorCode code, String message) {
    this(new ErrorAccumulator().add(code, message));
  }

  public ErrorAccumulator getErrors() {
    return errors.copy();
  }
}
