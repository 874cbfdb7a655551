package org.openrepo.oaipmh.exception;

public class InvariantViolationException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public InvariantViolationException(String message) {
    super(message);
  }
}
