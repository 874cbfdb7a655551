package org.openrepo.oaipmh.validator;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_ARGUMENT;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_VERB;

import org.junit.jupiter.api.Test;
import org.openrepo.oaipmh.exception.OaiPmhException;
import org.openrepo.oaipmh.model.OaiPmhError;

class ErrorAccumulatorTest {

  @Test
  void shouldGroupMessagesByCodeInFirstReportOrder() {
    ErrorAccumulator errors = new ErrorAccumulator()
      .add(BAD_ARGUMENT, "first argument")
      .add(BAD_VERB, "verb")
      .add(BAD_ARGUMENT, "second argument");

    assertThat(errors.asMap().keySet(), contains(BAD_ARGUMENT, BAD_VERB));
    assertThat(errors.getMessages(BAD_ARGUMENT), contains("first argument", "second argument"));
    assertThat(errors.toErrorTypes(), contains(
      new OaiPmhError().withCode(BAD_ARGUMENT).withValue("first argument"),
      new OaiPmhError().withCode(BAD_ARGUMENT).withValue("second argument"),
      new OaiPmhError().withCode(BAD_VERB).withValue("verb")));
  }

  @Test
  void shouldStartEmpty() {
    ErrorAccumulator errors = new ErrorAccumulator();

    assertThat(errors.hasErrors(), is(false));
    assertThat(errors.contains(BAD_VERB), is(false));
    assertThat(errors.getMessages(BAD_VERB), is(empty()));
  }

  @Test
  void shouldExposeReadOnlyView() {
    ErrorAccumulator errors = new ErrorAccumulator().add(BAD_VERB, "verb");

    assertThrows(UnsupportedOperationException.class, () -> errors.asMap().clear());
    assertThrows(UnsupportedOperationException.class, () -> errors.getMessages(BAD_VERB).add("other"));
  }

  @Test
  void shouldSnapshotErrorsInException() {
    ErrorAccumulator errors = new ErrorAccumulator().add(BAD_VERB, "verb");
    OaiPmhException exception = new OaiPmhException(errors);
    errors.add(BAD_ARGUMENT, "later");

    assertThat(exception.getErrors().asMap().keySet(), contains(BAD_VERB));
    assertThat(errors.copy(), is(errors));
  }

  @Test
  void shouldKeepInvalidResultSeparateFromValidOne() {
    ValidationResult result = ValidationResult.invalid(new ErrorAccumulator().add(BAD_VERB, "verb"));

    assertThat(result.isValid(), is(false));
    OaiPmhException e = assertThrows(OaiPmhException.class, result::orElseThrow);
    assertThat(e.getErrors().getMessages(BAD_VERB), contains("verb"));
    assertThrows(IllegalArgumentException.class, () -> ValidationResult.invalid(new ErrorAccumulator()));
  }
}
