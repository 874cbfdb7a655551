package org.openrepo.oaipmh.validator;

import static java.lang.String.format;
import static org.openrepo.oaipmh.Constants.FROM_PARAM;
import static org.openrepo.oaipmh.Constants.IDENTIFIER_PARAM;
import static org.openrepo.oaipmh.Constants.ILLEGAL_ARGUMENT_ERROR;
import static org.openrepo.oaipmh.Constants.METADATA_PREFIX_PARAM;
import static org.openrepo.oaipmh.Constants.REPEATED_ARGUMENT_ERROR;
import static org.openrepo.oaipmh.Constants.RESUMPTION_TOKEN_PARAM;
import static org.openrepo.oaipmh.Constants.SET_PARAM;
import static org.openrepo.oaipmh.Constants.UNTIL_PARAM;
import static org.openrepo.oaipmh.Constants.VERB_MISSING_ERROR;
import static org.openrepo.oaipmh.Constants.VERB_NOT_SUPPORTED_ERROR;
import static org.openrepo.oaipmh.Constants.VERB_PARAM;
import static org.openrepo.oaipmh.Constants.VERB_REPEATED_ERROR;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_ARGUMENT;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_VERB;

import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openrepo.oaipmh.ParsedQuery;
import org.openrepo.oaipmh.Request;
import org.openrepo.oaipmh.domain.Verb;
import org.springframework.stereotype.Component;

import com.google.common.collect.ImmutableSet;

/**
 * Protocol level validation of a parsed query: verb presence, uniqueness and support, and the legality and
 * uniqueness of the other arguments. Every check runs regardless of the outcome of the previous ones so that
 * all problems of the query are reported at once.
 */
@Component
public class RequestValidator {

  private static final Logger logger = LogManager.getLogger(RequestValidator.class);

  /** Arguments defined by the protocol, in the order they are reported. */
  public static final Set<String> ALLOWED_ARGUMENTS = ImmutableSet.of(VERB_PARAM, IDENTIFIER_PARAM,
    METADATA_PREFIX_PARAM, FROM_PARAM, UNTIL_PARAM, SET_PARAM, RESUMPTION_TOKEN_PARAM);

  public ValidationResult validate(ParsedQuery query) {
    ErrorAccumulator errors = new ErrorAccumulator();

    validateVerbPresent(query, errors);
    validateVerbNotRepeated(query, errors);
    Verb verb = validateVerbSupported(query, errors);
    validateArgumentsLegal(query, errors);
    validateArgumentsNotRepeated(query, errors);

    if (errors.hasErrors()) {
      logger.warn("Request '{}' rejected: {}", query, errors);
      return ValidationResult.invalid(errors);
    }

    Request request = Request.builder()
      .verb(verb)
      .identifier(query.getFirstValue(IDENTIFIER_PARAM))
      .metadataPrefix(query.getFirstValue(METADATA_PREFIX_PARAM))
      .from(query.getFirstValue(FROM_PARAM))
      .until(query.getFirstValue(UNTIL_PARAM))
      .set(query.getFirstValue(SET_PARAM))
      .resumptionToken(query.getFirstValue(RESUMPTION_TOKEN_PARAM))
      .build();
    logger.debug("Request validated: {}", request);
    return ValidationResult.valid(request);
  }

  private void validateVerbPresent(ParsedQuery query, ErrorAccumulator errors) {
    if (!query.contains(VERB_PARAM)) {
      errors.add(BAD_VERB, VERB_MISSING_ERROR);
    }
  }

  private void validateVerbNotRepeated(ParsedQuery query, ErrorAccumulator errors) {
    if (query.countOccurrences(VERB_PARAM) > 1) {
      errors.add(BAD_VERB, VERB_REPEATED_ERROR);
    }
  }

  /**
   * Checks the first given verb value.
   *
   * @return the verb, {@code null} if it is absent or unknown
   */
  private Verb validateVerbSupported(ParsedQuery query, ErrorAccumulator errors) {
    if (!query.contains(VERB_PARAM)) {
      return null;
    }
    String verbName = query.getFirstValue(VERB_PARAM);
    Verb verb = Verb.fromName(verbName);
    if (verb == null) {
      errors.add(BAD_VERB, format(VERB_NOT_SUPPORTED_ERROR, verbName));
    }
    return verb;
  }

  private void validateArgumentsLegal(ParsedQuery query, ErrorAccumulator errors) {
    new LinkedHashSet<>(query.getKeys()).stream()
      .filter(key -> !ALLOWED_ARGUMENTS.contains(key))
      .forEach(key -> errors.add(BAD_ARGUMENT, format(ILLEGAL_ARGUMENT_ERROR, key)));
  }

  private void validateArgumentsNotRepeated(ParsedQuery query, ErrorAccumulator errors) {
    new LinkedHashSet<>(query.getKeys()).stream()
      .filter(key -> !VERB_PARAM.equals(key))
      .filter(key -> query.countOccurrences(key) > 1)
      .forEach(key -> errors.add(BAD_ARGUMENT, format(REPEATED_ARGUMENT_ERROR, key)));
  }
}
