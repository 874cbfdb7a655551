package org.openrepo.oaipmh.validator;

import static java.lang.String.format;
import static org.openrepo.oaipmh.Constants.BAD_ARGUMENT_VALUE_ERROR;
import static org.openrepo.oaipmh.Constants.BAD_DATESTAMP_FORMAT_ERROR;
import static org.openrepo.oaipmh.Constants.DATE_RANGE_GRANULARITY_ERROR;
import static org.openrepo.oaipmh.Constants.DATE_RANGE_ORDER_ERROR;
import static org.openrepo.oaipmh.Constants.EXCLUSIVE_PARAM_ERROR;
import static org.openrepo.oaipmh.Constants.FROM_PARAM;
import static org.openrepo.oaipmh.Constants.IDENTIFIER_PARAM;
import static org.openrepo.oaipmh.Constants.ILLEGAL_VERB_PARAM_ERROR;
import static org.openrepo.oaipmh.Constants.METADATA_PREFIX_PARAM;
import static org.openrepo.oaipmh.Constants.MISSING_REQUIRED_PARAMETERS_ERROR;
import static org.openrepo.oaipmh.Constants.SET_PARAM;
import static org.openrepo.oaipmh.Constants.UNTIL_PARAM;
import static org.openrepo.oaipmh.Constants.VERB_PARAM;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_ARGUMENT;

import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openrepo.oaipmh.Request;
import org.openrepo.oaipmh.domain.Granularity;
import org.openrepo.oaipmh.domain.Verb;
import org.openrepo.oaipmh.domain.value.MetadataPrefix;
import org.openrepo.oaipmh.domain.value.RecordIdentifier;
import org.openrepo.oaipmh.domain.value.SetSpec;
import org.openrepo.oaipmh.domain.value.UtcDatetime;
import org.openrepo.oaipmh.exception.ValidationException;
import org.openrepo.oaipmh.helpers.configuration.RepositoryConfiguration;
import org.springframework.stereotype.Component;

/**
 * Validates the arguments of a protocol valid request against its verb: required, exclusive and illegal arguments,
 * the syntax of argument values and the 'from'/'until' date range.
 */
@Component
public class VerbArgumentsValidator {

  private static final Logger logger = LogManager.getLogger(VerbArgumentsValidator.class);

  private final RepositoryConfiguration repositoryConfiguration;

  public VerbArgumentsValidator(RepositoryConfiguration repositoryConfiguration) {
    this.repositoryConfiguration = repositoryConfiguration;
  }

  /**
   * @param request request that passed {@link RequestValidator}
   * @return collected errors, empty if the arguments are valid
   */
  public ErrorAccumulator validate(Request request) {
    ErrorAccumulator errors = new ErrorAccumulator();
    Verb verb = request.getVerb();

    validateRequiredParams(verb, request, errors);
    validateExclusiveParam(verb, request, errors);
    validateIllegalParams(verb, request, errors);
    validateValue(verb, request, IDENTIFIER_PARAM, RecordIdentifier::new, errors);
    validateValue(verb, request, METADATA_PREFIX_PARAM, MetadataPrefix::new, errors);
    validateValue(verb, request, SET_PARAM, SetSpec::new, errors);
    validateDateRange(verb, request, errors);

    if (errors.hasErrors()) {
      logger.warn("Arguments of {} rejected: {}", request, errors);
    }
    return errors;
  }

  /**
   * Verifies that none of the required parameters is missing. If the exclusive parameter is given it is the only
   * required one.
   */
  private void validateRequiredParams(Verb verb, Request request, ErrorAccumulator errors) {
    Set<String> params = hasExclusiveParam(verb, request)
      ? Set.of(verb.getExclusiveParam())
      : verb.getRequiredParams();

    String missingRequiredParams = params.stream()
      .filter(p -> StringUtils.isEmpty(request.getParam(p)))
      .collect(Collectors.joining(","));

    if (StringUtils.isNotEmpty(missingRequiredParams)) {
      errors.add(BAD_ARGUMENT, format(MISSING_REQUIRED_PARAMETERS_ERROR, missingRequiredParams));
    }
  }

  /**
   * In case of resumption token presence verifies that no other argument was specified.
   */
  private void validateExclusiveParam(Verb verb, Request request, ErrorAccumulator errors) {
    if (!hasExclusiveParam(verb, request)) {
      return;
    }
    RequestValidator.ALLOWED_ARGUMENTS.stream()
      .filter(p -> !VERB_PARAM.equals(p))
      .filter(p -> !verb.getExclusiveParam().equals(p))
      .filter(p -> request.getParam(p) != null)
      .findAny()
      .ifPresent(p -> errors.add(BAD_ARGUMENT, format(EXCLUSIVE_PARAM_ERROR, verb.getName(), verb.getExclusiveParam())));
  }

  private void validateIllegalParams(Verb verb, Request request, ErrorAccumulator errors) {
    RequestValidator.ALLOWED_ARGUMENTS.stream()
      .filter(p -> request.getParam(p) != null)
      .filter(p -> !verb.getAllParams().contains(p))
      .forEach(p -> errors.add(BAD_ARGUMENT, format(ILLEGAL_VERB_PARAM_ERROR, verb.getName(), p)));
  }

  /**
   * Checks the syntax of an argument the verb accepts; absent and empty values are left to the required check.
   */
  private void validateValue(Verb verb, Request request, String param, Function<String, ?> factory,
                             ErrorAccumulator errors) {
    String value = request.getParam(param);
    if (StringUtils.isEmpty(value) || !verb.getAllParams().contains(param)) {
      return;
    }
    try {
      factory.apply(value);
    } catch (ValidationException e) {
      logger.debug("Invalid argument value: {}", e.getMessage());
      errors.add(BAD_ARGUMENT, format(BAD_ARGUMENT_VALUE_ERROR, param, value));
    }
  }

  private void validateDateRange(Verb verb, Request request, ErrorAccumulator errors) {
    UtcDatetime from = parseDatestamp(verb, FROM_PARAM, request.getFrom(), errors);
    UtcDatetime until = parseDatestamp(verb, UNTIL_PARAM, request.getUntil(), errors);
    if (from == null || until == null) {
      return;
    }
    if (from.getGranularity() != until.getGranularity()) {
      errors.add(BAD_ARGUMENT, DATE_RANGE_GRANULARITY_ERROR);
    } else if (from.compareTo(until) > 0) {
      errors.add(BAD_ARGUMENT, DATE_RANGE_ORDER_ERROR);
    }
  }

  /**
   * Parses the datestamp at the repository granularity. A repository with seconds granularity must support day
   * granularity too, so it accepts both shapes.
   *
   * @return parsed datestamp, {@code null} if the value is absent, not accepted by the verb or invalid
   */
  private UtcDatetime parseDatestamp(Verb verb, String param, String value, ErrorAccumulator errors) {
    if (value == null || !verb.getAllParams().contains(param)) {
      return null;
    }
    try {
      if (repositoryConfiguration.getTimeGranularity() == Granularity.YYYY_MM_DD) {
        return new UtcDatetime(value, Granularity.YYYY_MM_DD);
      }
      return UtcDatetime.parse(value);
    } catch (ValidationException e) {
      logger.debug("Invalid datestamp: {}", e.getMessage());
      errors.add(BAD_ARGUMENT, format(BAD_DATESTAMP_FORMAT_ERROR, param, value));
      return null;
    }
  }

  private boolean hasExclusiveParam(Verb verb, Request request) {
    return verb.getExclusiveParam() != null && request.getParam(verb.getExclusiveParam()) != null;
  }
}
