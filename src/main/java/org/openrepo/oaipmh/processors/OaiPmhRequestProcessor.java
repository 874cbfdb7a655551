package org.openrepo.oaipmh.processors;

import static java.lang.String.format;
import static org.openrepo.oaipmh.Constants.VERB_NOT_IMPLEMENTED_ERROR;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_ARGUMENT;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_VERB;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openrepo.oaipmh.ParsedQuery;
import org.openrepo.oaipmh.Request;
import org.openrepo.oaipmh.ResponseConverter;
import org.openrepo.oaipmh.domain.Verb;
import org.openrepo.oaipmh.exception.OaiPmhException;
import org.openrepo.oaipmh.exception.ValidationException;
import org.openrepo.oaipmh.helpers.VerbHelper;
import org.openrepo.oaipmh.helpers.response.ResponseHelper;
import org.openrepo.oaipmh.model.OaiPmhResponse;
import org.openrepo.oaipmh.validator.ErrorAccumulator;
import org.openrepo.oaipmh.validator.RequestValidator;
import org.openrepo.oaipmh.validator.ValidationResult;
import org.openrepo.oaipmh.validator.VerbArgumentsValidator;
import org.springframework.stereotype.Component;

/**
 * Entry point of the OAI-PMH request handling: parses and validates the raw query, dispatches the request to the
 * {@link VerbHelper} of its verb and renders either the helper response or an error document.
 */
@Component
public class OaiPmhRequestProcessor {

  private static final Logger logger = LogManager.getLogger(OaiPmhRequestProcessor.class);

  /** Map containing OAI-PMH verb and corresponding helper instance. */
  private final Map<Verb, VerbHelper> helpers = new EnumMap<>(Verb.class);

  private final RequestValidator requestValidator;
  private final VerbArgumentsValidator verbArgumentsValidator;
  private final ResponseHelper responseHelper;

  public OaiPmhRequestProcessor(RequestValidator requestValidator, VerbArgumentsValidator verbArgumentsValidator,
                                ResponseHelper responseHelper, List<VerbHelper> verbHelpers) {
    this.requestValidator = requestValidator;
    this.verbArgumentsValidator = verbArgumentsValidator;
    this.responseHelper = responseHelper;
    for (VerbHelper helper : verbHelpers) {
      VerbHelper previous = helpers.put(helper.getVerb(), helper);
      if (previous != null) {
        throw new IllegalStateException(format("More than one helper registered for verb '%s': %s, %s",
          helper.getVerb(), previous.getClass().getSimpleName(), helper.getClass().getSimpleName()));
      }
    }
    logger.info("Verb helpers registered for {}", helpers.keySet());
  }

  /**
   * Handles the raw query and returns the marshalled OAI-PMH document.
   *
   * @param queryString raw http query string, without the leading '?'
   * @return OAI-PMH xml document
   */
  public String process(String queryString) {
    return ResponseConverter.getInstance().convertToString(handle(queryString));
  }

  /**
   * Handles the raw query. Protocol errors never escape: they are rendered as error elements of the response.
   *
   * @param queryString raw http query string, without the leading '?'
   * @return OAI-PMH response
   */
  public OaiPmhResponse handle(String queryString) {
    ValidationResult result;
    try {
      result = requestValidator.validate(ParsedQuery.parse(queryString));
    } catch (OaiPmhException e) {
      return responseHelper.buildOaipmhResponseWithErrors(null, e.getErrors());
    }
    if (!result.isValid()) {
      return responseHelper.buildOaipmhResponseWithErrors(null, result.getErrors());
    }

    Request request = result.getRequest();
    ErrorAccumulator errors = verbArgumentsValidator.validate(request);
    if (errors.hasErrors()) {
      return responseHelper.buildOaipmhResponseWithErrors(request, errors);
    }

    VerbHelper verbHelper = helpers.get(request.getVerb());
    if (verbHelper == null) {
      logger.warn("No helper registered for verb '{}'", request.getVerb());
      return responseHelper.buildOaipmhResponseWithErrors(request,
        new ErrorAccumulator().add(BAD_VERB, format(VERB_NOT_IMPLEMENTED_ERROR, request.getVerb())));
    }

    logger.debug("Using helper {} for {}", verbHelper.getClass().getSimpleName(), request);
    try {
      return verbHelper.handle(request);
    } catch (OaiPmhException e) {
      logger.warn("Request {} completed with errors: {}", request, e.getErrors());
      return responseHelper.buildOaipmhResponseWithErrors(request, e.getErrors());
    } catch (ValidationException e) {
      logger.warn("Request {} has invalid argument: {}", request, e.getMessage());
      return responseHelper.buildOaipmhResponseWithErrors(request,
        new ErrorAccumulator().add(BAD_ARGUMENT, e.getMessage()));
    }
  }
}
