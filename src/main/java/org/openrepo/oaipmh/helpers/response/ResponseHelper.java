package org.openrepo.oaipmh.helpers.response;

import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_ARGUMENT;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_VERB;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;

import org.openrepo.oaipmh.Request;
import org.openrepo.oaipmh.helpers.configuration.RepositoryConfiguration;
import org.openrepo.oaipmh.model.OaiPmhErrorCode;
import org.openrepo.oaipmh.model.OaiPmhResponse;
import org.openrepo.oaipmh.model.RequestType;
import org.openrepo.oaipmh.validator.ErrorAccumulator;
import org.springframework.stereotype.Component;

import com.google.common.collect.ImmutableSet;

/**
 * Used for building base {@link OaiPmhResponse} response or the one with accumulated errors.
 */
@Component
public class ResponseHelper {

  /**
   * Errors after which the request element must not echo the verb and arguments
   */
  private static final Set<OaiPmhErrorCode> BARE_REQUEST_ERRORS = ImmutableSet.of(BAD_VERB, BAD_ARGUMENT);

  private final RepositoryConfiguration repositoryConfiguration;

  public ResponseHelper(RepositoryConfiguration repositoryConfiguration) {
    this.repositoryConfiguration = repositoryConfiguration;
  }

  /**
   * Creates basic {@link OaiPmhResponse} with ResponseDate and Request details
   *
   * @param request validated {@link Request}
   * @return basic {@link OaiPmhResponse}
   */
  public OaiPmhResponse buildBaseOaipmhResponse(Request request) {
    return new OaiPmhResponse()
      .withResponseDate(Instant.now().truncatedTo(ChronoUnit.SECONDS))
      .withRequest(toRequestType(request));
  }

  /**
   * Builds base {@link OaiPmhResponse} response with the accumulated errors, one error element per message.
   * The request element carries only the base URL if the request is unknown or a badVerb or badArgument error
   * is present.
   *
   * @param request - validated request, {@code null} if the query was rejected before a request could be built
   * @param errors  - accumulated errors
   * @return OAI-PMH response with errors
   */
  public OaiPmhResponse buildOaipmhResponseWithErrors(Request request, ErrorAccumulator errors) {
    boolean bareRequest = request == null || BARE_REQUEST_ERRORS.stream().anyMatch(errors::contains);
    return new OaiPmhResponse()
      .withResponseDate(Instant.now().truncatedTo(ChronoUnit.SECONDS))
      .withRequest(bareRequest ? baseRequestType() : toRequestType(request))
      .withErrors(errors.toErrorTypes());
  }

  private RequestType baseRequestType() {
    return new RequestType().withValue(repositoryConfiguration.getBaseUrl().getValue());
  }

  private RequestType toRequestType(Request request) {
    return baseRequestType()
      .withVerb(request.getVerb().getName())
      .withIdentifier(request.getIdentifier())
      .withMetadataPrefix(request.getMetadataPrefix())
      .withFrom(request.getFrom())
      .withUntil(request.getUntil())
      .withSet(request.getSet())
      .withResumptionToken(request.getResumptionToken());
  }
}
