package org.openrepo.oaipmh.helpers;

import static org.openrepo.oaipmh.Constants.REPOSITORY_PROTOCOL_VERSION_2_0;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openrepo.oaipmh.Request;
import org.openrepo.oaipmh.domain.Verb;
import org.openrepo.oaipmh.helpers.configuration.RepositoryConfiguration;
import org.openrepo.oaipmh.helpers.response.ResponseHelper;
import org.openrepo.oaipmh.model.IdentifyType;
import org.openrepo.oaipmh.model.OaiPmhResponse;
import org.springframework.stereotype.Component;

/**
 * Helper class that contains business logic for retrieving OAI-PMH repository info.
 */
@Component
public class GetOaiRepositoryInfoHelper implements VerbHelper {

  private static final Logger logger = LogManager.getLogger(GetOaiRepositoryInfoHelper.class);

  private final RepositoryConfiguration repositoryConfiguration;
  private final ResponseHelper responseHelper;

  public GetOaiRepositoryInfoHelper(RepositoryConfiguration repositoryConfiguration, ResponseHelper responseHelper) {
    this.repositoryConfiguration = repositoryConfiguration;
    this.responseHelper = responseHelper;
  }

  @Override
  public Verb getVerb() {
    return Verb.IDENTIFY;
  }

  @Override
  public OaiPmhResponse handle(Request request) {
    try {
      return responseHelper.buildBaseOaipmhResponse(request)
        .withIdentify(new IdentifyType()
          .withRepositoryName(repositoryConfiguration.getRepositoryName().getValue())
          .withBaseURL(repositoryConfiguration.getBaseUrl().getValue())
          .withProtocolVersion(REPOSITORY_PROTOCOL_VERSION_2_0)
          .withEarliestDatestamp(repositoryConfiguration.getEarliestDatestamp().getValue())
          .withDeletedRecord(repositoryConfiguration.getDeletedRecords().value())
          .withGranularity(repositoryConfiguration.getTimeGranularity().value())
          .withAdminEmails(repositoryConfiguration.getAdminEmails().getValues()));
    } catch (IllegalStateException e) {
      logger.error("Error happened while processing Identify verb request: {}", e.getMessage());
      throw e;
    }
  }
}
