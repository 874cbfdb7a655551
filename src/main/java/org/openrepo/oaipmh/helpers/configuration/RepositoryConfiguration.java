package org.openrepo.oaipmh.helpers.configuration;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static org.openrepo.oaipmh.Constants.REPOSITORY_ADMIN_EMAILS;
import static org.openrepo.oaipmh.Constants.REPOSITORY_NAME;

import java.util.Arrays;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openrepo.oaipmh.domain.DeletedRecord;
import org.openrepo.oaipmh.domain.Granularity;
import org.openrepo.oaipmh.domain.value.BaseUrl;
import org.openrepo.oaipmh.domain.value.Email;
import org.openrepo.oaipmh.domain.value.EmailCollection;
import org.openrepo.oaipmh.domain.value.RepositoryName;
import org.openrepo.oaipmh.domain.value.UtcDatetime;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Repository wide settings read from {@code oai-pmh.properties}; system properties of the same name take precedence.
 * Values are parsed into domain types once, at construction, so a misconfigured repository fails at start up.
 * A missing name or e-mail list is only reported when Identify asks for it.
 */
@Component
public class RepositoryConfiguration {

  private static final Logger logger = LogManager.getLogger(RepositoryConfiguration.class);

  private final BaseUrl baseUrl;
  private final RepositoryName repositoryName;
  private final EmailCollection adminEmails;
  private final Granularity timeGranularity;
  private final DeletedRecord deletedRecords;
  private final UtcDatetime earliestDatestamp;

  public RepositoryConfiguration(@Value("${repository.baseURL:http://localhost/oai}") String baseUrl,
                                 @Value("${repository.name:}") String repositoryName,
                                 @Value("${repository.adminEmails:}") String adminEmails,
                                 @Value("${repository.timeGranularity:YYYY-MM-DDThh:mm:ssZ}") String timeGranularity,
                                 @Value("${repository.deletedRecords:no}") String deletedRecords,
                                 @Value("${repository.earliestDatestamp:1970-01-01T00:00:00Z}") String earliestDatestamp) {
    this.baseUrl = new BaseUrl(baseUrl);
    this.repositoryName = StringUtils.isBlank(repositoryName) ? null : new RepositoryName(repositoryName);
    this.adminEmails = StringUtils.isBlank(adminEmails) ? null : parseEmails(adminEmails);
    this.timeGranularity = Granularity.fromValue(timeGranularity);
    this.deletedRecords = DeletedRecord.fromValue(deletedRecords);
    this.earliestDatestamp = new UtcDatetime(earliestDatestamp, this.timeGranularity);
    logger.info("Repository configured: baseURL {}, name '{}', granularity {}, deletedRecords {}, earliestDatestamp {}",
      baseUrl, repositoryName, timeGranularity, deletedRecords, earliestDatestamp);
  }

  private static EmailCollection parseEmails(String adminEmails) {
    return new EmailCollection(Arrays.stream(adminEmails.split(","))
      .map(String::trim)
      .filter(StringUtils::isNotEmpty)
      .map(Email::new)
      .collect(toImmutableList()));
  }

  public BaseUrl getBaseUrl() {
    return baseUrl;
  }

  /**
   * @return repository name
   * @throws IllegalStateException if the name is not configured
   */
  public RepositoryName getRepositoryName() {
    if (repositoryName == null) {
      throw new IllegalStateException(String.format("The required repository config '%s' is missing", REPOSITORY_NAME));
    }
    return repositoryName;
  }

  /**
   * @return admin e-mails given as a comma separated list
   * @throws IllegalStateException if no e-mail is configured
   */
  public EmailCollection getAdminEmails() {
    if (adminEmails == null) {
      throw new IllegalStateException(
        String.format("The required repository config '%s' is missing", REPOSITORY_ADMIN_EMAILS));
    }
    return adminEmails;
  }

  public Granularity getTimeGranularity() {
    return timeGranularity;
  }

  public DeletedRecord getDeletedRecords() {
    return deletedRecords;
  }

  public UtcDatetime getEarliestDatestamp() {
    return earliestDatestamp;
  }
}
