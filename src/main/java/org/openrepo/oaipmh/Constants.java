package org.openrepo.oaipmh;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;

public final class Constants {

  private Constants() {
    throw new IllegalStateException("This class holds constants only");
  }

  /**
   * Strict ISO Date and Time with UTC offset.
   * Represents {@linkplain org.openrepo.oaipmh.domain.Granularity#YYYY_MM_DD_THH_MM_SS_Z YYYY_MM_DD_THH_MM_SS_Z} granularity
   */
  public static final String ISO_DATE_TIME_PATTERN = "uuuu-MM-dd'T'HH:mm:ss'Z'";
  public static final String ISO_DATE_ONLY_PATTERN = "uuuu-MM-dd";
  public static final DateTimeFormatter ISO_UTC_DATE_TIME = DateTimeFormatter.ofPattern(ISO_DATE_TIME_PATTERN)
    .withResolverStyle(ResolverStyle.STRICT);
  public static final DateTimeFormatter ISO_UTC_DATE_ONLY = DateTimeFormatter.ofPattern(ISO_DATE_ONLY_PATTERN)
    .withResolverStyle(ResolverStyle.STRICT);

  public static final String JAXB_MARSHALLER_FORMATTED_OUTPUT = "jaxb.marshaller.formattedOutput";
  public static final String OAI_PMH_NAMESPACE = "http://www.openarchives.org/OAI/2.0/";
  public static final String OAI_PMH_SCHEMA_LOCATION = OAI_PMH_NAMESPACE + " http://www.openarchives.org/OAI/2.0/OAI-PMH.xsd";

  public static final String REPOSITORY_BASE_URL = "repository.baseURL";
  public static final String REPOSITORY_NAME = "repository.name";
  public static final String REPOSITORY_ADMIN_EMAILS = "repository.adminEmails";
  public static final String REPOSITORY_TIME_GRANULARITY = "repository.timeGranularity";
  public static final String REPOSITORY_DELETED_RECORDS = "repository.deletedRecords";
  public static final String REPOSITORY_EARLIEST_DATESTAMP = "repository.earliestDatestamp";
  public static final String REPOSITORY_PROTOCOL_VERSION_2_0 = "2.0";

  /** Raw query strings longer than this are rejected before tokenization. */
  public static final int MAX_QUERY_LENGTH = 1000;

  public static final String VERB_PARAM = "verb";
  public static final String FROM_PARAM = "from";
  public static final String IDENTIFIER_PARAM = "identifier";
  public static final String METADATA_PREFIX_PARAM = "metadataPrefix";
  public static final String RESUMPTION_TOKEN_PARAM = "resumptionToken";
  public static final String SET_PARAM = "set";
  public static final String UNTIL_PARAM = "until";

  public static final String REQUEST_TOO_LONG_ERROR = "Request is too long. Maximum length is %d characters.";
  public static final String VERB_MISSING_ERROR = "The verb argument is missing in the request";
  public static final String VERB_REPEATED_ERROR = "The verb argument is repeated in the request";
  public static final String VERB_NOT_SUPPORTED_ERROR = "The value '%s' of the verb argument is not supported by the OAI-PMH protocol";
  public static final String VERB_NOT_IMPLEMENTED_ERROR = "The verb '%s' is not supported by this repository";
  public static final String ILLEGAL_ARGUMENT_ERROR = "Illegal argument '%s' in the request";
  public static final String REPEATED_ARGUMENT_ERROR = "Argument '%s' is repeated in the request";

  public static final String EXCLUSIVE_PARAM_ERROR = "Verb '%s', argument '%s' is exclusive, no others maybe specified with it.";
  public static final String MISSING_REQUIRED_PARAMETERS_ERROR = "Missing required parameters: %s";
  public static final String ILLEGAL_VERB_PARAM_ERROR = "Verb '%s', illegal argument: %s";
  public static final String BAD_DATESTAMP_FORMAT_ERROR = "Bad datestamp format for '%s=%s' argument.";
  public static final String BAD_ARGUMENT_VALUE_ERROR = "Bad value for '%s=%s' argument.";
  public static final String DATE_RANGE_GRANULARITY_ERROR = "Invalid date range: 'from' must have the same granularity as 'until'.";
  public static final String DATE_RANGE_ORDER_ERROR = "Invalid date range: 'from' must be less than or equal to 'until'.";

  public static final String DELETED_RECORD_WITH_METADATA_ERROR = "deleted record cannot carry metadata";
}
