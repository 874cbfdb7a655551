package org.openrepo.oaipmh.validator;

import static java.lang.String.format;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.is;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_ARGUMENT;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.openrepo.oaipmh.Request;
import org.openrepo.oaipmh.domain.Verb;
import org.openrepo.oaipmh.helpers.configuration.RepositoryConfiguration;

class VerbArgumentsValidatorTest {

  private static final String DAY = "YYYY-MM-DD";
  private static final String SECOND = "YYYY-MM-DDThh:mm:ssZ";

  private final VerbArgumentsValidator validator = new VerbArgumentsValidator(configuration(SECOND));

  @ParameterizedTest
  @MethodSource("validRequests")
  void shouldAcceptValidArguments(Request request) {
    assertThat(validator.validate(request).hasErrors(), is(false));
  }

  private static Stream<Arguments> validRequests() {
    return Stream.of(
      Arguments.of(Request.builder().verb(Verb.IDENTIFY).build()),
      Arguments.of(Request.builder().verb(Verb.LIST_SETS).build()),
      Arguments.of(Request.builder().verb(Verb.LIST_SETS).resumptionToken("token").build()),
      Arguments.of(Request.builder().verb(Verb.LIST_METADATA_FORMATS).build()),
      Arguments.of(Request.builder().verb(Verb.LIST_METADATA_FORMATS).identifier("oai:example.org:1").build()),
      Arguments.of(Request.builder().verb(Verb.GET_RECORD).identifier("oai:example.org:1").metadataPrefix("oai_dc").build()),
      Arguments.of(Request.builder().verb(Verb.LIST_RECORDS).metadataPrefix("oai_dc").from("2024-01-01")
        .until("2024-01-01").set("science:physics").build()),
      Arguments.of(Request.builder().verb(Verb.LIST_IDENTIFIERS).metadataPrefix("oai_dc").from("2024-01-01T00:00:00Z")
        .until("2024-01-01T10:00:00Z").build()),
      Arguments.of(Request.builder().verb(Verb.LIST_IDENTIFIERS).resumptionToken("token").build())
    );
  }

  @ParameterizedTest
  @EnumSource(value = Verb.class, names = {"GET_RECORD", "LIST_RECORDS", "LIST_IDENTIFIERS"})
  void shouldReportMissingRequiredArguments(Verb verb) {
    ErrorAccumulator errors = validator.validate(Request.builder().verb(verb).build());

    String missing = String.join(",", verb.getRequiredParams());
    assertThat(errors.getMessages(BAD_ARGUMENT), contains(format("Missing required parameters: %s", missing)));
  }

  @Test
  void shouldReportArgumentsGivenWithResumptionToken() {
    ErrorAccumulator errors = validator.validate(Request.builder()
      .verb(Verb.LIST_RECORDS)
      .resumptionToken("token")
      .metadataPrefix("oai_dc")
      .build());

    assertThat(errors.getMessages(BAD_ARGUMENT), contains(
      "Verb 'ListRecords', argument 'resumptionToken' is exclusive, no others maybe specified with it."));
  }

  @ParameterizedTest
  @EnumSource(value = Verb.class, names = {"IDENTIFY", "LIST_SETS"})
  void shouldReportIllegalArguments(Verb verb) {
    ErrorAccumulator errors = validator.validate(Request.builder()
      .verb(verb)
      .identifier("oai:example.org:1")
      .from("2024-01-01")
      .build());

    assertThat(errors.getMessages(BAD_ARGUMENT), containsInAnyOrder(
      format("Verb '%s', illegal argument: identifier", verb.getName()),
      format("Verb '%s', illegal argument: from", verb.getName())));
  }

  @Test
  void shouldReportInvalidArgumentValues() {
    ErrorAccumulator errors = validator.validate(Request.builder()
      .verb(Verb.LIST_RECORDS)
      .metadataPrefix("oai dc")
      .set("science::physics")
      .build());

    assertThat(errors.getMessages(BAD_ARGUMENT), contains(
      "Bad value for 'metadataPrefix=oai dc' argument.",
      "Bad value for 'set=science::physics' argument."));
  }

  @Test
  void shouldReportBlankIdentifier() {
    ErrorAccumulator errors = validator.validate(Request.builder()
      .verb(Verb.GET_RECORD)
      .identifier(" ")
      .metadataPrefix("oai_dc")
      .build());

    assertThat(errors.getMessages(BAD_ARGUMENT), contains("Bad value for 'identifier= ' argument."));
  }

  @Test
  void shouldReportBadDatestamps() {
    ErrorAccumulator errors = validator.validate(listRecords("2024-02-30", "2024-01-01T25:00:00Z"));

    assertThat(errors.getMessages(BAD_ARGUMENT), contains(
      "Bad datestamp format for 'from=2024-02-30' argument.",
      "Bad datestamp format for 'until=2024-01-01T25:00:00Z' argument."));
  }

  @Test
  void shouldReportFromAfterUntil() {
    ErrorAccumulator errors = validator.validate(listRecords("2024-01-02", "2024-01-01"));

    assertThat(errors.getMessages(BAD_ARGUMENT),
      contains("Invalid date range: 'from' must be less than or equal to 'until'."));
  }

  @Test
  void shouldReportDifferentGranularity() {
    ErrorAccumulator errors = validator.validate(listRecords("2024-01-01", "2024-01-02T00:00:00Z"));

    assertThat(errors.getMessages(BAD_ARGUMENT),
      contains("Invalid date range: 'from' must have the same granularity as 'until'."));
  }

  @Test
  void shouldAcceptOnlyDaysInDayGranularityRepository() {
    VerbArgumentsValidator dayValidator = new VerbArgumentsValidator(configuration(DAY));

    assertThat(dayValidator.validate(listRecords("2024-01-01", null)).hasErrors(), is(false));
    assertThat(dayValidator.validate(listRecords("2024-01-01T00:00:00Z", null)).getMessages(BAD_ARGUMENT),
      contains("Bad datestamp format for 'from=2024-01-01T00:00:00Z' argument."));
  }

  private static Request listRecords(String from, String until) {
    return Request.builder()
      .verb(Verb.LIST_RECORDS)
      .metadataPrefix("oai_dc")
      .from(from)
      .until(until)
      .build();
  }

  private static RepositoryConfiguration configuration(String granularity) {
    return new RepositoryConfiguration("http://localhost/oai", "Test repository", "admin@example.org", granularity,
      "no", DAY.equals(granularity) ? "2000-01-01" : "2000-01-01T00:00:00Z");
  }
}
