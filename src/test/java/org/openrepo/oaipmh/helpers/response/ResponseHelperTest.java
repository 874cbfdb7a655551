package org.openrepo.oaipmh.helpers.response;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_ARGUMENT;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_VERB;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.ID_DOES_NOT_EXIST;

import java.time.temporal.ChronoField;

import org.junit.jupiter.api.Test;
import org.openrepo.oaipmh.Request;
import org.openrepo.oaipmh.domain.Verb;
import org.openrepo.oaipmh.helpers.configuration.RepositoryConfiguration;
import org.openrepo.oaipmh.model.OaiPmhError;
import org.openrepo.oaipmh.model.OaiPmhResponse;
import org.openrepo.oaipmh.model.RequestType;
import org.openrepo.oaipmh.validator.ErrorAccumulator;

class ResponseHelperTest {

  private static final String BASE_URL = "http://localhost/oai";

  private final ResponseHelper responseHelper = new ResponseHelper(new RepositoryConfiguration(BASE_URL, "Test repository",
    "admin@example.org", "YYYY-MM-DDThh:mm:ssZ", "no", "1970-01-01T00:00:00Z"));

  private final Request request = Request.builder()
    .verb(Verb.GET_RECORD)
    .identifier("oai:example.org:1")
    .metadataPrefix("oai_dc")
    .build();

  @Test
  void shouldEchoRequestInBaseResponse() {
    OaiPmhResponse response = responseHelper.buildBaseOaipmhResponse(request);

    assertThat(response.getResponseDate(), is(notNullValue()));
    assertThat(response.getResponseDate().getLong(ChronoField.NANO_OF_SECOND), is(0L));
    assertThat(response.getRequest(), is(new RequestType()
      .withValue(BASE_URL)
      .withVerb("GetRecord")
      .withIdentifier("oai:example.org:1")
      .withMetadataPrefix("oai_dc")));
    assertThat(response.getErrors(), is(empty()));
  }

  @Test
  void shouldEchoRequestWithNonArgumentErrors() {
    OaiPmhResponse response = responseHelper.buildOaipmhResponseWithErrors(request,
      new ErrorAccumulator().add(ID_DOES_NOT_EXIST, "No matching identifier in repository"));

    assertThat(response.getRequest().getVerb(), is("GetRecord"));
    assertThat(response.getErrors(), contains(
      new OaiPmhError().withCode(ID_DOES_NOT_EXIST).withValue("No matching identifier in repository")));
  }

  @Test
  void shouldOmitRequestAttributesWithBadArgument() {
    OaiPmhResponse response = responseHelper.buildOaipmhResponseWithErrors(request,
      new ErrorAccumulator().add(BAD_ARGUMENT, "bad"));

    assertThat(response.getRequest().getValue(), is(BASE_URL));
    assertThat(response.getRequest().getVerb(), is(nullValue()));
    assertThat(response.getRequest().getIdentifier(), is(nullValue()));
  }

  @Test
  void shouldRenderAllErrorsWithoutRequest() {
    OaiPmhResponse response = responseHelper.buildOaipmhResponseWithErrors(null,
      new ErrorAccumulator().add(BAD_VERB, "verb").add(BAD_ARGUMENT, "first").add(BAD_ARGUMENT, "second"));

    assertThat(response.getRequest(), is(new RequestType().withValue(BASE_URL)));
    assertThat(response.getErrors(), contains(
      new OaiPmhError().withCode(BAD_VERB).withValue("verb"),
      new OaiPmhError().withCode(BAD_ARGUMENT).withValue("first"),
      new OaiPmhError().withCode(BAD_ARGUMENT).withValue("second")));
  }
}
