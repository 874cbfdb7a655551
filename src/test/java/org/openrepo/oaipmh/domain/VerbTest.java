package org.openrepo.oaipmh.domain;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class VerbTest {

  @ParameterizedTest
  @EnumSource(Verb.class)
  void shouldResolveByProtocolName(Verb verb) {
    assertThat(Verb.fromName(verb.getName()), is(verb));
    assertThat(verb.getAllParams(), hasItem("verb"));
  }

  @Test
  void shouldNotResolveUnknownOrEnumName() {
    assertThat(Verb.fromName("Foo"), is(nullValue()));
    assertThat(Verb.fromName("LIST_RECORDS"), is(nullValue()));
    assertThat(Verb.fromName(null), is(nullValue()));
  }

  @Test
  void shouldCollectAllParams() {
    assertThat(Verb.LIST_RECORDS.getAllParams(),
      containsInAnyOrder("verb", "metadataPrefix", "from", "until", "set", "resumptionToken"));
    assertThat(Verb.GET_RECORD.getAllParams(), containsInAnyOrder("verb", "identifier", "metadataPrefix"));
    assertThat(Verb.IDENTIFY.getAllParams(), containsInAnyOrder("verb"));
  }

  @Test
  void shouldSeparateRequiredOptionalAndExclusiveParams() {
    assertThat(Verb.LIST_RECORDS.getRequiredParams(), containsInAnyOrder("metadataPrefix"));
    assertThat(Verb.LIST_RECORDS.getOptionalParams(), containsInAnyOrder("from", "until", "set"));
    assertThat(Verb.LIST_RECORDS.getExclusiveParam(), is("resumptionToken"));
    assertThat(Verb.LIST_METADATA_FORMATS.getOptionalParams(), containsInAnyOrder("identifier"));
    assertThat(Verb.GET_RECORD.getOptionalParams(), is(empty()));
    assertThat(Verb.IDENTIFY.getExclusiveParam(), is(nullValue()));
  }
}
