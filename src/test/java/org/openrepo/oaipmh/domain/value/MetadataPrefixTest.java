package org.openrepo.oaipmh.domain.value;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.openrepo.oaipmh.exception.ValidationException;

class MetadataPrefixTest {

  @ParameterizedTest
  @ValueSource(strings = {"oai_dc", "marc21", "mods-3.7", "x!~*'()", "A"})
  void shouldKeepValidPrefix(String value) {
    assertThat(new MetadataPrefix(value).getValue(), is(value));
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"oai dc", "oai:dc", "oai/dc", "dc?", "é"})
  void shouldRejectInvalidPrefix(String value) {
    ValidationException e = assertThrows(ValidationException.class, () -> new MetadataPrefix(value));
    assertThat(e.getKind(), is(ValidationException.Kind.INVALID_FORMAT));
    assertThat(e.getField(), is("metadataPrefix"));
  }

  @Test
  void shouldCompareByValue() {
    MetadataPrefix first = new MetadataPrefix("oai_dc");
    MetadataPrefix second = new MetadataPrefix("oai_dc");
    MetadataPrefix third = new MetadataPrefix("oai_dc");

    assertThat(first, is(first));
    assertThat(first, is(second));
    assertThat(second, is(first));
    assertThat(second, is(third));
    assertThat(first, is(third));
    assertThat(first.hashCode(), is(second.hashCode()));
    assertThat(first, is(not(new MetadataPrefix("marc21"))));
    assertThat(first.equals(null), is(false));
  }
}
