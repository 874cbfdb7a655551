package org.openrepo.oaipmh.domain.entity;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.openrepo.oaipmh.domain.value.RecordIdentifier;
import org.openrepo.oaipmh.domain.value.SetSpec;
import org.openrepo.oaipmh.domain.value.UtcDatetime;
import org.openrepo.oaipmh.exception.InvariantViolationException;

class RecordTest {

  private static final RecordIdentifier IDENTIFIER = new RecordIdentifier("oai:example.org:1");
  private static final UtcDatetime DATESTAMP = UtcDatetime.parse("2024-01-01T00:00:00Z");

  @Test
  void shouldRejectDeletedRecordWithMetadata() {
    RecordHeader header = deletedHeader();
    Map<String, String> metadata = Map.of("title", "x");

    InvariantViolationException e = assertThrows(InvariantViolationException.class, () -> new Record(header, metadata));
    assertThat(e.getMessage(), is("deleted record cannot carry metadata"));
  }

  @Test
  void shouldAcceptDeletedRecordWithoutMetadata() {
    assertThat(new Record(deletedHeader(), null).getMetadata(), is(nullValue()));
    assertThat(new Record(deletedHeader()).getMetadata(), is(nullValue()));
    assertThat(new Record(deletedHeader()).isDeleted(), is(true));
  }

  @Test
  void shouldCopyMetadata() {
    Map<String, String> metadata = new HashMap<>();
    metadata.put("title", "Title");
    Record record = new Record(new RecordHeader(IDENTIFIER, DATESTAMP), metadata);
    metadata.put("creator", "Creator");

    assertThat(record.getMetadata(), is(Map.of("title", "Title")));
    assertThrows(UnsupportedOperationException.class, () -> record.getMetadata().put("creator", "Creator"));
  }

  @Test
  void shouldCompareByIdentifier() {
    Record first = new Record(new RecordHeader(IDENTIFIER, DATESTAMP), Map.of("title", "a"));
    Record second = new Record(new RecordHeader(IDENTIFIER, UtcDatetime.parse("2024-02-01")), Map.of("title", "b"));

    assertThat(first, is(second));
    assertThat(first.hashCode(), is(second.hashCode()));
    assertThat(first, is(not(new Record(new RecordHeader(new RecordIdentifier("oai:example.org:2"), DATESTAMP)))));
  }

  @Test
  void shouldRequireHeader() {
    assertThrows(NullPointerException.class, () -> new Record(null));
  }

  private static RecordHeader deletedHeader() {
    return new RecordHeader(IDENTIFIER, DATESTAMP, true, List.of(new SetSpec("science")));
  }
}
