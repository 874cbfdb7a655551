package org.openrepo.oaipmh.domain.value;

import static com.google.common.collect.ImmutableList.toImmutableList;

import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.openrepo.oaipmh.exception.ValidationException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Non-empty list of administrator e-mails without duplicates. Equality ignores order.
 */
public final class EmailCollection implements Iterable<Email> {

  private final List<Email> emails;

  public EmailCollection(Collection<Email> emails) {
    if (emails == null || emails.isEmpty()) {
      throw ValidationException.emptyCollection("email");
    }
    Set<Email> seen = new HashSet<>();
    for (Email email : emails) {
      if (!seen.add(email)) {
        throw ValidationException.duplicateValue("email", email.getValue());
      }
    }
    this.emails = ImmutableList.copyOf(emails);
  }

  public static EmailCollection of(Email... emails) {
    return new EmailCollection(List.of(emails));
  }

  public List<String> getValues() {
    return emails.stream()
      .map(Email::getValue)
      .collect(toImmutableList());
  }

  public int size() {
    return emails.size();
  }

  @Override
  public Iterator<Email> iterator() {
    return emails.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EmailCollection)) {
      return false;
    }
    return ImmutableSet.copyOf(emails).equals(ImmutableSet.copyOf(((EmailCollection) o).emails));
  }

  @Override
  public int hashCode() {
    return ImmutableSet.copyOf(emails).hashCode();
  }

  @Override
  public String toString() {
    return emails.toString();
  }
}
