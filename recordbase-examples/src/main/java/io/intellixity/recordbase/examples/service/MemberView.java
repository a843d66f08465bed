package io.intellixity.recordbase.examples.service;

import io.intellixity.recordbase.examples.domain.Person;

/** Public projection of a group member; contact details are left out. */
public record MemberView(long id, String name, int age, boolean active) {
  static MemberView of(Person p) {
    return new MemberView(p.id(), p.name(), p.age(), p.active());
  }
}
