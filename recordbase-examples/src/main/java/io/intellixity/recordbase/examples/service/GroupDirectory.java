package io.intellixity.recordbase.examples.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.recordbase.examples.domain.Group;
import io.intellixity.recordbase.examples.domain.Person;
import io.intellixity.recordbase.persistence.jdbc.PersistenceController;
import io.intellixity.recordbase.persistence.options.DeleteOptions;
import io.intellixity.recordbase.persistence.options.GetCountOptions;
import io.intellixity.recordbase.persistence.options.GetOptions;
import io.intellixity.recordbase.persistence.options.UpdateMultipleOptions;
import io.intellixity.recordbase.persistence.query.SortField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Groups and their members on top of {@link PersistenceController}. */
public final class GroupDirectory {
  private static final Logger log = LoggerFactory.getLogger(GroupDirectory.class);

  private final PersistenceController controller;
  private final ObjectMapper mapper;

  public GroupDirectory(PersistenceController controller, ObjectMapper mapper) {
    this.controller = Objects.requireNonNull(controller, "controller");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public Group createGroup(String name) {
    Group g = new Group().name(name);
    controller.save(g);
    log.info("recordbase.example group_created id={}", g.id());
    return g;
  }

  public Person addMember(long groupId, String name, String email, int age) {
    Person p = new Person().name(name).email(email).age(age).active(true).groupId(groupId);
    controller.save(p);
    return p;
  }

  /** Null when no group has that identity. */
  public Group findGroup(long id) {
    Group g = new Group();
    controller.load(g, String.valueOf(id));
    return (g.id() == 0) ? null : g;
  }

  public List<MemberView> members(long groupId) {
    List<Object> rows = controller.get(Person::new, GetOptions.<Person>where(Map.of("groupId", groupId))
        .withOrder(List.of(SortField.asc("name"), SortField.asc("id")))
        .withRowTransform(MemberView::of));
    List<MemberView> out = new ArrayList<>(rows.size());
    for (Object o : rows) out.add((MemberView) o);
    return out;
  }

  public String membersJson(long groupId) {
    try {
      return mapper.writeValueAsString(members(groupId));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render members of group " + groupId, e);
    }
  }

  public long memberCount(long groupId) {
    return controller.getCount(Person::new, GetCountOptions.where(Map.of("groupId", groupId)));
  }

  /**
   * Apply form input (string values) to every member of a group.\n
   *
   * Keys that are not person fields and values that do not parse are ignored.
   */
  public void updateMembers(long groupId, Map<String, String> form) {
    controller.updateMultiple(Person::new, form,
        UpdateMultipleOptions.where(Map.of("groupId", groupId)).withConvertValuesFromString());
  }

  public void deactivateMembers(long groupId) {
    controller.updateMultiple(Person::new, Map.of("active", false), UpdateMultipleOptions.where(Map.of("groupId", groupId)));
  }

  /** Delete the group and all of its members. Returns false when the group does not exist. */
  public boolean removeGroup(long id) {
    Group g = findGroup(id);
    if (g == null) return false;
    controller.delete(g, DeleteOptions.cascading(Map.of(Group.PERSONS, Person::new)));
    log.info("recordbase.example group_removed id={}", id);
    return true;
  }
}
