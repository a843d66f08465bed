package io.intellixity.recordbase.persistence.jdbc;

import io.intellixity.recordbase.persistence.error.ConversionException;
import io.intellixity.recordbase.persistence.error.MissingValuesException;
import io.intellixity.recordbase.persistence.error.QueryException;
import io.intellixity.recordbase.persistence.error.SchemaException;
import io.intellixity.recordbase.persistence.error.ValidationException;
import io.intellixity.recordbase.persistence.jdbc.TestRecords.Orphan;
import io.intellixity.recordbase.persistence.jdbc.TestRecords.Person;
import io.intellixity.recordbase.persistence.jdbc.TestRecords.PersonName;
import io.intellixity.recordbase.persistence.jdbc.postgres.PostgresSqlGeneratorFactory;
import io.intellixity.recordbase.persistence.options.DeleteMultipleOptions;
import io.intellixity.recordbase.persistence.options.GetCountOptions;
import io.intellixity.recordbase.persistence.options.GetOptions;
import io.intellixity.recordbase.persistence.options.SaveOptions;
import io.intellixity.recordbase.persistence.options.UpdateMultipleOptions;
import io.intellixity.recordbase.persistence.query.SortField;
import io.intellixity.recordbase.persistence.schema.SchemaCache;
import io.intellixity.recordbase.persistence.validate.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Controller behavior against a real temporary SQLite database.\n
 *
 * SQLite accepts the Postgres generator's statements (quoted identifiers, RETURNING, ON CONFLICT).
 */
final class PersistenceControllerTest {
  @TempDir
  Path tempDir;

  private SqliteTestDatabase db;
  private PersistenceController controller;

  @BeforeEach
  void setUp() {
    db = new SqliteTestDatabase(tempDir);
    controller = new PersistenceController(db,
        new SchemaCache(new PostgresSqlGeneratorFactory(), SqliteTestDatabase.TABLE_PREFIX));
  }

  // -- Save / Load --

  @Test
  void saveInsertsAndLoadReturnsEqualFields() {
    Person p = Person.of("Ann", 31, 7L);
    controller.save(p);
    assertTrue(p.id > 0);

    Person loaded = new Person();
    controller.load(loaded, String.valueOf(p.id));
    assertEquals(p.id, loaded.id);
    assertEquals("Ann", loaded.name);
    assertEquals(31, loaded.age);
    assertTrue(loaded.active);
    assertEquals(7L, loaded.groupId);
  }

  @Test
  void saveWithUnknownIdentityInserts() {
    Person p = Person.of("Bob", 40, 0L);
    p.id = 42L;
    controller.save(p);

    Person loaded = new Person();
    controller.load(loaded, "42");
    assertEquals(42L, loaded.id);
    assertEquals("Bob", loaded.name);
  }

  @Test
  void saveWithExistingIdentityUpdatesRow() {
    Person p = Person.of("Cid", 20, 1L);
    controller.save(p);
    p.name = "Cid II";
    p.active = false;
    controller.save(p);

    Person loaded = new Person();
    controller.load(loaded, String.valueOf(p.id));
    assertEquals("Cid II", loaded.name);
    assertFalse(loaded.active);
    assertEquals(1L, db.count("t_persons"));
  }

  @Test
  void updateOnlySaveOfMissingRowIsSilent() {
    Person p = Person.of("Dee", 20, 1L);
    p.id = 99L;
    controller.save(p, SaveOptions.updateOnly());
    assertEquals(0L, db.count("t_persons"));

    p.id = 0L;
    controller.save(p);
    p.age = 21;
    controller.save(p, SaveOptions.updateOnly());
    Person loaded = new Person();
    controller.load(loaded, String.valueOf(p.id));
    assertEquals(21, loaded.age);
  }

  @Test
  void saveRejectsConstraintViolationsWithoutWriting() {
    Person p = Person.of("Eve", 200, 1L);
    ValidationException ex = assertThrows(ValidationException.class, () -> controller.save(p));
    assertEquals("Validate", ex.op());
    assertEquals(List.of("age"), ex.fields());
    assertEquals(0L, db.count("t_persons"));

    Person negative = Person.of("Eve", 20, 1L);
    negative.id = -5L;
    ValidationException ex2 = assertThrows(ValidationException.class, () -> controller.save(negative));
    assertEquals(List.of("id"), ex2.fields());
  }

  @Test
  void loadOfMissingRowResetsRecord() {
    Person p = Person.of("Fay", 33, 3L);
    p.id = 12L;
    controller.load(p, "12");
    assertEquals(0L, p.id);
    assertEquals("", p.name);
    assertEquals(0, p.age);
    assertFalse(p.active);
    assertEquals(0L, p.groupId);
  }

  @Test
  void loadRejectsMalformedAndNegativeIds() {
    Person p = new Person();
    ConversionException ex = assertThrows(ConversionException.class, () -> controller.load(p, "abc"));
    assertEquals("IDToInt", ex.op());
    assertThrows(ConversionException.class, () -> controller.load(p, "-1"));
    assertThrows(ConversionException.class, () -> controller.load(p, null));
  }

  @Test
  void nullStringColumnLoadsAsEmpty() {
    Person p = Person.of(null, 5, 1L);
    controller.save(p);
    Person loaded = new Person();
    loaded.name = "stale";
    controller.load(loaded, String.valueOf(p.id));
    assertEquals("", loaded.name);
  }

  // -- Delete --

  @Test
  void deleteWithZeroIdentityDoesNotTouchDatabase() {
    int before = db.connectionCount();
    controller.delete(new Person());
    assertEquals(before, db.connectionCount());
  }

  @Test
  void deleteWithZeroIdentityStillResolvesSchema() {
    PersistenceController broken = new PersistenceController(db, new SchemaCache((d, o) -> {
      throw new IllegalStateException("no table for " + d.type());
    }));
    int before = db.connectionCount();

    SchemaException ex = assertThrows(SchemaException.class, () -> broken.delete(new Person()));
    assertEquals("ResolveSchema", ex.op());
    assertEquals(before, db.connectionCount());
  }

  @Test
  void deleteRemovesRowAndResetsRecord() {
    Person p = Person.of("Gus", 50, 2L);
    controller.save(p);
    long id = p.id;
    controller.delete(p);

    assertEquals(0L, p.id);
    assertEquals("", p.name);
    assertEquals(0, p.age);
    assertEquals(0L, p.groupId);
    Person loaded = new Person();
    controller.load(loaded, String.valueOf(id));
    assertEquals(0L, loaded.id);
  }

  @Test
  void deleteMultipleReturnsDeletedIdentities() {
    Person a = Person.of("a", 1, 1L);
    Person b = Person.of("b", 2, 2L);
    Person c = Person.of("c", 3, 3L);
    controller.save(a);
    controller.save(b);
    controller.save(c);

    List<Long> ids = controller.deleteMultiple(Person::new,
        DeleteMultipleOptions.where(Map.of("groupId", List.of(1L, 3L))));
    assertEquals(2, ids.size());
    assertTrue(ids.containsAll(List.of(a.id, c.id)));
    assertEquals(1L, db.count("t_persons"));

    assertEquals(List.of(), controller.deleteMultiple(Person::new,
        DeleteMultipleOptions.where(Map.of("groupId", List.of()))));
    assertEquals(1L, db.count("t_persons"));
  }

  // -- UpdateMultiple --

  @Test
  void updateMultipleRejectsEmptyValuesRegardlessOfFilters() {
    MissingValuesException ex = assertThrows(MissingValuesException.class,
        () -> controller.updateMultiple(Person::new, Map.of(), UpdateMultipleOptions.where(Map.of("groupId", 1L))));
    assertEquals("MissingValues", ex.op());
    assertThrows(MissingValuesException.class,
        () -> controller.updateMultiple(Person::new, null, UpdateMultipleOptions.where(Map.of())));
  }

  @Test
  void updateMultipleAssignsValuesOnMatchingRows() {
    controller.save(Person.of("a", 1, 1L));
    controller.save(Person.of("b", 2, 1L));
    controller.save(Person.of("c", 3, 2L));

    controller.updateMultiple(Person::new, Map.of("age", 9, "active", false),
        UpdateMultipleOptions.where(Map.of("groupId", 1L)));

    List<Object> rows = controller.get(Person::new, GetOptions.<Person>where(Map.of("age", 9)));
    assertEquals(2, rows.size());
    for (Object o : rows) assertFalse(((Person) o).active);
    assertEquals(1L, controller.getCount(Person::new, GetCountOptions.where(Map.of("age", 3))));
  }

  @Test
  void updateMultipleConvertsStringValues() {
    controller.save(Person.of("a", 1, 1L));

    Map<String, Object> values = new HashMap<>();
    values.put("age", "30");
    values.put("active", "true");
    values.put("bogus", "x");
    controller.updateMultiple(Person::new, values, UpdateMultipleOptions.where(Map.of()).withConvertValuesFromString());

    Person loaded = (Person) controller.get(Person::new, GetOptions.all()).get(0);
    assertEquals(30, loaded.age);
    assertTrue(loaded.active);
  }

  @Test
  void updateMultipleRejectsValuesLostInConversion() {
    assertThrows(MissingValuesException.class, () -> controller.updateMultiple(Person::new,
        Map.of("age", "not-a-number"), UpdateMultipleOptions.where(Map.of()).withConvertValuesFromString()));
  }

  // -- Unknown keys --

  @Test
  void unknownKeysAreRejectedAndReported() {
    Map<String, Object> bogus = Map.of("bogus", 1L);

    ValidationException get = assertThrows(ValidationException.class,
        () -> controller.get(Person::new, GetOptions.<Person>where(bogus)));
    assertEquals("ValidateFilters", get.op());
    assertEquals(List.of("bogus"), get.fields());

    assertThrows(ValidationException.class, () -> controller.getCount(Person::new, GetCountOptions.where(bogus)));
    assertThrows(ValidationException.class, () -> controller.deleteMultiple(Person::new, DeleteMultipleOptions.where(bogus)));

    ValidationException values = assertThrows(ValidationException.class,
        () -> controller.updateMultiple(Person::new, bogus, UpdateMultipleOptions.where(Map.of())));
    assertEquals("ValidateValues", values.op());

    ValidationException filters = assertThrows(ValidationException.class,
        () -> controller.updateMultiple(Person::new, Map.of("age", 1), UpdateMultipleOptions.where(bogus)));
    assertEquals("ValidateFilters", filters.op());

    ValidationException order = assertThrows(ValidationException.class,
        () -> controller.get(Person::new, GetOptions.<Person>all().withOrder(List.of(SortField.asc("bogus")))));
    assertEquals("ValidateOrder", order.op());
  }

  @Test
  void nullFilterKeyIsReportedAsValidationFailure() {
    Map<String, Object> filters = new HashMap<>();
    filters.put(null, 1L);

    ValidationException get = assertThrows(ValidationException.class,
        () -> controller.get(Person::new, GetOptions.<Person>where(filters)));
    assertEquals(List.of("null"), get.fields());
    assertThrows(ValidationException.class, () -> controller.deleteMultiple(Person::new, DeleteMultipleOptions.where(filters)));

    ValidationException values = assertThrows(ValidationException.class,
        () -> controller.updateMultiple(Person::new, filters, UpdateMultipleOptions.where(Map.of())));
    assertEquals("ValidateValues", values.op());
    assertEquals(List.of("null"), values.fields());
  }

  @Test
  void wrongValueKindIsRejected() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> controller.getCount(Person::new, GetCountOptions.where(Map.of("age", "old"))));
    assertEquals(List.of("age"), ex.fields());
  }

  // -- Get / GetCount --

  @Test
  void getSortsPagesAndTransformsRows() {
    for (int i = 1; i <= 5; i++) controller.save(Person.of("p" + i, i * 10, 1L));

    List<Object> names = controller.get(Person::new, GetOptions.<Person>where(Map.of("groupId", 1L))
        .withOrder(List.of(SortField.desc("age")))
        .withPage(2, 1)
        .withRowTransform(p -> p.name));
    assertEquals(List.of("p4", "p3"), names);

    List<Object> all = controller.get(Person::new, GetOptions.<Person>all().withOrder(List.of(SortField.asc("id"))));
    assertEquals(5, all.size());
    assertEquals("p1", ((Person) all.get(0)).name);
    assertNotSame(all.get(0), all.get(1));
  }

  @Test
  void getCountHonorsFilters() {
    controller.save(Person.of("a", 1, 1L));
    controller.save(Person.of("b", 2, 2L));
    controller.save(Person.of("c", 3, 2L));

    assertEquals(3L, controller.getCount(Person::new, GetCountOptions.all()));
    assertEquals(2L, controller.getCount(Person::new, GetCountOptions.where(Map.of("groupId", 2L))));
    assertEquals(0L, controller.getCount(Person::new, GetCountOptions.where(Map.of("groupId", List.of()))));
  }

  // -- Schema pass-throughs --

  @Test
  void projectionRegisteredWithParentReadsParentTable() {
    Person p = Person.of("Hal", 44, 1L);
    controller.save(p);

    controller.register(new PersonName(), new Person(), false);
    PersonName name = new PersonName();
    controller.load(name, String.valueOf(p.id));
    assertEquals("Hal", name.name);
    assertEquals(p.id, name.id);
  }

  @Test
  void fieldNameForColumnMapsBack() {
    assertEquals("groupId", controller.fieldNameForColumn(new Person(), "group_id"));
    SchemaException ex = assertThrows(SchemaException.class,
        () -> controller.fieldNameForColumn(new Person(), "nope"));
    assertTrue(ex.getMessage().contains("nope"));
  }

  @Test
  void validateReportsInvalidValues() {
    ValidationResult ok = controller.validate(Person.of("Ivy", 3, 1L), Map.of());
    assertTrue(ok.valid());
    ValidationResult bad = controller.validate(new Person(), Map.of("age", -1, "name", "x"));
    assertFalse(bad.valid());
    assertEquals(List.of("age"), bad.invalidFields());
  }

  @Test
  void driverFailureSurfacesAsQueryException() {
    QueryException ex = assertThrows(QueryException.class,
        () -> controller.getCount(Orphan::new, GetCountOptions.all()));
    assertEquals("DBQuery", ex.op());
    assertNotNull(ex.getCause());
  }
}
