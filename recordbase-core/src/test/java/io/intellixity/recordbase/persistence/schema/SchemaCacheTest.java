package io.intellixity.recordbase.persistence.schema;

import io.intellixity.recordbase.persistence.error.SchemaException;
import io.intellixity.recordbase.persistence.record.FieldKind;
import io.intellixity.recordbase.persistence.record.Persistable;
import io.intellixity.recordbase.persistence.record.RecordDescriptor;
import io.intellixity.recordbase.persistence.record.SamplePerson;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaCacheTest {
  /** Minimal dialect: unquoted identifiers, no paging or returning. */
  private static final class PlainGenerator extends AbstractSqlGenerator {
    PlainGenerator(RecordDescriptor d, GeneratorOptions o) { super(d, o); }

    @Override protected String quoteIdent(String ident) { return ident; }

    @Override protected String applyPage(String sql, int limit, int offset) { return sql; }

    @Override protected String applyReturning(String sql, String column) { return sql; }

    @Override protected String renderUpsert(String table, String identityColumn, List<String> dataColumns) {
      throw new UnsupportedOperationException();
    }
  }

  private static final class CountingFactory implements SqlGeneratorFactory {
    final AtomicInteger created = new AtomicInteger();
    final List<GeneratorOptions> options = new ArrayList<>();

    @Override
    public synchronized SqlGenerator create(RecordDescriptor descriptor, GeneratorOptions o) {
      created.incrementAndGet();
      options.add(o);
      return new PlainGenerator(descriptor, o);
    }
  }

  private static Persistable bare(RecordDescriptor d) {
    return new Persistable() {
      @Override public RecordDescriptor descriptor() { return d; }
      @Override public Object get(String field) { return null; }
      @Override public void set(String field, Object value) {}
    };
  }

  @Test
  void resolvesLazilyOncePerType() {
    CountingFactory f = new CountingFactory();
    SchemaCache cache = new SchemaCache(f, "x_");

    SqlGenerator g1 = cache.resolve(new SamplePerson());
    SqlGenerator g2 = cache.resolve(SamplePerson.valid());
    assertSame(g1, g2);
    assertEquals(1, f.created.get());
    assertEquals("x_sample_persons", g1.table());
    assertTrue(cache.isRegistered("SamplePerson"));
  }

  @Test
  void registerKeepsExistingUnlessOverwritten() {
    CountingFactory f = new CountingFactory();
    SchemaCache cache = new SchemaCache(f);
    SqlGenerator first = cache.resolve(new SamplePerson());

    cache.register(new SamplePerson(), null, false);
    assertSame(first, cache.resolve(new SamplePerson()));

    cache.register(new SamplePerson(), null, true);
    assertNotSame(first, cache.resolve(new SamplePerson()));
    assertEquals(2, f.created.get());
  }

  @Test
  void childRegisteredWithParentSharesParentTable() {
    CountingFactory f = new CountingFactory();
    SchemaCache cache = new SchemaCache(f, "x_");
    RecordDescriptor view = RecordDescriptor.builder("PersonCard").field("name", FieldKind.STRING).build();

    cache.register(bare(view), new SamplePerson(), false);

    SqlGenerator g = cache.resolve(bare(view));
    assertEquals("x_sample_persons", g.table());
    GeneratorOptions childOptions = f.options.get(f.options.size() - 1);
    assertEquals("SamplePerson", childOptions.forcedName());
    assertNotNull(childOptions.source());
  }

  @Test
  void generatorFailuresBecomeSchemaExceptions() {
    SchemaCache cache = new SchemaCache((d, o) -> { throw new IllegalStateException("boom"); });
    SchemaException reg = assertThrows(SchemaException.class, () -> cache.register(new SamplePerson(), null, false));
    assertEquals("RegisterSchema", reg.op());
    assertInstanceOf(IllegalStateException.class, reg.getCause());

    SchemaException res = assertThrows(SchemaException.class, () -> cache.resolve(new SamplePerson()));
    assertEquals("ResolveSchema", res.op());
    assertFalse(cache.isRegistered("SamplePerson"));
  }

  @Test
  void invalidFieldNamesAreRejectedAtRegistration() {
    RecordDescriptor bad = RecordDescriptor.builder("Bad").field("semi;colon", FieldKind.STRING).build();
    SchemaCache cache = new SchemaCache(new CountingFactory());
    assertThrows(SchemaException.class, () -> cache.resolve(bare(bad)));
  }

  @Test
  void fieldNameForColumnReverseMaps() {
    SchemaCache cache = new SchemaCache(new CountingFactory());
    assertEquals("active", cache.fieldNameForColumn(new SamplePerson(), "active"));
    assertEquals("id", cache.fieldNameForColumn(new SamplePerson(), "id"));
    assertThrows(SchemaException.class, () -> cache.fieldNameForColumn(new SamplePerson(), "missing"));
  }

  @Test
  void concurrentFirstUseBuildsOneGenerator() throws Exception {
    CountingFactory f = new CountingFactory();
    SchemaCache cache = new SchemaCache(f);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<SqlGenerator>> futures = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return cache.resolve(new SamplePerson());
        }));
      }
      start.countDown();
      SqlGenerator first = futures.get(0).get(5, TimeUnit.SECONDS);
      for (Future<SqlGenerator> fu : futures) assertSame(first, fu.get(5, TimeUnit.SECONDS));
      assertEquals(1, f.created.get());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void plainGeneratorRendersSharedStatements() {
    SqlGenerator g = new SchemaCache(new CountingFactory()).resolve(new SamplePerson());
    assertEquals("SELECT COUNT(*) FROM sample_persons WHERE age = ? AND score IN (?, ?)",
        g.selectCount(new TreeMap<>(Map.of("score", List.of(1L, 2L), "age", 3))));
  }
}
