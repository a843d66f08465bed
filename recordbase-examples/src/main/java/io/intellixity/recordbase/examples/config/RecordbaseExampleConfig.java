package io.intellixity.recordbase.examples.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.recordbase.examples.service.GroupDirectory;
import io.intellixity.recordbase.persistence.jdbc.PersistenceController;
import io.intellixity.recordbase.persistence.jdbc.postgres.PostgresSqlGeneratorFactory;
import io.intellixity.recordbase.persistence.schema.SchemaCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(DatabaseSettings.class)
public class RecordbaseExampleConfig {

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(DatabaseSettings settings) {
    settings.requireUsable();
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(settings.getJdbcUrl());
    if (settings.getUsername() != null) hc.setUsername(settings.getUsername());
    if (settings.getPassword() != null) hc.setPassword(settings.getPassword());
    hc.setMaximumPoolSize(settings.getPoolSize());
    hc.setPoolName("recordbase-example");
    return new HikariDataSource(hc);
  }

  @Bean
  public SchemaCache schemaCache(DatabaseSettings settings) {
    return new SchemaCache(new PostgresSqlGeneratorFactory(), settings.getTablePrefix());
  }

  @Bean
  public PersistenceController persistenceController(DataSource dataSource, SchemaCache schemas) {
    return new PersistenceController(dataSource, schemas);
  }

  @Bean
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  @Bean
  public GroupDirectory groupDirectory(PersistenceController controller, ObjectMapper mapper) {
    return new GroupDirectory(controller, mapper);
  }
}
