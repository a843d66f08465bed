package io.intellixity.recordbase.examples;

import io.intellixity.recordbase.examples.config.DatabaseSettings;
import io.intellixity.recordbase.examples.domain.Group;
import io.intellixity.recordbase.examples.service.GroupDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.Map;

/**
 * Walks through the controller operations against the configured database.\n
 *
 * Expects the tables from {@code schema-postgres.sql} to exist.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class SampleApp {
  private static final Logger log = LoggerFactory.getLogger(SampleApp.class);

  public static void main(String[] args) {
    SpringApplication.run(SampleApp.class, args);
  }

  @Bean
  CommandLineRunner groupWalkthrough(DatabaseSettings settings, GroupDirectory directory) {
    return args -> {
      log.info("recordbase.example starting settings={}", settings);

      Group g = directory.createGroup("Climbing club");
      directory.addMember(g.id(), "Ada", "ada@example.org", 36);
      directory.addMember(g.id(), "Lin", "", 29);
      directory.updateMembers(g.id(), Map.of("age", "30"));
      log.info("recordbase.example members={}", directory.membersJson(g.id()));

      directory.removeGroup(g.id());
      log.info("recordbase.example remaining_members={}", directory.memberCount(g.id()));
    };
  }
}
