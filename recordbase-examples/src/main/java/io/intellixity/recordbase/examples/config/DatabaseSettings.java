package io.intellixity.recordbase.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the sample application, bound from {@code recordbase.*}.\n
 *
 * Defaults live in {@code application.properties}; any Spring Boot property source overrides them
 * (e.g. {@code --recordbase.jdbc-url=...} or the {@code RECORDBASE_POOL_SIZE} environment variable).
 */
@ConfigurationProperties(prefix = "recordbase")
public class DatabaseSettings {
  private String jdbcUrl;
  private String username;
  private String password;
  private int poolSize = 4;
  private String tablePrefix = "";

  public String getJdbcUrl() { return jdbcUrl; }
  public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
  public String getUsername() { return username; }
  public void setUsername(String username) { this.username = username; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  public int getPoolSize() { return poolSize; }
  public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
  public String getTablePrefix() { return tablePrefix; }
  public void setTablePrefix(String tablePrefix) { this.tablePrefix = (tablePrefix == null) ? "" : tablePrefix.trim(); }

  /** Fails fast on settings the pool cannot start with. */
  public void requireUsable() {
    if (jdbcUrl == null || jdbcUrl.isBlank()) throw new IllegalStateException("recordbase.jdbc-url is required");
    if (poolSize < 1) throw new IllegalStateException("recordbase.pool-size must be >= 1, got " + poolSize);
  }

  @Override
  public String toString() {
    return "DatabaseSettings{jdbcUrl=" + jdbcUrl + ", username=" + username + ", poolSize=" + poolSize
        + ", tablePrefix=" + tablePrefix + "}";
  }
}
