package com.festivalplatform.testsupport.containers;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.JdbcDatabaseContainer;

/** Builds a plain data source for a running container and resets its schema with Flyway. */
public final class FlywayTestDatabase {
  private FlywayTestDatabase() {}

  public static DataSource dataSource(JdbcDatabaseContainer<?> container) {
    DriverManagerDataSource dataSource = new DriverManagerDataSource();
    dataSource.setDriverClassName(container.getDriverClassName());
    dataSource.setUrl(container.getJdbcUrl());
    dataSource.setUsername(container.getUsername());
    dataSource.setPassword(container.getPassword());
    return dataSource;
  }

  public static DataSource migrated(JdbcDatabaseContainer<?> container) {
    DataSource dataSource = dataSource(container);
    Flyway flyway =
        Flyway.configure()
            .dataSource(dataSource)
            .locations("classpath:db/migration")
            .cleanDisabled(false)
            .load();
    flyway.clean();
    flyway.migrate();
    return dataSource;
  }
}
