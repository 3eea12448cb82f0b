package com.mk.fx.qa.pingit.persistence;

import java.nio.file.Path;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.sqlite.SQLiteDataSource;

/** Builds a repository over a fresh SQLite file with the application schema. */
final class SqliteTestSupport {

  private SqliteTestSupport() {}

  static PingRepository repository(Path dir) {
    var dataSource = new SQLiteDataSource();
    dataSource.setUrl("jdbc:sqlite:" + dir.resolve("pingit-test.db"));
    new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
    return new PingRepository(
        new JdbcTemplate(dataSource), new DataSourceTransactionManager(dataSource));
  }
}
