package com.dcruver.filetaxonomy.app;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * SQLite data source for taxonomy snapshots, the task ledger and suggestions.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(@Value("${taxonomy.storage.database}") String database) throws Exception {
        Path dbPath = expandHome(database, System.getProperty("user.home"));
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());

        return dataSource;
    }

    /** Expands a leading {@code ~} or {@code ~/}; a tilde anywhere else is part of the name. */
    static Path expandHome(String database, String home) {
        if (database.equals("~")) {
            return Paths.get(home);
        }
        if (database.startsWith("~/")) {
            return Paths.get(home, database.substring(2));
        }
        return Paths.get(database);
    }
}
