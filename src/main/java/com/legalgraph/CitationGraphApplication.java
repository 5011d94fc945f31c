package com.legalgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Each build opens its own embedded database, so no application-wide
 * DataSource is configured.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class CitationGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CitationGraphApplication.class, args);
    }
}
