package com.salesagent.leads;

import com.salesagent.leads.store.StoreSchema;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.UUID;

/**
 * Fresh in-memory H2 database per call, in PostgreSQL mode, with the lead store schema applied.
 */
public final class TestDatabase {

    private TestDatabase() {
    }

    public static JdbcTemplate create() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:leads_" + UUID.randomUUID().toString().replace("-", "")
                        + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
                "sa", "");
        dataSource.setDriverClassName("org.h2.Driver");
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        new StoreSchema(jdbcTemplate).ensureSchema();
        return jdbcTemplate;
    }
}
