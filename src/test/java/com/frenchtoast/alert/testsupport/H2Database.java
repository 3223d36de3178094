package com.frenchtoast.alert.testsupport;

import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;

import java.util.UUID;

/**
 * A fresh in-memory H2 database per call, with the production schema applied.
 */
public final class H2Database {

    private H2Database() {}

    public static DatabaseClient create() {
        String name = "ft-" + UUID.randomUUID();
        ConnectionFactory cf = ConnectionFactories.get("r2dbc:h2:mem:///" + name + ";DB_CLOSE_DELAY=-1");
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).populate(cf).block();
        return DatabaseClient.create(cf);
    }
}
