package io.paradedb.operator.crd.paradedb.config;

import io.paradedb.operator.crd.paradedb.ConnectionPoolingSpec;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import org.jspecify.annotations.NullMarked;

/**
 * Renders {@code pgbouncer.ini} for the connection pooler.
 */
@NullMarked
public final class PgBouncerConfigBuilder {
    public static String build(
            ParadeDB paradeDB,
            ConnectionPoolingSpec pooling
    ) {
        var database = paradeDB.getSpec().getAuth().getDatabase();

        return """
                [databases]
                %s = host=%s port=%d dbname=%s

                [pgbouncer]
                listen_addr = 0.0.0.0
                listen_port = %d
                auth_type = md5
                auth_file = /etc/pgbouncer/userlist.txt
                pool_mode = %s
                max_client_conn = %d
                default_pool_size = %d
                min_pool_size = %d
                reserve_pool_size = %d
                admin_users = postgres
                stats_users = postgres
                """.formatted(
                database,
                ParadeDBNames.primaryService(paradeDB),
                ParadeDBNames.POSTGRES_PORT,
                database,
                ParadeDBNames.POSTGRES_PORT,
                pooling.getPoolMode(),
                pooling.getMaxClientConnections(),
                pooling.getDefaultPoolSize(),
                pooling.getMinPoolSize(),
                pooling.getReservePoolSize()
        );
    }

    private PgBouncerConfigBuilder() {
    }
}
