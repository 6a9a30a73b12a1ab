package io.intellixity.querydog.jdbc.bind;

import java.sql.Connection;

/** Where a value is going: the open connection (for array creation) and the 1-based marker position. */
public record JdbcBindContext(Connection connection, String name, int position1Based) {}
