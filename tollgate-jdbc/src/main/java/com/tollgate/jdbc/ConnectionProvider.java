package com.tollgate.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/** Source of JDBC connections; callers close what they obtain. */
@FunctionalInterface
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;
}
