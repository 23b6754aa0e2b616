package com.gentoro.autoreport.query.jdbc;

import com.gentoro.autoreport.query.DataSourceDescriptor;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/** Opens JDBC connections for a descriptor. */
@FunctionalInterface
public interface ConnectionFactory {

  Connection open(DataSourceDescriptor dataSource) throws SQLException;

  /** {@link DriverManager} based factory; the driver must be on the classpath. */
  static ConnectionFactory driverManager() {
    return dataSource -> {
      Properties props = new Properties();
      props.putAll(dataSource.properties());
      if (dataSource.user() != null) {
        props.setProperty("user", dataSource.user());
      }
      if (dataSource.password() != null) {
        props.setProperty("password", dataSource.password());
      }
      return DriverManager.getConnection(dataSource.url(), props);
    };
  }
}
