package com.gentoro.autoreport.query;

import java.util.Map;

/**
 * Connection descriptor handed to the schema and query collaborators.
 *
 * @param id stable identifier, also part of the result cache key
 * @param url JDBC url or any locator the executor understands
 */
public record DataSourceDescriptor(
    String id, String url, String user, String password, Map<String, String> properties) {

  public DataSourceDescriptor {
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }

  public static DataSourceDescriptor of(String id) {
    return new DataSourceDescriptor(id, null, null, null, Map.of());
  }

  @Override
  public String toString() {
    return "DataSourceDescriptor[id=" + id + ", url=" + url + ", user=" + user + "]";
  }
}
