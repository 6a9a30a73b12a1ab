package io.intellixity.querydog.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "clickhouse")
public class ClickHouseProperties {
  private String host = "localhost";
  private int httpPort = 8123;
  private boolean secure;
  private String user = "default";
  private String password = "";
  private String database = "default";
  private int poolSize = 10;

  public String getHost() { return host; }
  public void setHost(String host) { this.host = host; }
  public int getHttpPort() { return httpPort; }
  public void setHttpPort(int httpPort) { this.httpPort = httpPort; }
  public boolean isSecure() { return secure; }
  public void setSecure(boolean secure) { this.secure = secure; }
  public String getUser() { return user; }
  public void setUser(String user) { this.user = user; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  public String getDatabase() { return database; }
  public void setDatabase(String database) { this.database = database; }
  public int getPoolSize() { return poolSize; }
  public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

  /** HTTP-protocol JDBC URL; TLS is switched on through the driver's ssl option. */
  public String jdbcUrl() {
    String db = (database == null || database.isBlank()) ? "" : "/" + database;
    return "jdbc:clickhouse:http://" + host + ":" + httpPort + db + (secure ? "?ssl=true" : "");
  }
}
