package io.intellixity.querydog.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "querydog")
public class QueryDogProperties {
  /** Folder scanned for saved {@code *.sql} files, relative to the working directory unless absolute. */
  private String queriesDir = "queries";
  private int adHocDefaultLimit = 1000;
  private int runHistorySize = 100;
  /** Zone that offset-bearing timestamps are converted into before they are bound. */
  private String timeZone = "UTC";

  public String getQueriesDir() { return queriesDir; }
  public void setQueriesDir(String queriesDir) { this.queriesDir = queriesDir; }
  public int getAdHocDefaultLimit() { return adHocDefaultLimit; }
  public void setAdHocDefaultLimit(int adHocDefaultLimit) { this.adHocDefaultLimit = adHocDefaultLimit; }
  public int getRunHistorySize() { return runHistorySize; }
  public void setRunHistorySize(int runHistorySize) { this.runHistorySize = runHistorySize; }
  public String getTimeZone() { return timeZone; }
  public void setTimeZone(String timeZone) { this.timeZone = timeZone; }
}
