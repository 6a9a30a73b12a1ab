package io.intellixity.querydog.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.querydog.compile.QueryAssembler;
import io.intellixity.querydog.dataset.DatasetCatalog;
import io.intellixity.querydog.exec.AdHocQueryGateway;
import io.intellixity.querydog.exec.ExplainDispatcher;
import io.intellixity.querydog.exec.StatementExecutor;
import io.intellixity.querydog.jdbc.JdbcStatementExecutor;
import io.intellixity.querydog.query.QueryRequestParser;
import io.intellixity.querydog.query.TimeWindowNormalizer;
import io.intellixity.querydog.server.service.InMemoryRunStatsStore;
import io.intellixity.querydog.server.service.RunStatsStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties({ClickHouseProperties.class, QueryDogProperties.class})
public class QueryDogConfig {

  @Bean
  public DataSource clickHouseDataSource(ClickHouseProperties props) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("querydog-clickhouse");
    hc.setJdbcUrl(props.jdbcUrl());
    hc.setUsername(props.getUser());
    hc.setPassword(props.getPassword());
    hc.setMaximumPoolSize(props.getPoolSize());
    // Fail on first use instead of at startup when ClickHouse is not reachable yet.
    hc.setInitializationFailTimeout(-1);
    return new HikariDataSource(hc);
  }

  @Bean
  public StatementExecutor statementExecutor(DataSource clickHouseDataSource) {
    return new JdbcStatementExecutor(clickHouseDataSource);
  }

  @Bean
  public TimeWindowNormalizer timeWindowNormalizer(QueryDogProperties props) {
    return new TimeWindowNormalizer(ZoneId.of(props.getTimeZone()));
  }

  @Bean
  public QueryRequestParser queryRequestParser(ObjectMapper mapper, TimeWindowNormalizer times) {
    return new QueryRequestParser(mapper, times);
  }

  @Bean
  public DatasetCatalog datasetCatalog() {
    return DatasetCatalog.standard();
  }

  @Bean
  public QueryAssembler queryAssembler() {
    return new QueryAssembler();
  }

  @Bean
  public AdHocQueryGateway adHocQueryGateway(StatementExecutor executor, QueryDogProperties props) {
    return new AdHocQueryGateway(executor, props.getAdHocDefaultLimit());
  }

  @Bean
  public ExplainDispatcher explainDispatcher(StatementExecutor executor) {
    return new ExplainDispatcher(executor);
  }

  @Bean(destroyMethod = "clear")
  public RunStatsStore runStatsStore(QueryDogProperties props) {
    return new InMemoryRunStatsStore(props.getRunHistorySize(), Clock.systemUTC());
  }
}
