package io.intellixity.querydog.server.web;

import io.intellixity.querydog.exec.AdHocQueryGateway;
import io.intellixity.querydog.exec.AdHocResult;
import io.intellixity.querydog.exec.ExplainDispatcher;
import io.intellixity.querydog.query.QueryValidationException;
import io.intellixity.querydog.server.FakeStatementExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AdHocQueryControllerTest {
  private FakeStatementExecutor executor;

  @BeforeEach
  void setUp() {
    executor = new FakeStatementExecutor();
  }

  @Test
  void appliesDefaultLimit() {
    AdHocQueryController c = new AdHocQueryController(new AdHocQueryGateway(executor, 500));
    executor.rows = List.of(Map.of("n", 1));

    AdHocResult r = c.run(new AdHocQueryController.AdHocBody("SELECT 1;", null));

    assertEquals(1, r.rowCount());
    assertEquals("SELECT 1 LIMIT :limit", executor.last().sql());
    assertEquals(500, executor.last().bindings().get("limit").value());
  }

  @Test
  void missingBodyIsRejected() {
    AdHocQueryController c = new AdHocQueryController(new AdHocQueryGateway(executor, 500));
    QueryValidationException e = assertThrows(QueryValidationException.class, () -> c.run(null));
    assertEquals(QueryValidationException.Reason.MISSING_QUERY, e.reason());
  }

  @Test
  void explainWithoutTypeUsesPlan() {
    ExplainController c = new ExplainController(new ExplainDispatcher(executor));
    executor.rows = List.of(Map.of("explain", "Expression"));

    List<Map<String, Object>> out = c.plan(new ExplainController.ExplainBody("SELECT 1"));

    assertEquals("EXPLAIN SELECT 1", executor.last().sql());
    assertEquals(executor.rows, out);
  }

  @Test
  void syntaxComesBackAsLines() {
    ExplainController c = new ExplainController(new ExplainDispatcher(executor));
    executor.lines = List.of("SELECT 1", "", "FROM t");

    List<Map<String, Object>> out = c.explain("syntax", new ExplainController.ExplainBody("select 1 from t"));

    assertEquals("EXPLAIN SYNTAX select 1 from t", executor.last().sql());
    assertEquals(2, out.size());
    assertEquals("FROM t", out.get(1).get(ExplainDispatcher.TEXT_COLUMN));
  }

  @Test
  void unknownExplainTypeIsRejected() {
    ExplainController c = new ExplainController(new ExplainDispatcher(executor));
    QueryValidationException e = assertThrows(QueryValidationException.class,
        () -> c.explain("bogus", new ExplainController.ExplainBody("SELECT 1")));
    assertEquals(QueryValidationException.Reason.INVALID_EXPLAIN_MODE, e.reason());
    assertTrue(executor.seen.isEmpty());
  }
}
