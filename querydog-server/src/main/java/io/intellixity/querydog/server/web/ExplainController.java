package io.intellixity.querydog.server.web;

import io.intellixity.querydog.exec.ExplainDispatcher;
import io.intellixity.querydog.exec.ExplainMode;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/explain")
public final class ExplainController {
  private final ExplainDispatcher dispatcher;

  public ExplainController(ExplainDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  public record ExplainBody(String query) {}

  @PostMapping
  public List<Map<String, Object>> plan(@RequestBody ExplainBody body) {
    return dispatcher.dispatch(ExplainMode.PLAN, body == null ? null : body.query());
  }

  @PostMapping("/{type}")
  public List<Map<String, Object>> explain(@PathVariable("type") String type, @RequestBody ExplainBody body) {
    return dispatcher.dispatch(type, body == null ? null : body.query());
  }
}
