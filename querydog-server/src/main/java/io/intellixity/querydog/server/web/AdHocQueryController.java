package io.intellixity.querydog.server.web;

import io.intellixity.querydog.exec.AdHocQueryGateway;
import io.intellixity.querydog.exec.AdHocResult;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/query")
public final class AdHocQueryController {
  private final AdHocQueryGateway gateway;

  public AdHocQueryController(AdHocQueryGateway gateway) {
    this.gateway = gateway;
  }

  public record AdHocBody(String query, Integer limit) {}

  @PostMapping
  public AdHocResult run(@RequestBody AdHocBody body) {
    return gateway.execute(body == null ? null : body.query(), body == null ? null : body.limit());
  }
}
