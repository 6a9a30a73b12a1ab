package io.intellixity.querydog.server.web;

import io.intellixity.querydog.server.config.ClickHouseProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public final class ConnectionInfoController {
  private final ClickHouseProperties props;

  public ConnectionInfoController(ClickHouseProperties props) {
    this.props = props;
  }

  /** Target server details. The password is never echoed. */
  @GetMapping("/api/connection-info")
  public Map<String, Object> info() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("host", props.getHost());
    out.put("port", props.getHttpPort());
    out.put("secure", props.isSecure());
    out.put("user", props.getUser());
    return out;
  }
}
