package io.intellixity.querydog.jdbc.bind;

import io.intellixity.querydog.compile.Bind;
import io.intellixity.querydog.compile.ParamType;

import java.sql.PreparedStatement;
import java.sql.SQLException;

public interface JdbcParamBinder {
  boolean supports(ParamType type);

  void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind) throws SQLException;
}
