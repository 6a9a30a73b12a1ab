package io.intellixity.querydog.jdbc.bind;

import io.intellixity.querydog.compile.Bind;
import io.intellixity.querydog.compile.ParamType;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * Binders for every {@link ParamType} a compiled statement can carry.
 * Earlier entries win when more than one supports a type.
 */
public final class JdbcParamBinders {
  private final List<JdbcParamBinder> binders;

  public JdbcParamBinders() {
    this(List.of(new StringArrayBinder(), new UnsignedBinder(), new TextBinder()));
  }

  public JdbcParamBinders(List<JdbcParamBinder> binders) {
    this.binders = List.copyOf(binders);
  }

  public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind) throws SQLException {
    for (JdbcParamBinder b : binders) {
      if (b.supports(bind.type())) {
        b.bind(ps, ctx, bind);
        return;
      }
    }
    throw new IllegalArgumentException("No binder for parameter '" + ctx.name() + "' of type " + bind.type());
  }

  /** Array(String) as a driver-created SQL array. */
  static final class StringArrayBinder implements JdbcParamBinder {
    @Override public boolean supports(ParamType type) { return type == ParamType.ARRAY_STRING; }

    @Override
    public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind) throws SQLException {
      @SuppressWarnings("unchecked")
      List<String> values = (List<String>) bind.value();
      Array array = ctx.connection().createArrayOf(ParamType.STRING.clickHouseType(), values.toArray(new String[0]));
      ps.setArray(ctx.position1Based(), array);
    }
  }

  /** UInt32/UInt64 values are always non-negative and fit a signed long. */
  static final class UnsignedBinder implements JdbcParamBinder {
    @Override public boolean supports(ParamType type) { return type == ParamType.UINT32 || type == ParamType.UINT64; }

    @Override
    public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind) throws SQLException {
      if (bind.value() == null) {
        ps.setNull(ctx.position1Based(), Types.BIGINT);
      } else if (bind.value() instanceof Number n) {
        ps.setLong(ctx.position1Based(), n.longValue());
      } else {
        throw new IllegalArgumentException("Parameter '" + ctx.name() + "' expects a number, got "
            + bind.value().getClass().getName());
      }
    }
  }

  /** String and DateTime; DateTime values are already store literals. */
  static final class TextBinder implements JdbcParamBinder {
    @Override public boolean supports(ParamType type) { return type == ParamType.STRING || type == ParamType.DATETIME; }

    @Override
    public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind) throws SQLException {
      if (bind.value() == null) ps.setNull(ctx.position1Based(), Types.VARCHAR);
      else ps.setString(ctx.position1Based(), String.valueOf(bind.value()));
    }
  }
}
