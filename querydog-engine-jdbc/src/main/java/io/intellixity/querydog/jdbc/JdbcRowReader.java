package io.intellixity.querydog.jdbc;

import io.intellixity.querydog.query.TimeWindowNormalizer;

import java.net.InetAddress;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.*;

/**
 * Reads a result set into ordered column-label to value maps.
 * <p>
 * Values are normalized to JSON-friendly shapes: arrays become lists, date-times become store
 * literals ({@code yyyy-MM-dd HH:mm:ss}, with microseconds when present), dates become ISO strings,
 * and UUIDs and addresses become strings. Maps and nested arrays are converted recursively.
 */
public final class JdbcRowReader {
  private final ResultSet rs;
  private List<String> labels;

  public JdbcRowReader(ResultSet rs) {
    this.rs = Objects.requireNonNull(rs, "rs");
  }

  public List<Map<String, Object>> readAll() throws SQLException {
    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) out.add(readRow());
    return out;
  }

  /** First column of every row, split on line breaks. */
  public List<String> readLines() throws SQLException {
    List<String> out = new ArrayList<>();
    while (rs.next()) {
      Object v = rs.getObject(1);
      if (v == null) continue;
      out.addAll(Arrays.asList(String.valueOf(v).split("\\r?\\n", -1)));
    }
    return out;
  }

  Map<String, Object> readRow() throws SQLException {
    List<String> l = labels();
    Map<String, Object> row = new LinkedHashMap<>(l.size() * 2);
    for (int i = 0; i < l.size(); i++) row.put(l.get(i), convert(rs.getObject(i + 1)));
    return row;
  }

  private List<String> labels() throws SQLException {
    if (labels == null) {
      ResultSetMetaData md = rs.getMetaData();
      List<String> l = new ArrayList<>(md.getColumnCount());
      for (int i = 1; i <= md.getColumnCount(); i++) l.add(md.getColumnLabel(i));
      labels = l;
    }
    return labels;
  }

  static Object convert(Object v) throws SQLException {
    if (v == null) return null;
    if (v instanceof Array a) return convert(a.getArray());
    if (v.getClass().isArray()) {
      int n = java.lang.reflect.Array.getLength(v);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(convert(java.lang.reflect.Array.get(v, i)));
      return out;
    }
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(convert(x));
      return out;
    }
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), convert(e.getValue()));
      return out;
    }
    if (v instanceof Timestamp t) return dateTime(t.toLocalDateTime());
    if (v instanceof LocalDateTime t) return dateTime(t);
    if (v instanceof OffsetDateTime t) return dateTime(t.toLocalDateTime());
    if (v instanceof ZonedDateTime t) return dateTime(t.toLocalDateTime());
    if (v instanceof java.sql.Date d) return d.toLocalDate().toString();
    if (v instanceof LocalDate d) return d.toString();
    if (v instanceof UUID u) return u.toString();
    if (v instanceof InetAddress ia) return ia.getHostAddress();
    return v;
  }

  static String dateTime(LocalDateTime t) {
    String base = TimeWindowNormalizer.format(t);
    if (t.getNano() == 0) return base;
    return base + String.format(Locale.ROOT, ".%06d", t.getNano() / 1_000);
  }
}
