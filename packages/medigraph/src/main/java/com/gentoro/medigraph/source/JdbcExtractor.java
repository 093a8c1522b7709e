package com.gentoro.medigraph.source;

import com.gentoro.medigraph.exception.ConfigurationException;
import com.gentoro.medigraph.exception.SourceQueryException;
import com.gentoro.medigraph.exception.SourceUnavailableException;
import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.configuration2.Configuration;

/**
 * {@link Extractor} over a JDBC connection. Each entity type maps to one view; the statement
 * selects exactly that type's column set and caps the result with {@code LIMIT}.
 */
public class JdbcExtractor implements Extractor {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(JdbcExtractor.class);

  private static final Pattern QUALIFIED_NAME =
      Pattern.compile("^[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*){0,2}$");

  private final Connection connection;
  private final Map<EntityType, String> views;

  public JdbcExtractor(Connection connection, Map<EntityType, String> views) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.views = new EnumMap<>(EntityType.class);
    for (EntityType type : EntityType.values()) {
      String view = views.getOrDefault(type, type.defaultSource());
      if (!QUALIFIED_NAME.matcher(view).matches()) {
        throw new ConfigurationException("Invalid source view name for " + type + ": " + view);
      }
      this.views.put(type, view);
    }
  }

  /** Views come from {@code source.views.<entity>}, defaulting to the standard MEDIGRAPH views. */
  public static JdbcExtractor fromConfiguration(Connection connection, Configuration configuration) {
    Map<EntityType, String> views = new EnumMap<>(EntityType.class);
    for (EntityType type : EntityType.values()) {
      views.put(
          type, configuration.getString("source.views." + type.configKey(), type.defaultSource()));
    }
    return new JdbcExtractor(connection, views);
  }

  @Override
  public List<SourceRow> fetch(EntityType entityType, int maxRows) {
    Objects.requireNonNull(entityType, "entityType");
    if (maxRows < 0) {
      throw new IllegalArgumentException("maxRows must be >= 0, got " + maxRows);
    }
    if (maxRows == 0) {
      return List.of();
    }
    String sql = buildQuery(entityType, maxRows);
    log.debug("Extracting {} with: {}", entityType, sql);

    try (PreparedStatement statement = connection.prepareStatement(sql);
        ResultSet rs = statement.executeQuery()) {
      Map<String, Integer> columnIndex = resolveColumns(entityType, rs.getMetaData());
      List<SourceRow> rows = new ArrayList<>();
      while (rs.next()) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String column : entityType.sourceColumns()) {
          values.put(column, rs.getObject(columnIndex.get(column)));
        }
        rows.add(new SourceRow(values));
      }
      log.info(
          "Source returned {} {} rows (capped at {})",
          rows.size(),
          entityType.label().toLowerCase(Locale.ROOT),
          maxRows);
      return rows;
    } catch (SQLException e) {
      if (isConnectionFailure(e)) {
        throw new SourceUnavailableException("Source connection lost while extracting " + entityType, e);
      }
      throw new SourceQueryException(
          entityType,
          "Extract for " + entityType + " from " + views.get(entityType) + " failed: " + e.getMessage(),
          e);
    }
  }

  /** SQL for one entity type's capped extract. Visible for tests. */
  String buildQuery(EntityType entityType, int maxRows) {
    StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(String.join(", ", entityType.sourceColumns()))
            .append(" FROM ")
            .append(views.get(entityType));
    if (entityType.orderByColumn() != null) {
      // The observation table is raw, not a curated view, and may hold rows without an id
      sql.append(" WHERE ").append(entityType.keyColumn()).append(" IS NOT NULL");
      sql.append(" ORDER BY ").append(entityType.orderByColumn());
    }
    sql.append(" LIMIT ").append(maxRows);
    return sql.toString();
  }

  private static Map<String, Integer> resolveColumns(EntityType entityType, ResultSetMetaData meta)
      throws SQLException {
    Map<String, Integer> index = new LinkedHashMap<>();
    for (int i = 1; i <= meta.getColumnCount(); i++) {
      index.putIfAbsent(meta.getColumnLabel(i).toUpperCase(Locale.ROOT), i);
    }
    Set<String> missing = new HashSet<>();
    for (String column : entityType.sourceColumns()) {
      if (!index.containsKey(column)) missing.add(column);
    }
    if (!missing.isEmpty()) {
      throw new SourceQueryException(
          entityType, "Extract for " + entityType + " is missing expected columns " + missing);
    }
    return index;
  }

  /** SQLState class 08 is "connection exception". */
  private static boolean isConnectionFailure(SQLException e) {
    String state = e.getSQLState();
    return state != null && state.startsWith("08");
  }
}
