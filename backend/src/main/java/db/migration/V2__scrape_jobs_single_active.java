package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * At most one PENDING or LOCKED job per target. Partial indexes are PostgreSQL only; other stores rely on the
 * conditional insert in the job repository.
 */
public class V2__scrape_jobs_single_active extends BaseJavaMigration {
  private static final String INDEX_NAME = "uq_scrape_jobs_active_target";

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    if (!isPostgres(connection)) {
      return;
    }
    try (Statement statement = connection.createStatement()) {
      statement.executeUpdate(
          "CREATE UNIQUE INDEX IF NOT EXISTS "
              + INDEX_NAME
              + " ON scrape_jobs (target_type, target_key) "
              + "WHERE status IN ('PENDING', 'LOCKED')");
    }
  }

  private boolean isPostgres(Connection connection) throws SQLException {
    String productName = connection.getMetaData().getDatabaseProductName();
    return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
  }
}
