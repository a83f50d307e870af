package classifier.service;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class JdbcDatabaseProbe implements DatabaseProbe {

  private final JdbcTemplate jdbcTemplate;

  public JdbcDatabaseProbe(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void ping() {
    jdbcTemplate.queryForObject("SELECT 1", Integer.class);
  }
}
