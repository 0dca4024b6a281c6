package com.sldce.backend;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Boots against the Flyway schema and lets Hibernate validate every entity mapping against it.
 */
@SpringBootTest(properties = {
		"spring.flyway.enabled=true",
		"spring.jpa.hibernate.ddl-auto=validate",
		"spring.datasource.url=jdbc:h2:mem:sldce_flyway;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE",
		"spring.datasource.driverClassName=org.h2.Driver",
		"spring.datasource.username=sa",
		"spring.datasource.password="
})
class FlywayMigrationValidationTests {

	@Autowired
	JdbcTemplate jdbcTemplate;

	@Test
	void migrationsApplyAndMatchEntities() {
		Integer applied = jdbcTemplate.queryForObject(
				"select count(*) from flyway_schema_history where success = true", Integer.class);

		assertThat(applied).isEqualTo(2);
	}

}
