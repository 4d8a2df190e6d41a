package villagecompute.autopost.testing;

import java.util.HashMap;
import java.util.Map;

import io.quarkus.test.junit.QuarkusTestProfile;

/**
 * Boots Quarkus against an in-memory H2 database in PostgreSQL mode.
 *
 * <p>
 * The {@code jsonb} domain lets the entities keep their PostgreSQL column definitions.
 *
 * <pre>
 * &#64;QuarkusTest
 * &#64;TestProfile(H2TestProfile.class)
 * class MyStoreTest {
 * }
 * </pre>
 */
public class H2TestProfile implements QuarkusTestProfile {

    private static final String JDBC_URL = "jdbc:h2:mem:autopost-tests;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;"
            + "DB_CLOSE_DELAY=-1;INIT=CREATE DOMAIN IF NOT EXISTS jsonb AS JSON";

    @Override
    public Map<String, String> getConfigOverrides() {
        return new HashMap<>(Map.ofEntries(Map.entry("quarkus.datasource.db-kind", "h2"),
                Map.entry("quarkus.datasource.username", "sa"), Map.entry("quarkus.datasource.password", "sa"),
                Map.entry("quarkus.datasource.jdbc.url", JDBC_URL),
                Map.entry("quarkus.datasource.jdbc.driver", "org.h2.Driver"),
                Map.entry("quarkus.datasource.devservices.enabled", "false"),
                Map.entry("quarkus.hibernate-orm.database.generation", "drop-and-create"),
                Map.entry("autopost.scheduler.recover-on-startup", "false")));
    }

    @Override
    public String getConfigProfile() {
        return "test";
    }
}
