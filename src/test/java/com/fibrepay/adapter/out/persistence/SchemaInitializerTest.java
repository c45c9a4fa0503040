package com.fibrepay.adapter.out.persistence;

import com.fibrepay.support.TestDatabase;
import io.vertx.sqlclient.Row;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fibrepay.support.TestDatabase.await;
import static org.junit.jupiter.api.Assertions.*;

class SchemaInitializerTest {

    @Test
    void statementsOf_dropsCommentsAndBlankStatements() {
        String script = "-- header\n"
                + "CREATE TABLE A (ID INT);\n"
                + "\n"
                + "  -- indented comment\n"
                + "CREATE INDEX IX_A ON A (ID);\n"
                + ";\n";

        List<String> statements = SchemaInitializer.statementsOf(script);

        assertEquals(List.of("CREATE TABLE A (ID INT)", "CREATE INDEX IX_A ON A (ID)"), statements);
    }

    @Test
    void initialize_isRepeatableAndSeedsTaskTypes() {
        try (TestDatabase db = TestDatabase.create()) {
            // Second run must not fail or duplicate the seed rows
            await(new SchemaInitializer(db.vertx(), db.pool()).initialize());

            Row row = await(db.pool().query("SELECT COUNT(*) AS CNT FROM TASK_TYPE").execute()).iterator().next();
            assertEquals(3, row.getInteger("CNT"));
        }
    }
}
