package org.schemasync.script;

import org.junit.jupiter.api.Test;
import org.schemasync.model.ColumnAttribute;
import org.schemasync.model.ColumnChange;
import org.schemasync.script.dialect.MySqlDialect;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.schemasync.testing.SnapshotMother.col;

class AlterTableBuilderTest {

    @Test
    void groupsStatementsRegardlessOfInsertionOrder() {
        String sql = new AlterTableBuilder("users", new MySqlDialect())
                .note("table comment differs; not synchronized")
                .dropColumnAdvisory("legacy")
                .modifyColumn("age", new ColumnChange(col("INT", true), col("SMALLINT", true), Set.of(ColumnAttribute.TYPE)))
                .addColumn("email", col("VARCHAR(100)", true))
                .build();

        assertThat(sql).isEqualTo("""
                -- Sync table structure: users
                ALTER TABLE users ADD COLUMN email VARCHAR(100);
                ALTER TABLE users MODIFY COLUMN age INT;
                -- ALTER TABLE users DROP COLUMN legacy;  -- caution: drops target-only column
                -- table comment differs; not synchronized
                """);
    }

    @Test
    void emptyBlockIsOnlyTheHeader() {
        assertThat(new AlterTableBuilder("users", new MySqlDialect()).build())
                .isEqualTo("-- Sync table structure: users\n");
    }
}
