package org.schemasync.script;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemasync.diff.SchemaDiffer;
import org.schemasync.model.DiffResult;
import org.schemasync.model.SchemaSnapshot;
import org.schemasync.model.SelectionSpec;
import org.schemasync.model.TableDefinition;
import org.schemasync.script.dialect.MySqlDialect;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.schemasync.testing.SnapshotMother.col;
import static org.schemasync.testing.SnapshotMother.orders;
import static org.schemasync.testing.SnapshotMother.snapshot;
import static org.schemasync.testing.SnapshotMother.table;

class ScriptSynthesizerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);
    private final ScriptSynthesizer synthesizer = new ScriptSynthesizer(new MySqlDialect(), clock);
    private final SchemaDiffer differ = new SchemaDiffer();

    private static String normalize(String sql) {
        return sql.replaceAll("\\s+", " ").trim();
    }

    @Test
    @DisplayName("Missing table becomes a CREATE TABLE with its selected columns and primary key")
    void createsMissingTable() {
        SchemaSnapshot source = snapshot("orders", orders());
        SchemaSnapshot target = SchemaSnapshot.empty();
        DiffResult diff = differ.compare(source, target);

        String script = synthesizer.synthesize("prod-vs-staging", source, target, diff,
                List.of("orders"), Map.of("orders", List.of("id", "total")));

        assertThat(script).contains("""
                -- Create missing table: orders
                CREATE TABLE orders (
                    id INTEGER NOT NULL,
                    total DECIMAL DEFAULT 0,
                    PRIMARY KEY (id)
                );
                """);
        assertThat(normalize(script)).contains(
                "CREATE TABLE orders ( id INTEGER NOT NULL, total DECIMAL DEFAULT 0, PRIMARY KEY (id) );");
    }

    @Test
    void headerAndTrailerWrapTheScript() {
        SchemaSnapshot source = snapshot("orders", orders());
        DiffResult diff = differ.compare(source, SchemaSnapshot.empty());

        String script = synthesizer.synthesize("prod-vs-staging", source, SchemaSnapshot.empty(), diff,
                List.of("orders"), Map.of("orders", List.of("id")));

        assertThat(script).startsWith("""
                -- Schema sync script: prod-vs-staging
                -- Generated at: 2024-03-01 10:15:30
                -- Sync mode: structure

                -- Tables selected: 1
                """);
        assertThat(script).endsWith("\n-- Sync complete --\n");
    }

    @Test
    @DisplayName("Unselected columns of a missing table are left out")
    void respectsColumnSelectionOnCreate() {
        TableDefinition users = table()
                .column("id", col("INTEGER", false))
                .column("email", col("VARCHAR(100)", true))
                .column("name", col("VARCHAR(50)", true))
                .pk("id")
                .build();
        SchemaSnapshot source = snapshot("users", users);
        DiffResult diff = differ.compare(source, SchemaSnapshot.empty());

        String script = synthesizer.synthesize("s", source, SchemaSnapshot.empty(), diff,
                List.of("users"), Map.of("users", List.of("name", "id")));

        assertThat(script).doesNotContain("email");
        assertThat(script.indexOf("id INTEGER")).isLessThan(script.indexOf("name VARCHAR(50)"));
    }

    @Test
    void missingTableWithoutSelectedColumnsSkipsCreate() {
        SchemaSnapshot source = snapshot("orders", orders());
        DiffResult diff = differ.compare(source, SchemaSnapshot.empty());

        String script = synthesizer.synthesize("s", source, SchemaSnapshot.empty(), diff, List.of("orders"), Map.of());

        assertThat(script)
                .contains("-- no columns selected for orders; CREATE TABLE skipped")
                .doesNotContain("CREATE TABLE orders");
    }

    @Test
    @DisplayName("Changed column is rewritten to its source definition")
    void modifiesChangedColumn() {
        SchemaSnapshot source = snapshot("items", table().column("price", col("NUMERIC(10,2)", true)).build());
        SchemaSnapshot target = snapshot("items", table().column("price", col("FLOAT", true)).build());
        DiffResult diff = differ.compare(source, target);

        String script = synthesizer.synthesize("s", source, target, diff,
                List.of("items"), Map.of("items", List.of("price")));

        assertThat(script)
                .contains("-- Sync table structure: items\n")
                .contains("ALTER TABLE items MODIFY COLUMN price NUMERIC(10,2);\n")
                .doesNotContain("FLOAT");
    }

    @Test
    void addsMissingColumnInSourceOrder() {
        SchemaSnapshot source = snapshot("users", table()
                .column("id", col("INTEGER", false))
                .column("status", col("VARCHAR(10)", false, "active"))
                .column("age", col("INT", true))
                .build());
        SchemaSnapshot target = snapshot("users", table().column("id", col("INTEGER", false)).build());
        DiffResult diff = differ.compare(source, target);

        String script = synthesizer.synthesize("s", source, target, diff,
                List.of("users"), Map.of("users", List.of("age", "status")));

        String status = "ALTER TABLE users ADD COLUMN status VARCHAR(10) NOT NULL DEFAULT 'active';";
        String age = "ALTER TABLE users ADD COLUMN age INT;";
        assertThat(script).contains(status, age);
        assertThat(script.indexOf(status)).isLessThan(script.indexOf(age));
    }

    @Test
    @DisplayName("All ADD COLUMN statements of a table come before its MODIFY COLUMN statements")
    void addsBeforeModifies() {
        SchemaSnapshot source = snapshot("t", table()
                .column("price", col("INT", true))
                .column("note", col("VARCHAR(10)", true))
                .column("qty", col("BIGINT", false))
                .column("sku", col("VARCHAR(20)", true))
                .build());
        SchemaSnapshot target = snapshot("t", table()
                .column("price", col("FLOAT", true))
                .column("qty", col("INT", false))
                .build());
        DiffResult diff = differ.compare(source, target);

        String script = synthesizer.synthesize("s", source, target, diff,
                List.of("t"), Map.of("t", List.of("price", "note", "qty", "sku")));

        assertThat(script).contains("""
                -- Sync table structure: t
                ALTER TABLE t ADD COLUMN note VARCHAR(10);
                ALTER TABLE t ADD COLUMN sku VARCHAR(20);
                ALTER TABLE t MODIFY COLUMN price INT;
                ALTER TABLE t MODIFY COLUMN qty BIGINT NOT NULL;
                """);
    }

    @Test
    @DisplayName("Target-only table is only ever mentioned as a commented advisory")
    void targetOnlyTableIsAdvisory() {
        SchemaSnapshot target = snapshot("temp_cache", table().column("k", col("VARCHAR(10)", false)).build());
        DiffResult diff = differ.compare(SchemaSnapshot.empty(), target);

        String script = synthesizer.synthesize("s", SchemaSnapshot.empty(), target, diff, List.of("temp_cache"), Map.of());

        assertThat(script)
                .contains("-- Tables that exist only in target\n")
                .contains("-- table exists only in target: temp_cache\n")
                .contains("-- DROP TABLE temp_cache;")
                .doesNotContain("\nDROP TABLE");
    }

    @Test
    void targetOnlyColumnIsAdvisory() {
        SchemaSnapshot source = snapshot("users", table().column("id", col("INTEGER", false)).build());
        SchemaSnapshot target = snapshot("users", table()
                .column("id", col("INTEGER", false))
                .column("legacy_flag", col("CHAR(1)", true))
                .build());
        DiffResult diff = differ.compare(source, target);

        String script = synthesizer.synthesize("s", source, target, diff, List.of("users"), Map.of());

        assertThat(script)
                .contains("-- ALTER TABLE users DROP COLUMN legacy_flag;  -- caution: drops target-only column\n")
                .doesNotContain("\nALTER TABLE users DROP");
    }

    @Test
    void commentOnlyChangeIsNotedWithoutStatements() {
        SchemaSnapshot source = snapshot("t", table().column("id", col("INT", false)).comment("new").build());
        SchemaSnapshot target = snapshot("t", table().column("id", col("INT", false)).comment("old").build());
        DiffResult diff = differ.compare(source, target);

        String script = synthesizer.synthesize("s", source, target, diff, List.of("t"), Map.of("t", List.of("id")));

        assertThat(script)
                .contains("-- Sync table structure: t\n-- table comment differs; not synchronized\n")
                .doesNotContain("ALTER TABLE");
    }

    @Test
    void unknownAndUnchangedTablesProduceNothing() {
        SchemaSnapshot s = snapshot("orders", orders());
        DiffResult diff = differ.compare(s, s);

        String script = synthesizer.synthesize("s", s, s, diff,
                List.of("orders", "ghost"), Map.of("ghost", List.of("x")));

        assertThat(script).isEqualTo("""
                -- Schema sync script: s
                -- Generated at: 2024-03-01 10:15:30
                -- Sync mode: structure

                -- Tables selected: 2

                -- Sync complete --
                """);
    }

    @Test
    void emptySelectionYieldsHeaderAndTrailerOnly() {
        SchemaSnapshot source = snapshot("orders", orders());
        DiffResult diff = differ.compare(source, SchemaSnapshot.empty());

        String script = synthesizer.synthesize(ScriptRequest.builder()
                .source(source)
                .target(SchemaSnapshot.empty())
                .diff(diff)
                .build());

        assertThat(script)
                .startsWith("-- Schema sync script: schema-sync\n")
                .contains("-- Tables selected: 0\n")
                .doesNotContain("CREATE");
    }

    @Test
    void tablesFollowSelectionOrderAndOutputIsDeterministic() {
        SchemaSnapshot source = snapshot("a", orders(), "b", orders());
        DiffResult diff = differ.compare(source, SchemaSnapshot.empty());
        SelectionSpec selection = SelectionSpec.of(List.of("b", "a"),
                Map.of("a", List.of("id"), "b", List.of("id")));
        ScriptRequest request = ScriptRequest.builder()
                .source(source).target(SchemaSnapshot.empty()).diff(diff).selection(selection).build();

        String first = synthesizer.synthesize(request);
        String second = synthesizer.synthesize(request);

        assertThat(first).isEqualTo(second);
        assertThat(first.indexOf("CREATE TABLE b")).isLessThan(first.indexOf("CREATE TABLE a"));
    }

    @Test
    void requestRequiresDiff() {
        assertThatThrownBy(() -> ScriptRequest.builder()
                .source(SchemaSnapshot.empty())
                .target(SchemaSnapshot.empty())
                .build())
                .isInstanceOf(NullPointerException.class)
                .hasMessage("diff must not be null");
    }
}
