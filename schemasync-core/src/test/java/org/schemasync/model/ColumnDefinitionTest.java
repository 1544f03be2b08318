package org.schemasync.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnDefinitionTest {

    @Test
    void absentCommentIsStoredAsEmpty() {
        ColumnDefinition column = ColumnDefinition.builder().type("INT").nullable(true).build();

        assertThat(column.getComment()).isEmpty();
        assertThat(column).isEqualTo(column.toBuilder().comment("").build());
    }

    @Test
    void emptyStringDefaultIsNotTheSameAsNoDefault() {
        ColumnDefinition none = ColumnDefinition.builder().type("VARCHAR(10)").nullable(true).build();
        ColumnDefinition empty = none.toBuilder().defaultValue("").build();

        assertThat(none.hasDefault()).isFalse();
        assertThat(empty.hasDefault()).isTrue();
        assertThat(none).isNotEqualTo(empty);
    }

    @Test
    void missingNullableFlagDoesNotAllowNull() {
        ColumnDefinition column = new ColumnDefinition("INT", null, null, null);

        assertThat(column.allowsNull()).isFalse();
        assertThat(column.getNullable()).isNull();
    }
}
