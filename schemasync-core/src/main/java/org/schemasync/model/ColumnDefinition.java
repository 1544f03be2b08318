package org.schemasync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Structural facts of a single column as reported by a snapshot provider.
 * <p>
 * {@code defaultValue} is a literal (String, Number or Boolean); {@code null} means "no default",
 * which is a different value from an explicit empty-string default.
 * An absent comment is stored as an empty string.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnDefinition {
    private final String type;
    private final Boolean nullable;
    @JsonProperty("default")
    private final Object defaultValue;
    private final String comment;

    @Builder(toBuilder = true)
    @JsonCreator
    public ColumnDefinition(
            @JsonProperty("type")     String type,
            @JsonProperty("nullable") Boolean nullable,
            @JsonProperty("default")  Object defaultValue,
            @JsonProperty("comment")  String comment) {
        this.type = type;
        this.nullable = nullable;
        this.defaultValue = defaultValue;
        this.comment = comment != null ? comment : "";
    }

    public boolean allowsNull() {
        return Boolean.TRUE.equals(nullable);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
