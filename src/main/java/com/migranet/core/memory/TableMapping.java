package com.migranet.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Source table name → where it ended up on the target. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TableMapping {

    private final String sourceName;
    private final String targetSchema;
    private final String targetName;

    @JsonCreator
    public TableMapping(
            @JsonProperty("source_name")   String sourceName,
            @JsonProperty("target_schema") String targetSchema,
            @JsonProperty("target_name")   String targetName
    ) {
        this.sourceName   = Objects.requireNonNull(sourceName, "sourceName");
        this.targetSchema = targetSchema != null ? targetSchema : "dbo";
        this.targetName   = targetName != null ? targetName : sourceName;
    }

    @JsonProperty("source_name")   public String getSourceName()   { return sourceName; }
    @JsonProperty("target_schema") public String getTargetSchema() { return targetSchema; }
    @JsonProperty("target_name")   public String getTargetName()   { return targetName; }

    public String getQualifiedTarget() {
        return "[" + targetSchema + "].[" + targetName + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableMapping)) return false;
        TableMapping that = (TableMapping) o;
        return sourceName.equals(that.sourceName)
                && targetSchema.equals(that.targetSchema)
                && targetName.equals(that.targetName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, targetSchema, targetName);
    }

    @Override
    public String toString() {
        return sourceName + " → " + getQualifiedTarget();
    }
}
