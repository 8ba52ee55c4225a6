package com.migranet.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.migranet.core.model.ObjectKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Target-side shape of a deployed object, as reported by metadata refresh.
 * Procedural objects carry no columns.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ObjectDescription {

    private final String                      schema;
    private final String                      name;
    private final ObjectKind                  kind;
    private final List<ColumnDescription>     columns;
    private final List<ConstraintDescription> constraints;

    @JsonCreator
    public ObjectDescription(
            @JsonProperty("schema")      String schema,
            @JsonProperty("name")        String name,
            @JsonProperty("kind")        ObjectKind kind,
            @JsonProperty("columns")     List<ColumnDescription> columns,
            @JsonProperty("constraints") List<ConstraintDescription> constraints
    ) {
        this.schema      = schema;
        this.name        = Objects.requireNonNull(name, "name");
        this.kind        = kind != null ? kind : ObjectKind.TABLE;
        this.columns     = columns != null ? List.copyOf(columns) : List.of();
        this.constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    @JsonProperty("schema")      public String                      getSchema()      { return schema; }
    @JsonProperty("name")        public String                      getName()        { return name; }
    @JsonProperty("kind")        public ObjectKind                  getKind()        { return kind; }
    @JsonProperty("columns")     public List<ColumnDescription>     getColumns()     { return columns; }
    @JsonProperty("constraints") public List<ConstraintDescription> getConstraints() { return constraints; }

    /** Names of the identity columns, in column order. */
    @JsonIgnore
    public List<String> getIdentityColumns() {
        return columns.stream()
                .filter(ColumnDescription::isIdentity)
                .map(ColumnDescription::getName)
                .collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectDescription)) return false;
        ObjectDescription that = (ObjectDescription) o;
        return Objects.equals(schema, that.schema)
                && name.equals(that.name)
                && kind == that.kind
                && columns.equals(that.columns)
                && constraints.equals(that.constraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, name, kind, columns, constraints);
    }

    @Override
    public String toString() {
        return "ObjectDescription{" + schema + "." + name + ", columns=" + columns.size()
                + ", constraints=" + constraints.size() + "}";
    }

    // =========================================================================
    // Nested descriptions
    // =========================================================================

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ColumnDescription {

        private final String  name;
        private final String  dataType;
        private final boolean nullable;
        private final boolean identity;

        @JsonCreator
        public ColumnDescription(
                @JsonProperty("name")      String name,
                @JsonProperty("data_type") String dataType,
                @JsonProperty("nullable")  boolean nullable,
                @JsonProperty("identity")  boolean identity
        ) {
            this.name     = Objects.requireNonNull(name, "name");
            this.dataType = dataType != null ? dataType : "";
            this.nullable = nullable;
            this.identity = identity;
        }

        @JsonProperty("name")      public String  getName()     { return name; }
        @JsonProperty("data_type") public String  getDataType() { return dataType; }
        @JsonProperty("nullable")  public boolean isNullable()  { return nullable; }
        @JsonProperty("identity")  public boolean isIdentity()  { return identity; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ColumnDescription)) return false;
            ColumnDescription that = (ColumnDescription) o;
            return nullable == that.nullable && identity == that.identity
                    && name.equals(that.name) && dataType.equals(that.dataType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, dataType, nullable, identity);
        }

        @Override
        public String toString() {
            return name + " " + dataType + (identity ? " IDENTITY" : "") + (nullable ? "" : " NOT NULL");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConstraintDescription {

        private final String       name;
        private final String       type;
        private final List<String> columns;

        @JsonCreator
        public ConstraintDescription(
                @JsonProperty("name")    String name,
                @JsonProperty("type")    String type,
                @JsonProperty("columns") List<String> columns
        ) {
            this.name    = Objects.requireNonNull(name, "name");
            this.type    = type != null ? type : "";
            this.columns = columns != null ? Collections.unmodifiableList(new ArrayList<>(columns)) : List.of();
        }

        @JsonProperty("name")    public String       getName()    { return name; }
        @JsonProperty("type")    public String       getType()    { return type; }
        @JsonProperty("columns") public List<String> getColumns() { return columns; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ConstraintDescription)) return false;
            ConstraintDescription that = (ConstraintDescription) o;
            return name.equals(that.name) && type.equals(that.type) && columns.equals(that.columns);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type, columns);
        }
    }
}
