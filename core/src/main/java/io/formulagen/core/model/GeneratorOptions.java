package io.formulagen.core.model;

import java.util.Objects;

/**
 * Immutable configuration of one module generation run. Use {@link #builder()} to construct
 * instances; every component has a default.
 *
 * @param target         id of the registered backend (e.g. {@code python})
 * @param dataAccessMode how generated code reads record fields
 * @param nullSafety     whether string builtins coalesce null arguments to the empty string
 * @param depthComments  whether getters are grouped under dependency-depth comments
 * @param moduleName     base name of the generated file
 * @param sqlSchema      database schema that owns generated SQL functions and views
 */
public record GeneratorOptions(
        String target,
        DataAccessMode dataAccessMode,
        boolean nullSafety,
        boolean depthComments,
        String moduleName,
        String sqlSchema) {

    public static final String DEFAULT_TARGET = "python";
    public static final String DEFAULT_MODULE_NAME = "computed_fields";
    public static final String DEFAULT_SQL_SCHEMA = "public";

    public GeneratorOptions {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(dataAccessMode, "dataAccessMode must not be null");
        Objects.requireNonNull(moduleName, "moduleName must not be null");
        Objects.requireNonNull(sqlSchema, "sqlSchema must not be null");
        if (moduleName.isBlank()) {
            throw new IllegalArgumentException("moduleName must not be blank");
        }
    }

    /** Options with every default applied. */
    public static GeneratorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this instance's values. */
    public Builder toBuilder() {
        return new Builder()
                .target(target)
                .dataAccessMode(dataAccessMode)
                .nullSafety(nullSafety)
                .depthComments(depthComments)
                .moduleName(moduleName)
                .sqlSchema(sqlSchema);
    }

    /** Builder for {@link GeneratorOptions}. */
    public static final class Builder {

        private String target = DEFAULT_TARGET;
        private DataAccessMode dataAccessMode = DataAccessMode.ATTRIBUTE;
        private boolean nullSafety = true;
        private boolean depthComments = true;
        private String moduleName = DEFAULT_MODULE_NAME;
        private String sqlSchema = DEFAULT_SQL_SCHEMA;

        private Builder() {}

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder dataAccessMode(DataAccessMode dataAccessMode) {
            this.dataAccessMode = dataAccessMode;
            return this;
        }

        public Builder nullSafety(boolean nullSafety) {
            this.nullSafety = nullSafety;
            return this;
        }

        public Builder depthComments(boolean depthComments) {
            this.depthComments = depthComments;
            return this;
        }

        public Builder moduleName(String moduleName) {
            this.moduleName = moduleName;
            return this;
        }

        public Builder sqlSchema(String sqlSchema) {
            this.sqlSchema = sqlSchema;
            return this;
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(target, dataAccessMode, nullSafety, depthComments, moduleName, sqlSchema);
        }
    }
}
