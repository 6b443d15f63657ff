package io.formulagen.core.spi;

import io.formulagen.core.model.GeneratorOptions;
import io.formulagen.core.model.Schema;
import java.util.List;
import java.util.Objects;

/** Schema and options a backend is configured with for one generation run. */
public record GenerationContext(Schema schema, GeneratorOptions options) {

    public GenerationContext {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(options, "options must not be null");
    }

    /** Empty schema with default options, for transpiling formulas outside a module. */
    public static GenerationContext standalone() {
        return new GenerationContext(Schema.of(List.of()), GeneratorOptions.defaults());
    }
}
