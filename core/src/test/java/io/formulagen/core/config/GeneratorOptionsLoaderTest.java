package io.formulagen.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulagen.core.model.DataAccessMode;
import io.formulagen.core.model.GeneratorOptions;
import io.formulagen.core.testkit.SampleSchemas;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link GeneratorOptionsLoader}: YAML mapping, environment overlay and validation. */
class GeneratorOptionsLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    @Nested
    class YamlMapping {

        @Test
        void loadsEveryKeyFromFile() {
            GeneratorOptions options =
                    GeneratorOptionsLoader.load(SampleSchemas.resource("config/generator-options.yaml"), NO_ENV);

            assertThat(options.target()).isEqualTo("javascript");
            assertThat(options.dataAccessMode()).isEqualTo(DataAccessMode.CAMEL_CASE);
            assertThat(options.nullSafety()).isFalse();
            assertThat(options.depthComments()).isFalse();
            assertThat(options.moduleName()).isEqualTo("order_fields");
            assertThat(options.sqlSchema()).isEqualTo("reporting");
        }

        @Test
        void missingKeysKeepDefaults() {
            GeneratorOptions options = GeneratorOptionsLoader.fromYaml("target: sql\n", NO_ENV);

            assertThat(options.target()).isEqualTo("sql");
            assertThat(options.dataAccessMode()).isEqualTo(DataAccessMode.ATTRIBUTE);
            assertThat(options.nullSafety()).isTrue();
            assertThat(options.moduleName()).isEqualTo(GeneratorOptions.DEFAULT_MODULE_NAME);
            assertThat(options.sqlSchema()).isEqualTo(GeneratorOptions.DEFAULT_SQL_SCHEMA);
        }

        @Test
        void emptyDocumentGivesDefaults() {
            assertThat(GeneratorOptionsLoader.fromYaml("", NO_ENV)).isEqualTo(GeneratorOptions.defaults());
        }

        @Test
        void booleansAreCaseInsensitive() {
            GeneratorOptions options = GeneratorOptionsLoader.fromYaml("null-safety: FALSE\n", NO_ENV);

            assertThat(options.nullSafety()).isFalse();
        }

        @Test
        void dataAccessAliasesAreAccepted() {
            assertThat(GeneratorOptionsLoader.fromYaml("data-access: dict\n", NO_ENV)
                            .dataAccessMode())
                    .isEqualTo(DataAccessMode.DICT);
            assertThat(GeneratorOptionsLoader.fromYaml("data-access: object\n", NO_ENV)
                            .dataAccessMode())
                    .isEqualTo(DataAccessMode.ATTRIBUTE);
        }
    }

    @Nested
    class EnvironmentOverlay {

        @Test
        void environmentOverridesFile() {
            Map<String, String> env = Map.of(
                    "FORMULAGEN_TARGET", "sql",
                    "FORMULAGEN_NULL_SAFETY", " true ",
                    "FORMULAGEN_SQL_SCHEMA", "analytics");

            GeneratorOptions options =
                    GeneratorOptionsLoader.load(SampleSchemas.resource("config/generator-options.yaml"), env::get);

            assertThat(options.target()).isEqualTo("sql");
            assertThat(options.nullSafety()).isTrue();
            assertThat(options.sqlSchema()).isEqualTo("analytics");
            assertThat(options.moduleName()).isEqualTo("order_fields");
        }

        @Test
        void blankValuesAreIgnored() {
            Map<String, String> env = Map.of("FORMULAGEN_TARGET", "   ", "FORMULAGEN_MODULE_NAME", "");

            GeneratorOptions options = GeneratorOptionsLoader.fromYaml("target: javascript\n", env::get);

            assertThat(options.target()).isEqualTo("javascript");
            assertThat(options.moduleName()).isEqualTo(GeneratorOptions.DEFAULT_MODULE_NAME);
        }

        @Test
        void environmentAloneWithoutFile() {
            Map<String, String> env = Map.of("FORMULAGEN_DATA_ACCESS", "camel-case");

            assertThat(GeneratorOptionsLoader.fromEnvironment(env::get).dataAccessMode())
                    .isEqualTo(DataAccessMode.CAMEL_CASE);
        }

        @Test
        void invalidEnvironmentBooleanNamesTheVariable() {
            Map<String, String> env = Map.of("FORMULAGEN_DEPTH_COMMENTS", "yes");

            assertThatThrownBy(() -> GeneratorOptionsLoader.fromEnvironment(env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Invalid boolean for FORMULAGEN_DEPTH_COMMENTS: 'yes'");
        }
    }

    @Nested
    class Failures {

        @Test
        void missingFile() {
            Path missing = tempDir.resolve("nope.yaml");

            assertThatThrownBy(() -> GeneratorOptionsLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Options file not found: ");
        }

        @Test
        void malformedYaml() throws IOException {
            Path file = tempDir.resolve("broken.yaml");
            Files.writeString(file, "target: [python\n");

            assertThatThrownBy(() -> GeneratorOptionsLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML options: ")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        void nonMappingDocument() {
            assertThatThrownBy(() -> GeneratorOptionsLoader.fromYaml("- python\n", NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Options must be a YAML mapping");
        }

        @Test
        void invalidBoolean() {
            assertThatThrownBy(() -> GeneratorOptionsLoader.fromYaml("null-safety: maybe\n", NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Invalid boolean for null-safety: 'maybe'");
        }

        @Test
        void unknownDataAccessMode() {
            assertThatThrownBy(() -> GeneratorOptionsLoader.fromYaml("data-access: tuple\n", NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Unknown data access mode: 'tuple'");
        }

        @Test
        void blankModuleName() {
            assertThatThrownBy(() -> GeneratorOptionsLoader.fromYaml("module-name: '  '\n", NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Invalid generator options: moduleName must not be blank");
        }
    }
}
