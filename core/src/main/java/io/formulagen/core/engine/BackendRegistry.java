package io.formulagen.core.engine;

import io.formulagen.core.backend.javascript.JavaScriptBackend;
import io.formulagen.core.backend.python.PythonBackend;
import io.formulagen.core.backend.sql.SqlBackend;
import io.formulagen.core.spi.CodeGenBackend;
import io.formulagen.core.spi.GenerationContext;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a {@code target} option to the code generation backend that serves it. Targets match
 * case-insensitively, either the backend's own id or one of the aliases it was registered with
 * ({@code py}, {@code js} and {@code postgresql} for the bundled backends).
 *
 * <p>
 * The registry holds unconfigured prototypes. {@link #bind} hands out a copy configured for one
 * run, so a registry can be shared between threads and between concurrent runs.
 */
public final class BackendRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<String, CodeGenBackend> backends = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    /** Registry holding the bundled {@code python}, {@code javascript} and {@code sql} backends. */
    public static BackendRegistry withDefaults() {
        BackendRegistry registry = new BackendRegistry();
        registry.register(new PythonBackend(), "py");
        registry.register(new JavaScriptBackend(), "js");
        registry.register(new SqlBackend(), "postgresql", "postgres");
        return registry;
    }

    /**
     * Registers a backend under its id and the given aliases. A backend registered again under the
     * same id replaces the earlier one, keeping its aliases.
     *
     * @throws IllegalArgumentException if the id is blank, or an alias is blank or already names
     *                                  another backend
     */
    public synchronized void register(CodeGenBackend backend, String... targetAliases) {
        Objects.requireNonNull(backend, "backend must not be null");
        String id = normalize(backend.id());
        if (id.isEmpty()) {
            throw new IllegalArgumentException("backend id must not be null or blank");
        }
        if (aliases.containsKey(id)) {
            throw new IllegalArgumentException("'" + id + "' is already an alias of " + aliases.get(id));
        }
        for (String alias : targetAliases) {
            String key = normalize(alias);
            if (key.isEmpty()) {
                throw new IllegalArgumentException("alias of " + id + " must not be blank");
            }
            String owner = backends.containsKey(key) ? key : aliases.get(key);
            if (owner != null && !owner.equals(id)) {
                throw new IllegalArgumentException("Alias '" + key + "' already names backend " + owner);
            }
        }
        CodeGenBackend previous = backends.put(id, backend);
        if (previous != null && previous != backend) {
            LOG.debug("Backend replaced: id={}, previous={}", id, previous.getClass().getName());
        }
        for (String alias : targetAliases) {
            aliases.put(normalize(alias), id);
        }
    }

    /** The unconfigured backend serving {@code target}, by id or alias. */
    public Optional<CodeGenBackend> find(String target) {
        String key = normalize(target);
        return Optional.ofNullable(backends.get(aliases.getOrDefault(key, key)));
    }

    /**
     * The unconfigured backend serving {@code target}.
     *
     * @throws IllegalArgumentException if no backend serves the target; the message lists the
     *                                  registered ids
     */
    public CodeGenBackend require(String target) {
        return find(target)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown target '" + target + "'; registered backends: " + String.join(", ", ids())));
    }

    /**
     * Resolves the context's target and configures the backend for that context.
     *
     * @throws IllegalArgumentException if no backend serves the target
     */
    public CodeGenBackend bind(GenerationContext context) {
        return require(context.options().target()).configure(context);
    }

    public boolean supports(String target) {
        return find(target).isPresent();
    }

    /** Registered backend ids in alphabetical order, aliases excluded. */
    public Set<String> ids() {
        return new TreeSet<>(backends.keySet());
    }

    /** Aliases registered for a backend id, sorted. */
    public List<String> aliasesOf(String id) {
        String key = normalize(id);
        return aliases.entrySet().stream()
                .filter(e -> e.getValue().equals(key))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    private static String normalize(String target) {
        return target == null ? "" : target.strip().toLowerCase(Locale.ROOT);
    }
}
