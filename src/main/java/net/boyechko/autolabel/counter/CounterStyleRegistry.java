/*
 * AutoLabel - Counter-based labelling for document trees
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.autolabel.counter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Named counter styles. Definitions are read once from YAML; each style is constructed on first
 * lookup and then reused for the lifetime of the registry.
 */
public final class CounterStyleRegistry {
    private static final String DEFAULT_RESOURCE = "/counter-styles.yaml";
    private static final Logger logger = LoggerFactory.getLogger(CounterStyleRegistry.class);

    private final CounterStyleTable table;
    private final Map<String, CounterStyle> built = new HashMap<>();

    public CounterStyleRegistry(CounterStyleTable table) {
        this.table = table;
        if (table.styles == null) table.styles = new HashMap<>();
        if (table.aliases == null) table.aliases = new HashMap<>();
    }

    /**
     * Load a registry from a classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static CounterStyleRegistry fromResource(String resourcePath) {
        try (var inputStream = CounterStyleRegistry.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(CounterStyleTable.class, new LoaderOptions()));
            CounterStyleTable table = yaml.load(inputStream);
            CounterStyleRegistry registry = new CounterStyleRegistry(table);

            logger.debug(
                    "Loaded {} counter styles and {} aliases from resource {}",
                    registry.table.styles.size(),
                    registry.table.aliases.size(),
                    resourcePath);

            var warnings = registry.validateConsistency();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Counter styles loaded from {} have {} consistency warnings:",
                        resourcePath,
                        warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }
            return registry;
        } catch (Exception e) {
            logger.error(
                    "Failed to load counter styles from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load counter styles from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Load the predefined counter styles from the standard location */
    public static CounterStyleRegistry loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /** Resolves an alias (such as {@code a} or {@code I}) to the style name it stands for. */
    public String canonicalName(String name) {
        return table.aliases.getOrDefault(name, name);
    }

    public boolean isKnown(String name) {
        return table.styles.containsKey(canonicalName(name));
    }

    /** Returns every style name and alias this registry understands. */
    public Set<String> names() {
        Set<String> names = new TreeSet<>(table.styles.keySet());
        names.addAll(table.aliases.keySet());
        return names;
    }

    /** Returns the named style, or null if the name is unknown. */
    public synchronized CounterStyle get(String name) {
        String canonical = canonicalName(name);
        if (!table.styles.containsKey(canonical)) {
            return null;
        }
        return resolve(canonical, new ArrayDeque<>());
    }

    private CounterStyle resolve(String name, Deque<String> resolving) {
        CounterStyle style = built.get(name);
        if (style != null) {
            return style;
        }
        CounterStyleTable.Definition def = table.styles.get(name);
        if (def == null) {
            throw new IllegalArgumentException("Unknown counter style '" + name + "'");
        }
        if (resolving.contains(name)) {
            throw new IllegalArgumentException(
                    "Counter style '" + name + "' refers to itself via " + resolving);
        }

        resolving.push(name);
        try {
            style = build(name, def, resolving);
        } finally {
            resolving.pop();
        }
        built.put(name, style);
        logger.debug("Constructed counter style {}", name);
        return style;
    }

    private CounterStyle build(
            String name, CounterStyleTable.Definition def, Deque<String> resolving) {
        CounterStyle base = def.base != null ? resolve(canonicalName(def.base), resolving) : null;

        CounterSystem system;
        if (def.system != null) {
            system = buildSystem(name, def);
        } else if (base != null) {
            system = base.system();
        } else {
            throw new IllegalArgumentException(
                    "Counter style '" + name + "' has neither a system nor a base");
        }

        CounterStyle.Builder builder = CounterStyle.builder(name, system);
        if (base != null) {
            builder.from(base);
        }
        if (def.fallback != null) {
            builder.fallback(resolve(canonicalName(def.fallback), resolving));
        }
        if (def.negative != null) {
            if (def.negative.isEmpty() || def.negative.size() > 2) {
                throw new IllegalArgumentException(
                        "Counter style '" + name + "' needs one or two negative affixes");
            }
            builder.negative(
                    def.negative.get(0), def.negative.size() > 1 ? def.negative.get(1) : "");
        }
        if (def.prefix != null) builder.prefix(def.prefix);
        if (def.suffix != null) builder.suffix(def.suffix);
        if (def.range_min != null || def.range_max != null) {
            builder.range(def.range_min, def.range_max);
        }
        if (def.pad_width != null) {
            builder.pad(def.pad_width, def.pad_symbol != null ? def.pad_symbol : "0");
        }
        return builder.build();
    }

    private static CounterSystem buildSystem(String name, CounterStyleTable.Definition def) {
        return switch (def.system) {
            case "numeric" -> new CounterSystem.Numeric(def.symbols);
            case "alphabetic" -> new CounterSystem.Alphabetic(def.symbols);
            case "symbolic" -> new CounterSystem.Symbolic(def.symbols);
            case "cyclic" -> new CounterSystem.Cyclic(def.symbols);
            case "fixed" ->
                    new CounterSystem.Fixed(def.symbols, def.first != null ? def.first : 1);
            case "additive" -> {
                if (def.additive_symbols == null) {
                    throw new IllegalArgumentException(
                            "Additive counter style '" + name + "' has no additive_symbols");
                }
                List<CounterSystem.Additive.Weighted> weighted = new ArrayList<>();
                for (Map.Entry<Integer, String> e : def.additive_symbols.entrySet()) {
                    weighted.add(new CounterSystem.Additive.Weighted(e.getKey(), e.getValue()));
                }
                yield new CounterSystem.Additive(weighted);
            }
            case "chinese" -> new CounterSystem.Chinese(def.symbols, def.power_symbols);
            case "ethiopic" ->
                    new CounterSystem.Ethiopic(
                            def.symbols, def.tens_symbols, def.hundred_symbol, def.myriad_symbol);
            default ->
                    throw new IllegalArgumentException(
                            "Counter style '" + name + "' has unknown system '" + def.system + "'");
        };
    }

    /**
     * Checks that every alias, base and fallback names a defined style.
     *
     * @return List of warning messages (empty if the table is consistent)
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, String> alias : table.aliases.entrySet()) {
            if (!table.styles.containsKey(alias.getValue())) {
                warnings.add(
                        "Alias '" + alias.getKey() + "' names undefined style " + alias.getValue());
            }
        }
        for (Map.Entry<String, CounterStyleTable.Definition> entry : table.styles.entrySet()) {
            CounterStyleTable.Definition def = entry.getValue();
            if (def.base != null && !table.styles.containsKey(canonicalName(def.base))) {
                warnings.add(
                        "Style '" + entry.getKey() + "' has undefined base " + def.base);
            }
            if (def.fallback != null && !table.styles.containsKey(canonicalName(def.fallback))) {
                warnings.add(
                        "Style '" + entry.getKey() + "' has undefined fallback " + def.fallback);
            }
            if (def.system == null && def.base == null) {
                warnings.add("Style '" + entry.getKey() + "' has neither system nor base");
            }
        }
        return warnings;
    }
}
