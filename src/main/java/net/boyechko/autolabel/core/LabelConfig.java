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
package net.boyechko.autolabel.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Default label templates and output options.
 *
 * <p>Fields are public and snake_case so that SnakeYAML can populate them directly, e.g.:
 *
 * <pre>
 * labels:
 *   h2: "H.1 ,*"
 *   ol: "1.,(a),(I)"
 *   figure: '"Figure "h1.1. '
 * css: false
 * </pre>
 */
public class LabelConfig {
    private static final String DEFAULT_RESOURCE = "/labels.yaml";
    private static final Logger logger = LoggerFactory.getLogger(LabelConfig.class);

    /** Element type to template. Headings, lists, and any other tag as a standalone series. */
    public Map<String, String> labels = new LinkedHashMap<>();

    /** Heading template applied at level {@link #h_level}, unless {@link #labels} has one. */
    public String h_labels;

    public Integer h_level;

    public String ol_labels;

    public String ul_labels;

    /** Render list labels as CSS counters instead of embedded text. */
    public boolean css;

    /** Tags searched, among an element's children, for where to put a series label. */
    public List<String> caption_tags = new ArrayList<>(List.of("figcaption", "caption"));

    /**
     * Load a configuration from a classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static LabelConfig fromResource(String resourcePath) {
        try (var inputStream = LabelConfig.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            var yaml = new Yaml(new Constructor(LabelConfig.class, new LoaderOptions()));
            LabelConfig config = orEmpty(yaml.load(inputStream));
            logger.debug(
                    "Loaded {} label templates from resource {}",
                    config.effectiveLabels().size(),
                    resourcePath);
            config.logWarnings(resourcePath);
            return config;
        } catch (Exception e) {
            logger.error(
                    "Failed to load label configuration from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load label configuration from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Parses a configuration from YAML text. */
    public static LabelConfig fromYaml(String text) {
        var yaml = new Yaml(new Constructor(LabelConfig.class, new LoaderOptions()));
        LabelConfig config = orEmpty(yaml.load(text));
        config.logWarnings("YAML text");
        return config;
    }

    /** Load the default configuration from the standard location */
    public static LabelConfig loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /** A configuration with no default templates: only directives produce labels. */
    public static LabelConfig empty() {
        return new LabelConfig();
    }

    private static LabelConfig orEmpty(LabelConfig config) {
        if (config == null) {
            return new LabelConfig();
        }
        if (config.labels == null) config.labels = new LinkedHashMap<>();
        if (config.caption_tags == null) config.caption_tags = new ArrayList<>();
        return config;
    }

    public LabelConfig withLabel(String elementType, String template) {
        labels.put(elementType, template);
        return this;
    }

    public LabelConfig withCss(boolean css) {
        this.css = css;
        return this;
    }

    /** The per-type templates, with the single-purpose heading and list fields merged in. */
    public Map<String, String> effectiveLabels() {
        Map<String, String> merged = new LinkedHashMap<>(labels);
        if (h_labels != null) {
            merged.putIfAbsent("h" + headingLevel(), h_labels);
        }
        if (ol_labels != null) {
            merged.putIfAbsent("ol", ol_labels);
        }
        if (ul_labels != null) {
            merged.putIfAbsent("ul", ul_labels);
        }
        return merged;
    }

    public List<String> captionTags() {
        return List.copyOf(caption_tags);
    }

    private int headingLevel() {
        return h_level != null ? h_level : 1;
    }

    /**
     * Checks the configuration for values that will be ignored or are out of range.
     *
     * @return List of warning messages (empty if the configuration is consistent)
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();
        if (h_level != null && (h_level < 1 || h_level > 6)) {
            warnings.add("h_level " + h_level + " is not a heading level (1-6)");
        }
        if (h_labels != null && labels.containsKey("h" + headingLevel())) {
            warnings.add("h_labels is overridden by labels.h" + headingLevel());
        }
        if (ol_labels != null && labels.containsKey("ol")) {
            warnings.add("ol_labels is overridden by labels.ol");
        }
        if (ul_labels != null && labels.containsKey("ul")) {
            warnings.add("ul_labels is overridden by labels.ul");
        }
        if (labels.containsKey("li")) {
            warnings.add("labels.li is ignored; list items take their labels from ol or ul");
        }
        return warnings;
    }

    private void logWarnings(String source) {
        var warnings = validateConsistency();
        if (!warnings.isEmpty()) {
            logger.warn(
                    "Label configuration from {} has {} consistency warnings:",
                    source,
                    warnings.size());
            for (String warning : warnings) {
                logger.warn("  - {}", warning);
            }
        }
    }
}
