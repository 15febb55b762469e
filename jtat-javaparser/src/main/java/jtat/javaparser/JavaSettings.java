package jtat.javaparser;

import com.github.javaparser.ParserConfiguration.LanguageLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// Settings of the Java collaborators, read from system properties.
///
/// | property                  | default       |
/// |---------------------------|---------------|
/// | `jtat.java.languageLevel` | `JAVA_17`     |
/// | `jtat.java.indent`        | `4`           |
/// | `jtat.renderers`          | `pretty,plain`|
///
/// @param languageLevel the Java version sources and rules are parsed as
/// @param indent spaces per indentation level in rendered code
/// @param renderers renderer names in priority order, see [JavaLanguage]
public record JavaSettings(LanguageLevel languageLevel, int indent, List<String> renderers) {

    public static final String LANGUAGE_LEVEL_PROPERTY = "jtat.java.languageLevel";
    public static final String INDENT_PROPERTY = "jtat.java.indent";
    public static final String RENDERERS_PROPERTY = "jtat.renderers";

    public JavaSettings {
        Objects.requireNonNull(languageLevel, "languageLevel must not be null");
        Objects.requireNonNull(renderers, "renderers must not be null");
        if (indent < 0) {
            throw new IllegalArgumentException("indent must be >= 0, got: " + indent);
        }
        if (renderers.isEmpty()) {
            throw new IllegalArgumentException("at least one renderer must be named");
        }
        renderers = List.copyOf(renderers);
    }

    public static JavaSettings defaults() {
        return new JavaSettings(LanguageLevel.JAVA_17, 4, List.of("pretty", "plain"));
    }

    public static JavaSettings fromSystemProperties() {
        final var defaults = defaults();
        final var level = System.getProperty(LANGUAGE_LEVEL_PROPERTY);
        final var indent = System.getProperty(INDENT_PROPERTY);
        final var renderers = System.getProperty(RENDERERS_PROPERTY);
        return new JavaSettings(
                level == null ? defaults.languageLevel() : parseLevel(level),
                indent == null ? defaults.indent() : parseIndent(indent),
                renderers == null ? defaults.renderers() : parseNames(renderers));
    }

    public JavaSettings withLanguageLevel(LanguageLevel level) {
        return new JavaSettings(level, indent, renderers);
    }

    public JavaSettings withIndent(int spaces) {
        return new JavaSettings(languageLevel, spaces, renderers);
    }

    public JavaSettings withRenderers(List<String> names) {
        return new JavaSettings(languageLevel, indent, names);
    }

    static LanguageLevel parseLevel(String value) {
        var name = value.trim().toUpperCase(Locale.ROOT);
        if (!name.startsWith("JAVA_") && !name.equals("CURRENT") && !name.equals("POPULAR")
                && !name.startsWith("BLEEDING") && !name.startsWith("RAW")) {
            name = "JAVA_" + name.replace('.', '_');
        }
        try {
            return LanguageLevel.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + LANGUAGE_LEVEL_PROPERTY + ": " + value, e);
        }
    }

    private static int parseIndent(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(INDENT_PROPERTY + " must be a number, got: " + value, e);
        }
    }

    private static List<String> parseNames(String value) {
        final var names = new ArrayList<String>();
        for (final var part : value.split(",")) {
            if (!part.isBlank()) {
                names.add(part.trim().toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }
}
