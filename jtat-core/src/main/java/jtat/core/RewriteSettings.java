package jtat.core;

/// Engine settings.
///
/// @param separators write `=#` marker comments around copied and generated regions
public record RewriteSettings(boolean separators) {

    public static final String SEPARATORS_PROPERTY = "jtat.separators";

    public static RewriteSettings defaults() {
        return new RewriteSettings(false);
    }

    /// Reads `jtat.separators`; absent means the default.
    public static RewriteSettings fromSystemProperties() {
        return new RewriteSettings(Boolean.parseBoolean(System.getProperty(SEPARATORS_PROPERTY, "false")));
    }

    public RewriteSettings withSeparators(boolean enabled) {
        return new RewriteSettings(enabled);
    }
}
