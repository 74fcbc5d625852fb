package com.purchasingpower.remediation.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Languages the scanner has rule sets for.
 *
 * <p>Each language carries the names a caller may use for it and the file extension
 * the scanner relies on to pick its rules.
 */
public enum Language {
    PYTHON("py", "python"),
    JAVASCRIPT("js", "javascript"),
    JAVA("java", "java"),
    GO("go", "go"),
    CSHARP("cs", "csharp", "c#");

    private static final String SYNTHETIC_BASENAME = "remediation";

    private final String extension;
    private final List<String> aliases;

    Language(String extension, String... aliases) {
        this.extension = extension;
        this.aliases = List.of(aliases);
    }

    public String getExtension() {
        return extension;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /**
     * Filename handed to the scanner. It never points at a real file of the caller.
     */
    public String syntheticFilename() {
        return SYNTHETIC_BASENAME + "." + extension;
    }

    /**
     * Case-insensitive lookup by alias.
     */
    public static Optional<Language> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.aliases.contains(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
