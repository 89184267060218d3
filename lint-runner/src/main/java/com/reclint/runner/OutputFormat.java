package com.reclint.runner;

import java.util.Locale;
import java.util.Optional;

/**
 * Report format written to standard output.
 *
 * @since 1.0.0
 */
public enum OutputFormat {

    /** One line per error or violation. */
    TEXT {
        @Override
        ReportWriter writer() {
            return new TextReportWriter();
        }
    },
    /** A single JSON document. */
    JSON {
        @Override
        ReportWriter writer() {
            return new JsonReportWriter();
        }
    };

    abstract ReportWriter writer();

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<OutputFormat> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "text" -> Optional.of(TEXT);
            case "json" -> Optional.of(JSON);
            default -> Optional.empty();
        };
    }
}
