package in.orderflow.application.service;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trade history export formats.
 */
public enum ExportFormat {
    JSON("json"),
    CSV("csv");

    private final String code;

    ExportFormat(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ExportFormat fromCode(String code) {
        for (ExportFormat format : values()) {
            if (format.code.equalsIgnoreCase(code)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown export format: " + code);
    }
}
