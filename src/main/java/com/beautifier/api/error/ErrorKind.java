package com.beautifier.api.error;

/**
 * Every failure that aborts a formatting run.
 */
public enum ErrorKind {
    MISSING_EXTENSION("File has no extension, cannot tell which language it holds"),
    UNSUPPORTED_EXTENSION("Unsupported file extension, only html/css/js/ts are formatted"),
    INPUT_READ_FAILURE("Cannot read input file"),
    OUTPUT_WRITE_FAILURE("Cannot write output file"),
    UNSUPPORTED_FILE_TYPE("No formatter registered for file type");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
