package io.github.cobfuscator;

import io.github.cobfuscator.parser.SourceLocation;

/**
 * Base class of every error that aborts the processing of a translation unit.
 * Instances carry the location of the offending construct; the file name is attached
 * by the pipeline once the failing unit is known.
 */
public class CompilationException extends RuntimeException {

    private static final long serialVersionUID = 6120835741729348017L;

    private final SourceLocation location;
    private String fileName;

    public CompilationException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public CompilationException(String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getFileName() {
        return fileName;
    }

    public CompilationException withFileName(String fileName) {
        if (this.fileName == null) {
            this.fileName = fileName;
        }
        return this;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (fileName != null) {
            sb.append(fileName).append(':');
        }
        if (location != null) {
            sb.append(location).append(": ");
        } else if (fileName != null) {
            sb.append(' ');
        }
        sb.append(super.getMessage());
        return sb.toString();
    }
}
