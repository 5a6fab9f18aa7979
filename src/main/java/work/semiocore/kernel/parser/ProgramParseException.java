package work.semiocore.kernel.parser;

import work.semiocore.kernel.shared.SemioException;

/**
 * Structural error in program source, located by source name and 1-based line (0 when the
 * violation concerns the whole file).
 */
public final class ProgramParseException extends SemioException {
    private final String source;
    private final int line;

    public ProgramParseException(String code, String source, int line, String message) {
        super(code, line > 0 ? message + " at " + source + ":" + line : message + " in " + source);
        this.source = source;
        this.line = line;
    }

    public String source() {
        return source;
    }

    public int line() {
        return line;
    }
}
