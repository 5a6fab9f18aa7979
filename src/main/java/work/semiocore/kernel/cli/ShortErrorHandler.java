package work.semiocore.kernel.cli;

import picocli.CommandLine;
import work.semiocore.kernel.shared.SemioException;

/**
 * Keeps CLI failures short: {@code ERROR: <message>} naming the violated invariant.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof SemioException semio) {
            message = message + " [" + semio.code() + "]";
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText("ERROR: " + message));
        if (Boolean.getBoolean("semiocore.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
