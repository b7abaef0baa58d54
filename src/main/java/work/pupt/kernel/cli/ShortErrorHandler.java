package work.pupt.kernel.cli;

import picocli.CommandLine;

/**
 * Prints the root cause of a failed render on one line; {@code -Dpupt.debug=true} adds the trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "pupt.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable cause = ex;
        while (cause instanceof CommandLine.ExecutionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            cause.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
