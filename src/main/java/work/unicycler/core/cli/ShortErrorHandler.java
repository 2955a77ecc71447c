package work.unicycler.core.cli;

import picocli.CommandLine;
import work.unicycler.core.error.ProtocolException;

/**
 * Keeps CLI failures short and focused on the root cause.
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
        if (ex instanceof ProtocolException protocolException) {
            message = "[" + protocolException.code() + "] " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("unicycler.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
