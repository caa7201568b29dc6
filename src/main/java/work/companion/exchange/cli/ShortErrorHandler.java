package work.companion.exchange.cli;

import picocli.CommandLine;
import work.companion.exchange.api.ExchangeReport;
import work.companion.exchange.store.StoreException;

/**
 * Prints unexpected failures of {@code export} and {@code import} as one line naming the command.
 *
 * <p>Store failures also name their innermost cause, which is usually the SQLite message. Stack
 * traces are only printed with {@code -Dcompanion.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = describe(ex);
        if (ex instanceof StoreException) {
            Throwable root = rootCause(ex);
            if (root != ex && root.getMessage() != null && !root.getMessage().isBlank()) {
                message += " (" + root.getMessage() + ")";
            }
        }
        String line = commandLine.getCommandName() + " failed: " + message;
        commandLine.getErr().println(commandLine.getColorScheme().errorText(line));
        if (Boolean.getBoolean("companion.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return ExchangeReport.Status.FAILURE.exitCode();
    }

    private static String describe(Throwable ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    private static Throwable rootCause(Throwable ex) {
        Throwable current = ex;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
