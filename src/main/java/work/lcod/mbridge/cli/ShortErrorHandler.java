package work.lcod.mbridge.cli;

import java.util.Locale;
import picocli.CommandLine;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.ErrorKind;

/**
 * Prints a one-line reason for a failed run. Bridge failures are prefixed with their kind
 * and engine status; a missing engine gets its own exit code.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int ENGINE_UNAVAILABLE = 3;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean("mbridge.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof BridgeException bridge && bridge.kind() == ErrorKind.RESOURCE) {
            return ENGINE_UNAVAILABLE;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof BridgeException bridge) {
            String kind = bridge.kind().name().toLowerCase(Locale.ROOT);
            return bridge.code() != 0
                ? kind + " error " + bridge.code() + ": " + message
                : kind + " error: " + message;
        }
        return message;
    }
}
