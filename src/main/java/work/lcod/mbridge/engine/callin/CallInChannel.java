package work.lcod.mbridge.engine.callin;

import com.sun.jna.Memory;
import com.sun.jna.ptr.LongByReference;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.mbridge.api.BridgeConfiguration;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.engine.EngineChannel;
import work.lcod.mbridge.runtime.CallBuffer;

/**
 * {@link EngineChannel} backed by the engine's shared library. Every routine named in a call
 * must be declared in the engine's call-in table with an output string first and the
 * arguments after it as input strings.
 *
 * <p>Nothing here ships the engine side: the integration routine implementing each entry
 * point (taking the reference literal, then the packed temp-array tokens, then the
 * operation's own arguments) and the call-in table that maps it must be installed in the
 * engine's routine path before {@link #open()} is called.</p>
 */
public final class CallInChannel implements EngineChannel {
    private static final Logger log = LoggerFactory.getLogger(CallInChannel.class);

    private final BridgeConfiguration config;
    private final Charset charset;
    private CallInLibrary library;
    private Memory output;

    public CallInChannel(BridgeConfiguration config) {
        this.config = config;
        this.charset = config.utf8() ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1;
    }

    @Override
    public void open() {
        if (library != null) {
            return;
        }
        CallInLibrary loaded;
        try {
            loaded = CallInLibrary.load(config.libraryName(), config.functionPrefix(), charset.name());
        } catch (UnsatisfiedLinkError ex) {
            throw BridgeException.resource("Cannot load engine library '" + config.libraryName() + "': " + ex.getMessage());
        }
        int status = loaded.init();
        if (status != 0) {
            throw BridgeException.resource(config.functionPrefix() + "_init failed with status " + status);
        }
        library = loaded;
        output = new Memory(config.resultCapacity() + 1L);
        config.callInTable().ifPresent(this::switchTable);
        log.debug("Opened {} through {}", config.libraryName(), config.functionPrefix());
    }

    private void switchTable(String fileName) {
        var handle = new LongByReference();
        int status = library.ciTabOpen(fileName, handle);
        if (status == 0) {
            status = library.ciTabSwitch(handle.getValue(), new LongByReference());
        }
        if (status != 0) {
            throw BridgeException.resource("Cannot use call-in table " + fileName + ", status " + status);
        }
    }

    @Override
    public int call(String routine, CallBuffer result, Object... args) {
        requireOpen();
        var reply = new CallInLibrary.EngineString(output, config.resultCapacity());
        var callArgs = new Object[args.length + 1];
        callArgs[0] = reply;
        for (int i = 0; i < args.length; i++) {
            callArgs[i + 1] = String.valueOf(args[i]);
        }
        int status = library.ci(routine, callArgs);
        if (status != 0) {
            return status;
        }
        reply.read();
        long length = reply.length.longValue();
        if (length > result.capacity()) {
            throw BridgeException.resource(routine + " reply of " + length + " bytes exceeds the result capacity of " + result.capacity());
        }
        result.write(new String(output.getByteArray(0, (int) length), charset));
        return status;
    }

    @Override
    public void status(CallBuffer error) {
        requireOpen();
        var buffer = new Memory(error.capacity() + 1L);
        buffer.clear();
        library.zstatus(buffer, error.capacity());
        String text = buffer.getString(0, charset.name());
        // zstatus truncates to the buffer; multi-byte text may still exceed it by a character
        while (text.getBytes(charset).length > error.capacity()) {
            text = text.substring(0, text.length() - 1);
        }
        error.write(text);
    }

    @Override
    public String describe() {
        return config.libraryName() + " (" + config.functionPrefix() + " call-in)";
    }

    @Override
    public void close() {
        if (library == null) {
            return;
        }
        int status = library.exit();
        if (status != 0) {
            log.warn("{}_exit returned status {}", config.functionPrefix(), status);
        }
        library = null;
        output = null;
    }

    private void requireOpen() {
        if (library == null) {
            throw BridgeException.resource("Engine library " + config.libraryName() + " is not open");
        }
    }
}
