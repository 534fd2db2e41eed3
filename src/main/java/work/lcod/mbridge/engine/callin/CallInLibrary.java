package work.lcod.mbridge.engine.callin;

import com.sun.jna.FunctionMapper;
import com.sun.jna.Library;
import com.sun.jna.Native;
import com.sun.jna.NativeLong;
import com.sun.jna.Pointer;
import com.sun.jna.Structure;
import com.sun.jna.ptr.LongByReference;
import java.util.Locale;
import java.util.Map;

/**
 * JNA mapping of the engine's call-in C API. The same methods are bound to the
 * {@code ydb_} or {@code gtm_} symbols depending on the prefix the library is loaded with.
 */
public interface CallInLibrary extends Library {
    int init();

    int ci(String routine, Object... args);

    int zstatus(Pointer buffer, int length);

    int exit();

    int ciTabOpen(String fileName, LongByReference handle);

    int ciTabSwitch(long handle, LongByReference previous);

    static CallInLibrary load(String libraryName, String prefix, String encoding) {
        FunctionMapper mapper = (library, method) -> symbol(prefix, method.getName());
        return Native.load(libraryName, CallInLibrary.class, Map.of(
            Library.OPTION_FUNCTION_MAPPER, mapper,
            Library.OPTION_STRING_ENCODING, encoding));
    }

    /**
     * {@code ciTabOpen} with prefix {@code ydb} becomes {@code ydb_ci_tab_open}.
     */
    static String symbol(String prefix, String methodName) {
        var name = new StringBuilder(prefix).append('_');
        for (char c : methodName.toCharArray()) {
            if (Character.isUpperCase(c)) {
                name.append('_').append(Character.toLowerCase(c));
            } else {
                name.append(c);
            }
        }
        return name.toString().toLowerCase(Locale.ROOT);
    }

    /**
     * The engine's {@code ydb_string_t}: a length and a caller-owned buffer the engine fills.
     */
    @Structure.FieldOrder({"length", "address"})
    class EngineString extends Structure {
        public NativeLong length;
        public Pointer address;

        public EngineString() {}

        public EngineString(Pointer address, long capacity) {
            this.address = address;
            this.length = new NativeLong(capacity);
        }
    }
}
