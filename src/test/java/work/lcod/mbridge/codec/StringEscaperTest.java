package work.lcod.mbridge.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.ErrorKind;

class StringEscaperTest {
    @Test
    void transportEscapingRoundTrips() {
        List<String> samples = List.of(
            "plain",
            "quote\"inside",
            "back\\slash",
            "tab\there\nnewline",
            "\u0001\u001f\u007f",
            "\"\\\"",
            "");
        for (String sample : samples) {
            assertEquals(sample, StringEscaper.unescapeTransport(StringEscaper.escapeForTransport(sample)));
        }
    }

    @Test
    void escapesControlBytesAsUnicode() {
        assertEquals("a\\u0000b\\u007f", StringEscaper.escapeForTransport("a\u0000b\u007f"));
        assertEquals("x\\\\y", StringEscaper.escapeForTransport("x\\y"));
    }

    @Test
    void plainTextIsUntouched() {
        String text = "héllo wörld";
        assertEquals(text, StringEscaper.escapeForTransport(text));
    }

    @Test
    void engineEscapingDoublesInnerQuotes() {
        assertEquals("\"a\"\"b\"", StringEscaper.escapeForEngine("\"a\"b\""));
        assertEquals("\"ab\"", StringEscaper.escapeForEngine("\"ab\""));
        assertEquals("\"\"", StringEscaper.escapeForEngine("\"\""));
    }

    @Test
    void unquotesEngineLiterals() {
        assertEquals("a\"b", StringEscaper.unquoteEngineLiteral("\"a\"\"b\""));
        assertEquals("", StringEscaper.unquoteEngineLiteral("\"\""));
        var error = assertThrows(BridgeException.class, () -> StringEscaper.unquoteEngineLiteral("abc"));
        assertEquals(ErrorKind.ENCODING, error.kind());
    }

    @Test
    void rejectsMalformedTransportText() {
        var error = assertThrows(BridgeException.class, () -> StringEscaper.unescapeTransport("bad\\q"));
        assertEquals(ErrorKind.ENCODING, error.kind());
    }
}
