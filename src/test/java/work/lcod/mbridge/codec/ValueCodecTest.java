package work.lcod.mbridge.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import work.lcod.mbridge.api.Mode;

class ValueCodecTest {
    @Test
    void canonicalModeStripsAndRestoresLeadingZeros() {
        assertEquals(".5", ValueCodec.encodeInput("0.5", Mode.CANONICAL, true));
        assertEquals("-.5", ValueCodec.encodeInput("-0.5", Mode.CANONICAL, false));
        assertEquals("0.5", ValueCodec.decodeOutput(".5", Mode.CANONICAL));
        assertEquals("-0.5", ValueCodec.decodeOutput("-.5", Mode.CANONICAL));
    }

    @Test
    void leadingZeroTransformIsAnInvolution() {
        for (String engineForm : new String[] {".5", "-.5", ".125", "42"}) {
            String host = ValueCodec.decodeOutput(engineForm, Mode.CANONICAL);
            assertEquals(engineForm, ValueCodec.encodeInput(host, Mode.CANONICAL, true));
        }
        for (String hostForm : new String[] {"0.5", "-0.5", "3.25"}) {
            String engine = ValueCodec.encodeInput(hostForm, Mode.CANONICAL, true);
            assertEquals(hostForm, ValueCodec.decodeOutput(engine, Mode.CANONICAL));
        }
    }

    @Test
    void strictModeAlwaysQuotesOutput() {
        assertEquals("\"42\"", ValueCodec.decodeOutput("42", Mode.STRICT));
        assertEquals("\".5\"", ValueCodec.decodeOutput(".5", Mode.STRICT));
        assertEquals("42", ValueCodec.decodeOutput("42", Mode.CANONICAL));
    }

    @Test
    void longNumericOutputIsQuoted() {
        assertEquals("\"123456789012345678\"", ValueCodec.decodeOutput("123456789012345678", Mode.CANONICAL));
    }

    @Test
    void subscriptsKeepOneLayerOfQuotes() {
        assertEquals("\"abc\"", ValueCodec.encodeInput("\"abc\"", Mode.CANONICAL, false));
        assertEquals("\"abc\"", ValueCodec.encodeInput("abc", Mode.STRICT, false));
        assertEquals("\"say \"\"hi\"\"\"", ValueCodec.encodeInput("\"say \"hi\"\"", Mode.CANONICAL, false));
        assertEquals("\"7\"", ValueCodec.encodeInput("7", Mode.STRICT, false));
        assertEquals("7", ValueCodec.encodeInput("7", Mode.CANONICAL, false));
    }

    @Test
    void dataValuesLoseTheirQuotes() {
        assertEquals("abc", ValueCodec.encodeInput("\"abc\"", Mode.CANONICAL, true));
        assertEquals("say \"hi\"", ValueCodec.encodeInput("\"say \"hi\"\"", Mode.STRICT, true));
        assertEquals("42", ValueCodec.encodeInput("42", Mode.STRICT, true));
    }

    @Test
    void emptyTokensPassThrough() {
        assertEquals("", ValueCodec.encodeInput("", Mode.CANONICAL, false));
        assertEquals("\"\"", ValueCodec.decodeOutput("", Mode.CANONICAL));
    }

    @Test
    void outputEscapesQuotesAndControlCharacters() {
        assertEquals("\"a\\\"b\"", ValueCodec.decodeOutput("a\"b", Mode.CANONICAL));
        assertEquals("\"tab\\u0009\"", ValueCodec.decodeOutput("tab\t", Mode.STRICT));
    }
}
