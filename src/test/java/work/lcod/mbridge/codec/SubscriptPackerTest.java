package work.lcod.mbridge.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.ErrorKind;

class SubscriptPackerTest {
    @Test
    void packsWithByteLengthPrefixes() {
        assertEquals("3:abc0:2:é", SubscriptPacker.pack(List.of("abc", "", "é")));
    }

    @Test
    void unpacksWhatWasPacked() {
        List<String> tokens = List.of("\"a:b\"", "", "12", "3:x", "日本");
        assertEquals(tokens, SubscriptPacker.unpack(SubscriptPacker.pack(tokens)));
    }

    @Test
    void emptyListIsEmptyString() {
        assertEquals("", SubscriptPacker.pack(List.of()));
        assertTrue(SubscriptPacker.unpack("").isEmpty());
    }

    @Test
    void listOfEmptyTokensSurvives() {
        List<String> tokens = List.of("", "");
        assertEquals("0:0:", SubscriptPacker.pack(tokens));
        assertEquals(tokens, SubscriptPacker.unpack("0:0:"));
    }

    @Test
    void dropLastDiscardsFinalToken() {
        assertEquals(List.of("a", "b"), SubscriptPacker.unpack("1:a1:b1:c", true));
        assertTrue(SubscriptPacker.unpack("", true).isEmpty());
    }

    @Test
    void rejectsMalformedInput() {
        for (String packed : new String[] {"3:ab", "x", "3abc", "2:ab:", "12"}) {
            var error = assertThrows(BridgeException.class, () -> SubscriptPacker.unpack(packed), packed);
            assertEquals(ErrorKind.ENCODING, error.kind());
        }
    }
}
