package work.lcod.mbridge.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.ErrorKind;

class ReferenceBuilderTest {
    @Test
    void rendersNameAndTokens() {
        var builder = new ReferenceBuilder(8192);
        Reference reference = builder.build("^people", List.of("1", "\"smith\""));
        assertEquals("^people(1,\"smith\")", reference.literal());
        assertFalse(reference.isSpilled());
        assertEquals("", reference.packedSpill());
    }

    @Test
    void bareNameWithoutTokens() {
        Reference reference = new ReferenceBuilder(8192).build("^people", List.of());
        assertEquals("^people", reference.literal());
    }

    @Test
    void spillsToTempArrayPastTheLimit() {
        String big = "\"" + "x".repeat(60) + "\"";
        Reference reference = new ReferenceBuilder(40).build("^a", List.of(big, "2"));
        assertTrue(reference.isSpilled());
        assertEquals("^a(v4wTempArgs(1),v4wTempArgs(2))", reference.literal());
        assertEquals(List.of(big, "2"), reference.spilled());
        assertEquals(List.of(big, "2"), SubscriptPacker.unpack(reference.packedSpill()));
    }

    @Test
    void limitCountsBytesNotCharacters() {
        String token = "\"" + "é".repeat(10) + "\"";
        assertEquals(16, ReferenceBuilder.render("^a", List.of(token)).length());
        Reference reference = new ReferenceBuilder(20).build("^a", List.of(token));
        assertTrue(reference.isSpilled());
    }

    @Test
    void failsWhenEvenTheIndirectFormIsTooLong() {
        String big = "\"" + "y".repeat(30) + "\"";
        var builder = new ReferenceBuilder(40);
        var error = assertThrows(BridgeException.class, () -> builder.build("^a", List.of(big, big, big)));
        assertEquals(ErrorKind.ENCODING, error.kind());
    }
}
