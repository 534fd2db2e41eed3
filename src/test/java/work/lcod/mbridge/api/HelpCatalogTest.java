package work.lcod.mbridge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.tomlj.Toml;
import work.lcod.mbridge.runtime.Operation;

class HelpCatalogTest {
    private final HelpCatalog catalog = HelpCatalog.load();

    @Test
    void blankTopicGivesTheOverview() {
        assertTrue(catalog.text(null).startsWith("mbridge: access an M database"));
        assertEquals(catalog.text(null), catalog.text(" "));
    }

    @Test
    void topicSpellingsMatchOperationNames() {
        assertEquals(catalog.text("nextNode"), catalog.text("next-node"));
        assertEquals(catalog.text("nextNode"), catalog.text("NEXT_NODE"));
    }

    @Test
    void everyOperationHasHelp() {
        var topics = new ArrayList<String>();
        catalog.topics().forEach(topics::add);
        for (Operation operation : Operation.values()) {
            if (operation == Operation.DEBUG) {
                continue;
            }
            assertTrue(topics.contains(operation.routine().toLowerCase(Locale.ROOT)), operation.routine());
        }
    }

    @Test
    void unknownTopicListsTheKnownOnes() {
        String text = catalog.text("frobnicate");
        assertTrue(text.startsWith("No help for 'frobnicate'. Topics: "));
        assertTrue(text.contains("previousnode"));
    }

    @Test
    void usageFollowsTheSummary() {
        var parsed = HelpCatalog.fromToml(Toml.parse("[demo]\nsummary = \"Short.\"\nusage = \"\"\"\nLonger text.\n\"\"\"\n"));
        assertEquals("Short.\n\nLonger text.", parsed.text("demo"));
    }
}
