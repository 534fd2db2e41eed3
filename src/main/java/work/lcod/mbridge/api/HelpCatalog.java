package work.lcod.mbridge.api;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Built-in help texts, one TOML table per topic with a {@code summary} and a {@code usage}.
 */
public final class HelpCatalog {
    static final String RESOURCE = "/work/lcod/mbridge/help.toml";
    static final String OVERVIEW = "overview";

    private final Map<String, String> topics;

    private HelpCatalog(Map<String, String> topics) {
        this.topics = topics;
    }

    public static HelpCatalog load() {
        try (InputStream stream = HelpCatalog.class.getResourceAsStream(RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Missing help catalogue " + RESOURCE);
            }
            return fromToml(Toml.parse(stream));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read help catalogue " + RESOURCE, ex);
        }
    }

    static HelpCatalog fromToml(TomlParseResult result) {
        if (result.hasErrors()) {
            throw new IllegalStateException("Invalid help catalogue: " + result.errors().get(0));
        }
        var topics = new LinkedHashMap<String, String>();
        for (String key : result.keySet()) {
            TomlTable table = result.getTable(key);
            if (table == null) {
                continue;
            }
            var text = new StringBuilder(table.getString("summary", () -> ""));
            String usage = table.getString("usage");
            if (usage != null && !usage.isBlank()) {
                text.append("\n\n").append(usage.strip());
            }
            topics.put(normalise(key), text.toString());
        }
        return new HelpCatalog(topics);
    }

    /**
     * Help text for {@code topic}; a blank topic gives the overview. Topic names follow the
     * operation names ({@code nextNode}, {@code next-node} and {@code next_node} all match).
     */
    public String text(String topic) {
        String key = topic == null || topic.isBlank() ? OVERVIEW : normalise(topic);
        String text = topics.get(key);
        if (text == null) {
            return "No help for '" + topic + "'. Topics: " + String.join(", ", topics.keySet());
        }
        return text;
    }

    public Iterable<String> topics() {
        return topics.keySet();
    }

    private static String normalise(String topic) {
        return topic.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }
}
