package express.mvp.blocksync.block;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Payload of a save: the new text, the type it asserts, and any per-type attributes.
 *
 * <p>Instances are produced by {@link BlockType#toUpdate(String)} and are immutable.
 *
 * @param type the structural type the save asserts
 * @param text the full text content
 * @param attributes extra type-specific fields (e.g. the language of a code block)
 */
public record BlockUpdate(BlockType type, String text, Map<String, String> attributes) {

    /** Language sent for code blocks. */
    public static final String DEFAULT_CODE_LANGUAGE = "plain text";

    public BlockUpdate {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    static BlockUpdate of(BlockType type, String text) {
        return new BlockUpdate(type, text, Map.of());
    }

    static BlockUpdate withAttribute(BlockType type, String text, String key, String value) {
        return new BlockUpdate(type, text, Map.of(key, value));
    }
}
