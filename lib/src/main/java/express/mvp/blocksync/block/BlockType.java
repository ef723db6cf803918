package express.mvp.blocksync.block;

import java.util.Locale;
import java.util.Objects;

/**
 * Structural types a block can take while being edited.
 *
 * <p>The set is closed: every constant knows its wire name and how to build the update payload
 * that asserts its own type. A transformation request is nothing more than a save whose payload
 * is built by a different constant.
 *
 * <h2>Wire Names</h2>
 *
 * <table border="1">
 *   <caption>Block types</caption>
 *   <tr><th>Constant</th><th>Wire name</th></tr>
 *   <tr><td>PARAGRAPH</td><td>paragraph</td></tr>
 *   <tr><td>HEADING_1..3</td><td>heading_1..heading_3</td></tr>
 *   <tr><td>BULLETED_LIST_ITEM</td><td>bulleted_list_item</td></tr>
 *   <tr><td>NUMBERED_LIST_ITEM</td><td>numbered_list_item</td></tr>
 *   <tr><td>TO_DO</td><td>to_do</td></tr>
 *   <tr><td>TOGGLE</td><td>toggle</td></tr>
 *   <tr><td>CODE</td><td>code</td></tr>
 *   <tr><td>QUOTE</td><td>quote</td></tr>
 *   <tr><td>CALLOUT</td><td>callout</td></tr>
 * </table>
 *
 * @see BlockUpdate
 */
public enum BlockType {
    PARAGRAPH("paragraph", "Paragraph"),
    HEADING_1("heading_1", "Heading 1"),
    HEADING_2("heading_2", "Heading 2"),
    HEADING_3("heading_3", "Heading 3"),
    BULLETED_LIST_ITEM("bulleted_list_item", "Bulleted list"),
    NUMBERED_LIST_ITEM("numbered_list_item", "Numbered list"),
    TO_DO("to_do", "To-do"),
    TOGGLE("toggle", "Toggle"),

    /** Code blocks must name a language; edits always save as plain text. */
    CODE("code", "Code") {
        @Override
        public BlockUpdate toUpdate(String text) {
            return BlockUpdate.withAttribute(this, text, "language", BlockUpdate.DEFAULT_CODE_LANGUAGE);
        }
    },
    QUOTE("quote", "Quote"),
    CALLOUT("callout", "Callout");

    private final String wireName;
    private final String displayName;

    BlockType(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    /**
     * Returns the name used for this type by the remote store.
     *
     * @return the wire name, e.g. {@code heading_1}
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Returns a human-readable name for status text.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Builds the payload that replaces this block's text and asserts this type.
     *
     * @param text the full text content to save
     * @return the update payload
     */
    public BlockUpdate toUpdate(String text) {
        return BlockUpdate.of(this, text);
    }

    /**
     * Resolves a wire name to a block type.
     *
     * @param wireName the remote type name
     * @return the matching type
     * @throws IllegalArgumentException if the type cannot be edited as text
     */
    public static BlockType fromWireName(String wireName) {
        Objects.requireNonNull(wireName, "wireName");
        String normalized = wireName.trim().toLowerCase(Locale.ROOT);
        for (BlockType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported block type: " + wireName);
    }

    /**
     * Checks whether a wire name denotes an editable block type.
     *
     * @param wireName the remote type name (may be null)
     * @return true if {@link #fromWireName(String)} would succeed
     */
    public static boolean isEditable(String wireName) {
        if (wireName == null) {
            return false;
        }
        String normalized = wireName.trim().toLowerCase(Locale.ROOT);
        for (BlockType type : values()) {
            if (type.wireName.equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
