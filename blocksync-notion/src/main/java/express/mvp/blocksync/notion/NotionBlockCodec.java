package express.mvp.blocksync.notion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.blocksync.block.BlockContent;
import express.mvp.blocksync.block.BlockType;
import express.mvp.blocksync.block.BlockUpdate;
import express.mvp.blocksync.store.RemoteStoreException;
import express.mvp.blocksync.store.SaveReceipt;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts between Notion block JSON and the session's block types.
 *
 * <p>A block object carries its payload under a key named after its type:
 *
 * <pre>{@code
 * {
 *   "object": "block",
 *   "id": "b1",
 *   "type": "paragraph",
 *   "last_edited_time": "2024-01-02T03:04:05.000Z",
 *   "parent": {"type": "page_id", "page_id": "p1"},
 *   "paragraph": {"rich_text": [{"type": "text", "plain_text": "Hello", ...}]}
 * }
 * }</pre>
 *
 * <p>Text is the concatenation of every rich text run's {@code plain_text}; formatting is not
 * preserved on save.
 */
public final class NotionBlockCodec {

    private static final Logger LOGGER = Logger.getLogger(NotionBlockCodec.class.getName());

    private final ObjectMapper mapper;

    public NotionBlockCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public NotionBlockCodec() {
        this(new ObjectMapper());
    }

    /**
     * Decodes a block object.
     *
     * @param json the response body
     * @return the block
     * @throws RemoteStoreException if the body is not a block of an editable type
     */
    public BlockContent decodeBlock(String json) {
        JsonNode root = parse(json);
        String id = requiredText(root, "id");
        String typeName = requiredText(root, "type");
        if (!BlockType.isEditable(typeName)) {
            throw new RemoteStoreException(
                    "Block type " + typeName + " cannot be edited",
                    new IllegalArgumentException("Unsupported block type: " + typeName));
        }
        BlockType type = BlockType.fromWireName(typeName);
        String text = plainText(root.path(type.wireName()).path("rich_text"));
        String pageId = root.path("parent").path("page_id").asText(null);
        return new BlockContent(id, pageId, type, text, lastEditedTime(root));
    }

    /**
     * Decodes the block returned by an update into a receipt.
     *
     * @param json the response body
     * @return the receipt
     */
    public SaveReceipt decodeReceipt(String json) {
        JsonNode root = parse(json);
        return new SaveReceipt(requiredText(root, "id"), lastEditedTime(root));
    }

    /**
     * Encodes an update request body.
     *
     * @param update the payload to save
     * @return the JSON body for {@code PATCH /v1/blocks/{id}}
     */
    public String encodeUpdate(BlockUpdate update) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode body = root.putObject(update.type().wireName());
        ArrayNode richText = body.putArray("rich_text");
        if (!update.text().isEmpty()) {
            ObjectNode run = richText.addObject();
            run.put("type", "text");
            run.putObject("text").put("content", update.text());
        }
        for (Map.Entry<String, String> attribute : update.attributes().entrySet()) {
            body.put(attribute.getKey(), attribute.getValue());
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode block update", e);
        }
    }

    /**
     * Decodes an API error body {@code {"object":"error","status":..,"code":..,"message":..}}.
     *
     * @param status the HTTP status of the response
     * @param json the response body, possibly empty or not JSON
     * @return the exception to throw
     */
    public RemoteStoreException decodeError(int status, String json) {
        String code = null;
        String message = null;
        if (json != null && !json.isBlank()) {
            try {
                JsonNode root = mapper.readTree(json);
                code = root.path("code").asText(null);
                message = root.path("message").asText(null);
            } catch (JsonProcessingException e) {
                LOGGER.log(Level.FINE, "Error body for HTTP " + status + " is not JSON", e);
            }
        }
        String detail = message != null ? message : "request failed";
        String text = code != null
                ? "HTTP " + status + " " + code + ": " + detail
                : "HTTP " + status + ": " + detail;
        return new RemoteStoreException(status, code, text);
    }

    private JsonNode parse(String json) {
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new RemoteStoreException(
                        "Malformed block response",
                        new IllegalArgumentException("Expected a JSON object"));
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new RemoteStoreException("Malformed block response", e);
        }
    }

    private static String plainText(JsonNode richText) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode run : richText) {
            sb.append(run.path("plain_text").asText(""));
        }
        return sb.toString();
    }

    private static Instant lastEditedTime(JsonNode root) {
        String value = requiredText(root, "last_edited_time");
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new RemoteStoreException("Malformed last_edited_time: " + value, e);
        }
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            throw new RemoteStoreException(
                    "Malformed block response",
                    new IllegalArgumentException("Missing field " + field));
        }
        return node.asText();
    }
}
