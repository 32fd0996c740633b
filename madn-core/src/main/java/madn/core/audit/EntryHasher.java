package madn.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// SHA-256 over sorted-key JSON, entry_hash excluded
public class EntryHasher {
    public static final int MIN_LENGTH = 16;
    public static final int MAX_LENGTH = 64;

    private final ObjectMapper objectMapper;
    private final int length;

    public EntryHasher(ObjectMapper objectMapper, int length) {
        if (length < MIN_LENGTH || length > MAX_LENGTH) {
            throw new IllegalArgumentException("hash length must be within [16,64]: " + length);
        }
        this.objectMapper = objectMapper;
        this.length = length;
    }

    public int length() {
        return length;
    }

    public String hash(ObjectNode entry) {
        ObjectNode copy = entry.deepCopy();
        copy.remove(AuditLedger.ENTRY_HASH);
        try {
            return Digests.sha256Hex(objectMapper.writeValueAsString(canonical(copy)), length);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("entry not serializable", e);
        }
    }

    JsonNode canonical(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = objectMapper.createObjectNode();
            for (String name : names) {
                sorted.set(name, canonical(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = objectMapper.createArrayNode();
            node.forEach(item -> array.add(canonical(item)));
            return array;
        }
        return node;
    }
}
