package p2pchat.peer.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import p2pchat.common.exception.StorageException;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between typed records and the JSON documents held by a {@link RecordStore}.
 */
class RecordMapper<T> {

    private final ObjectMapper mapper;
    private final Class<T> type;

    RecordMapper(ObjectMapper mapper, Class<T> type) {
        this.mapper = mapper;
        this.type = type;
    }

    JsonNode toDocument(T record) {
        return mapper.valueToTree(record);
    }

    T fromDocument(JsonNode document) throws StorageException {
        try {
            return mapper.treeToValue(document, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StorageException("Corrupt " + type.getSimpleName() + " record: " + e.getMessage(), e);
        }
    }

    List<T> fromDocuments(List<JsonNode> documents) throws StorageException {
        List<T> result = new ArrayList<>(documents.size());
        for (JsonNode document : documents) {
            result.add(fromDocument(document));
        }
        return result;
    }
}
