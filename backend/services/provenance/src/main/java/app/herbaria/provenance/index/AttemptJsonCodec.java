package app.herbaria.provenance.index;

import app.herbaria.provenance.domain.entity.ExtractionAttemptEntity;
import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.model.FieldValue;
import app.herbaria.provenance.domain.type.DwcTerm;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON column layout of attempts and aggregation snapshots.
 *
 * <p>Field maps are stored as {@code {"term": {"value": "...", "confidence": 0.9}}}.
 */
class AttemptJsonCodec {

    private final ObjectMapper objectMapper;

    AttemptJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    ObjectNode writeFields(Map<?, FieldValue> fields) {
        ObjectNode out = objectMapper.createObjectNode();
        if (fields == null) {
            return out;
        }
        fields.forEach((key, value) -> {
            ObjectNode node = out.putObject(keyName(key));
            node.put("value", value.value());
            node.put("confidence", value.confidence());
        });
        return out;
    }

    ArrayNode writeErrors(List<String> errors) {
        ArrayNode out = objectMapper.createArrayNode();
        if (errors != null) {
            errors.forEach(out::add);
        }
        return out;
    }

    Map<DwcTerm, FieldValue> readFields(JsonNode node) {
        Map<DwcTerm, FieldValue> out = new EnumMap<>(DwcTerm.class);
        readValues(node).forEach((key, value) -> DwcTerm.fromName(key).ifPresent(term -> out.put(term, value)));
        return out;
    }

    Map<String, FieldValue> readValues(JsonNode node) {
        Map<String, FieldValue> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode value = entry.getValue();
            String text = value.path("value").isNull() ? null : value.path("value").asText(null);
            out.put(entry.getKey(), new FieldValue(text, value.path("confidence").asDouble(0.0)));
        }
        return out;
    }

    List<String> readErrors(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return out;
        }
        node.forEach(item -> out.add(item.asText()));
        return out;
    }

    ExtractionAttempt toModel(ExtractionAttemptEntity entity) {
        return new ExtractionAttempt(
                entity.getAttemptId(),
                entity.getSpecimenIdentity(),
                entity.getProvider(),
                entity.getModel(),
                entity.getParamsHash(),
                entity.getImageHash(),
                entity.getRunId(),
                entity.isForced(),
                entity.getStatus(),
                readFields(entity.getFieldsJson()),
                readValues(entity.getExtrasJson()),
                readErrors(entity.getErrorsJson()),
                entity.getCreatedAt(),
                entity.getCompletedAt()
        );
    }

    String toJsonText(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize json column", e);
        }
    }

    JsonNode writeRecord(AggregatedRecord record) {
        return objectMapper.valueToTree(record);
    }

    AggregatedRecord readRecord(JsonNode node) {
        try {
            return objectMapper.treeToValue(node, AggregatedRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored aggregation snapshot is unreadable", e);
        }
    }

    private static String keyName(Object key) {
        return key instanceof DwcTerm term ? term.name() : String.valueOf(key);
    }
}
