package app.herbaria.provenance.addressing;

import app.herbaria.provenance.domain.model.AddressedParams;
import app.herbaria.provenance.domain.model.ExtractionParams;
import app.herbaria.provenance.exception.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Stable identities for image bytes and extraction parameter sets.
 *
 * <p>Parameters are hashed over a canonical JSON form: object keys sorted recursively,
 * array order kept. Two parameter maps that differ only in key order get the same hash.
 */
@Component
public class ContentAddressor {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final ObjectMapper objectMapper;

    public ContentAddressor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String identify(byte[] imageBytes) {
        if (imageBytes == null) {
            throw new IllegalArgumentException("image bytes are required");
        }
        return HexFormat.of().formatHex(sha256().digest(imageBytes));
    }

    public String identify(InputStream in) {
        MessageDigest digest = sha256();
        byte[] buffer = new byte[BUFFER_SIZE];
        try {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read image stream", e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public String identify(Path imagePath) {
        try (InputStream in = Files.newInputStream(imagePath)) {
            return identify(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read image " + imagePath, e);
        }
    }

    public AddressedParams address(ExtractionParams params) {
        JsonNode canonical = canonicalize(params.asMap());
        return new AddressedParams(hash(canonical), canonical, params.provider(), params.model());
    }

    public String hashParams(Map<String, ?> params) {
        return hash(canonicalize(params));
    }

    public JsonNode canonicalize(Map<String, ?> params) {
        JsonNode tree;
        try {
            tree = objectMapper.valueToTree(params);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Extraction parameters are not serializable: " + e.getMessage(), e);
        }
        return canonicalizeJson(tree);
    }

    private String hash(JsonNode canonical) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(canonical);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to serialize canonical parameters", e);
        }
        return HexFormat.of().formatHex(sha256().digest(bytes));
    }

    private JsonNode canonicalizeJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return NullNode.getInstance();
        }

        if (node.isObject()) {
            ObjectNode obj = (ObjectNode) node;
            ObjectNode out = JsonNodeFactory.instance.objectNode();

            List<String> names = new ArrayList<>();
            obj.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);

            for (String name : names) {
                out.set(name, canonicalizeJson(obj.get(name)));
            }
            return out;
        }

        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            for (JsonNode el : node) {
                out.add(canonicalizeJson(el));
            }
            return out;
        }

        if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
            throw new ConfigurationException("Extraction parameter is not a finite number: " + node.asText());
        }
        if (node.isPojo()) {
            throw new ConfigurationException("Extraction parameter has no JSON form: " + node.getClass().getSimpleName());
        }

        return node;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
