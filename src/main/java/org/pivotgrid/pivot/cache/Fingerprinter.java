package org.pivotgrid.pivot.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pivotgrid.pivot.api.PivotRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the cache key of a request: the SHA-256 of a canonical JSON document in which object
 * keys are sorted recursively and expanded path sets are sorted, while the order of every list
 * in the configuration is preserved.
 */
public final class Fingerprinter {

    /** Element-wise path order, NULL elements after all others, shorter paths first on a tie. */
    static final Comparator<List<String>> PATH_ORDER = (a, b) -> {
        final int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            final String x = a.get(i);
            final String y = b.get(i);
            if (x == null || y == null) {
                if (x != y) {
                    return x == null ? 1 : -1;
                }
                continue;
            }
            final int cmp = x.compareTo(y);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    private final ObjectMapper objectMapper;

    public Fingerprinter(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String fingerprint(final PivotRequest request) {
        final ObjectNode document = objectMapper.createObjectNode();
        document.put("dataset", request.dataset());
        document.set("configuration", objectMapper.valueToTree(request.configuration()));
        document.set("expandedPaths", paths(request.expandedPaths()));
        document.set("expandedColumnPaths", paths(request.expandedColumnPaths()));

        try {
            final byte[] canonical = objectMapper.writeValueAsString(canonicalize(document))
                .getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request for fingerprinting", e);
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private ArrayNode paths(final Set<List<String>> paths) {
        final List<List<String>> sorted = new ArrayList<>(paths);
        sorted.sort(PATH_ORDER);
        final ArrayNode array = objectMapper.createArrayNode();
        for (final List<String> path : sorted) {
            final ArrayNode element = array.addArray();
            path.forEach(element::add);
        }
        return array;
    }

    private JsonNode canonicalize(final JsonNode node) {
        if (node.isObject()) {
            final ObjectNode sorted = objectMapper.createObjectNode();
            final Set<String> names = new TreeSet<>();
            final Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            for (final String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            final ArrayNode copy = objectMapper.createArrayNode();
            node.forEach(element -> copy.add(canonicalize(element)));
            return copy;
        }
        return node;
    }
}
