package dev.rosterwatch.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.rosterwatch.config.WatchProperties;
import dev.rosterwatch.model.ScrapeCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * JSON file holding the fingerprints already notified, one array per category:
 * {@code {"booked": [...], "released": [...]}}.
 */
@Slf4j
@Repository
public class SeenBookingStore {

    private final ObjectMapper objectMapper;
    private final Path dataFile;

    @Autowired
    public SeenBookingStore(ObjectMapper objectMapper, WatchProperties properties) {
        this(objectMapper, Paths.get(properties.getDataFile()));
    }

    SeenBookingStore(ObjectMapper objectMapper, Path dataFile) {
        this.objectMapper = objectMapper;
        this.dataFile = dataFile;
    }

    public Path getDataFile() {
        return dataFile;
    }

    /**
     * Read the persisted fingerprints.
     * A missing, unreadable or malformed file yields empty sets.
     *
     * @return Insertion-ordered fingerprints for every category
     */
    public Map<ScrapeCategory, Set<String>> load() {
        Map<ScrapeCategory, Set<String>> seen = emptyState();
        if (!Files.exists(dataFile)) {
            log.info("No seen bookings file at {} - starting fresh", dataFile);
            return seen;
        }

        try {
            JsonNode root = objectMapper.readTree(Files.readString(dataFile, StandardCharsets.UTF_8));
            if (root == null || !root.isObject()) {
                log.warn("Could not load seen bookings: {} is not a JSON object", dataFile);
                return emptyState();
            }
            for (ScrapeCategory category : ScrapeCategory.values()) {
                JsonNode entries = root.path(category.getKey());
                if (entries.isArray()) {
                    entries.forEach(entry -> seen.get(category).add(entry.asText()));
                }
            }
        } catch (IOException e) {
            log.warn("Could not load seen bookings: {}", e.getMessage());
            return emptyState();
        }

        log.info("Loaded {} booked and {} released records",
                seen.get(ScrapeCategory.BOOKED).size(), seen.get(ScrapeCategory.RELEASED).size());
        return seen;
    }

    /**
     * Rewrite the whole file with the given fingerprints.
     *
     * @return false if the file could not be written
     */
    public boolean save(Map<ScrapeCategory, Set<String>> seen) {
        ObjectNode root = objectMapper.createObjectNode();
        for (ScrapeCategory category : ScrapeCategory.values()) {
            ArrayNode entries = root.putArray(category.getKey());
            seen.getOrDefault(category, Set.of()).forEach(entries::add);
        }

        try {
            Path parent = dataFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(dataFile, toJson(root), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Error saving seen bookings to {}: {}", dataFile, e.getMessage());
            return false;
        }

        log.info("Saved {} booked and {} released records",
                root.get(ScrapeCategory.BOOKED.getKey()).size(), root.get(ScrapeCategory.RELEASED.getKey()).size());
        return true;
    }

    private String toJson(ObjectNode root) throws JsonProcessingException {
        return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(root);
    }

    private static Map<ScrapeCategory, Set<String>> emptyState() {
        Map<ScrapeCategory, Set<String>> state = new EnumMap<>(ScrapeCategory.class);
        for (ScrapeCategory category : ScrapeCategory.values()) {
            state.put(category, new LinkedHashSet<>());
        }
        return state;
    }
}
