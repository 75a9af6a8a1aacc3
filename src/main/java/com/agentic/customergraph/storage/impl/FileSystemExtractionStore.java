package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.core.Entity;
import com.agentic.customergraph.core.GraphMetrics;
import com.agentic.customergraph.core.GraphSnapshot;
import com.agentic.customergraph.core.Relationship;
import com.agentic.customergraph.core.SnapshotMetadata;
import com.agentic.customergraph.exception.ExtractionStoreException;
import com.agentic.customergraph.exception.SnapshotNotFoundException;
import com.agentic.customergraph.storage.ExtractionStore;
import com.agentic.customergraph.utils.LockUtil;
import com.agentic.customergraph.utils.StorageKeys;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Extraction Store on a local or mounted file system.
 *
 * <p>Directory layout under the configured root:</p>
 * <pre>
 * customer-graphs/{customer}/manifest.json
 * customer-graphs/{customer}/extractions/{extraction}/nodes.json
 * customer-graphs/{customer}/extractions/{extraction}/edges.json
 * customer-graphs/{customer}/extractions/{extraction}/metadata.json
 * </pre>
 *
 * <p>Path components come from {@link StorageKeys#component(String)}. The ids
 * reported by {@link #listExtractions(String)} and checked by
 * {@link #read(String, String)} are the ones stored in the documents, never
 * the directory names.</p>
 *
 * <p>Snapshots are written into a staging directory and published by an
 * atomic directory rename, so a listed extraction is always complete.
 * {@code nodes.json} and {@code edges.json} are read either as bare arrays or
 * as objects wrapping a {@code nodes} / {@code edges} array.</p>
 */
public class FileSystemExtractionStore implements ExtractionStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemExtractionStore.class);

    private static final String STAGING_DIR = ".staging";
    private static final String LOCK_SCOPE = "extraction-store-manifest";

    private final Path root;

    public FileSystemExtractionStore(@NotNull Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public CompletableFuture<Void> write(@NotNull GraphSnapshot snapshot) {
        return CompletableFuture.runAsync(() -> {
            String customerId = snapshot.customerId();
            String extractionId = snapshot.extractionId();
            Path target = extractionDir(customerId, extractionId);
            if (Files.exists(target)) {
                throw new ExtractionStoreException("Snapshot already exists: " + extractionId,
                    customerId, extractionId, false);
            }

            Path staging = customerDir(customerId).resolve(STAGING_DIR)
                .resolve(StorageKeys.sanitize(extractionId) + "-" + UUID.randomUUID());
            try {
                Files.createDirectories(staging);
                writeJson(staging.resolve(StorageKeys.NODES_FILE), nodesDocument(snapshot));
                writeJson(staging.resolve(StorageKeys.EDGES_FILE), edgesDocument(snapshot));
                writeJson(staging.resolve(StorageKeys.METADATA_FILE), metadataDocument(snapshot));

                Files.createDirectories(target.getParent());
                Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (FileAlreadyExistsException | DirectoryNotEmptyException e) {
                deleteQuietly(staging);
                throw new ExtractionStoreException("Snapshot already exists: " + extractionId,
                    customerId, extractionId, false, e);
            } catch (IOException e) {
                deleteQuietly(staging);
                throw new ExtractionStoreException("Failed to write snapshot " + extractionId + ": " + e.getMessage(),
                    customerId, extractionId, true, e);
            }

            updateManifest(customerId);
            logger.info("Wrote snapshot {} for customer {} to {}", extractionId, customerId, target);
        });
    }

    @Override
    public CompletableFuture<GraphSnapshot> read(@NotNull String customerId, @NotNull String extractionId) {
        return CompletableFuture.supplyAsync(() -> {
            Path dir = extractionDir(customerId, extractionId);
            if (!isComplete(dir)) {
                throw new SnapshotNotFoundException(customerId, extractionId);
            }
            try {
                StoredIds stored = storedIds(dir);
                if (!stored.belongsTo(customerId) || !stored.extractionId().equals(extractionId)) {
                    logger.warn("Extraction key {} for customer {} holds {}/{}", dir.getFileName(), customerId,
                        stored.customerId(), stored.extractionId());
                    throw new SnapshotNotFoundException(customerId, extractionId);
                }
                List<Entity> nodes = readList(dir.resolve(StorageKeys.NODES_FILE), "nodes",
                    new TypeReference<List<Entity>>() { });
                List<Relationship> edges = readList(dir.resolve(StorageKeys.EDGES_FILE), "edges",
                    new TypeReference<List<Relationship>>() { });

                SnapshotMetadata metadata = null;
                GraphMetrics metrics = null;
                Path metadataFile = dir.resolve(StorageKeys.METADATA_FILE);
                if (Files.exists(metadataFile)) {
                    JsonNode document = SnapshotJson.MAPPER.readTree(metadataFile.toFile());
                    if (document.hasNonNull("metadata")) {
                        metadata = SnapshotJson.MAPPER.treeToValue(document.get("metadata"), SnapshotMetadata.class);
                    }
                    if (document.hasNonNull("metrics")) {
                        metrics = SnapshotJson.MAPPER.treeToValue(document.get("metrics"), GraphMetrics.class);
                    }
                }
                return new GraphSnapshot(customerId, extractionId, nodes, edges, metadata, metrics);
            } catch (IOException e) {
                throw new ExtractionStoreException("Failed to read snapshot " + extractionId + ": " + e.getMessage(),
                    customerId, extractionId, true, e);
            }
        });
    }

    /**
     * Lists the extraction ids recorded in the customer's published snapshots,
     * ascending. Snapshots written for another customer id are skipped.
     */
    @Override
    public CompletableFuture<List<String>> listExtractions(@NotNull String customerId) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return publishedIds(customerId);
            } catch (IOException e) {
                throw new ExtractionStoreException("Failed to list extractions: " + e.getMessage(),
                    customerId, null, true, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listCustomers() {
        return CompletableFuture.supplyAsync(() -> {
            Path customers = root.resolve(StorageKeys.ROOT_PREFIX);
            if (!Files.isDirectory(customers)) {
                return new ArrayList<>();
            }
            List<String> result = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(customers, Files::isDirectory)) {
                for (Path dir : stream) {
                    result.add(customerIdOf(dir));
                }
            } catch (IOException e) {
                throw new ExtractionStoreException("Failed to list customers: " + e.getMessage(), null, null, true, e);
            }
            Collections.sort(result);
            return result;
        });
    }

    private String customerIdOf(Path customerDir) throws IOException {
        Path manifest = customerDir.resolve(StorageKeys.MANIFEST_FILE);
        if (Files.exists(manifest)) {
            JsonNode document = SnapshotJson.MAPPER.readTree(manifest.toFile());
            if (document.hasNonNull("customer_id")) {
                return document.get("customer_id").asText();
            }
        }
        return customerDir.getFileName().toString();
    }

    /**
     * Rewrites the customer manifest listing every published extraction.
     */
    private void updateManifest(String customerId) {
        ReentrantLock lock = LockUtil.customerLock(LOCK_SCOPE + ":" + root, customerId);
        lock.lock();
        try {
            List<String> ids = publishedIds(customerId);
            ObjectNode manifest = SnapshotJson.MAPPER.createObjectNode();
            manifest.put("customer_id", customerId);
            manifest.put("extraction_count", ids.size());
            manifest.put("latest_extraction", ids.isEmpty() ? null : ids.get(ids.size() - 1));
            ArrayNode list = manifest.putArray("extractions");
            ids.forEach(list::add);

            Path manifestFile = root.resolve(StorageKeys.customerManifestKey(customerId));
            Path temp = manifestFile.resolveSibling(StorageKeys.MANIFEST_FILE + "." + UUID.randomUUID() + ".tmp");
            writeJson(temp, manifest);
            Files.move(temp, manifestFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            // The snapshot itself is published; the manifest is rebuilt on the next write.
            logger.warn("Failed to update manifest for customer {}: {}", customerId, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private List<String> publishedIds(String customerId) throws IOException {
        Path extractions = customerDir(customerId).resolve(StorageKeys.EXTRACTIONS);
        List<String> ids = new ArrayList<>();
        if (!Files.isDirectory(extractions)) {
            return ids;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(extractions, this::isComplete)) {
            for (Path dir : stream) {
                StoredIds stored = storedIds(dir);
                if (stored.belongsTo(customerId)) {
                    ids.add(stored.extractionId());
                } else {
                    logger.warn("Skipping {} under customer {}: written for customer {}", dir.getFileName(),
                        customerId, stored.customerId());
                }
            }
        }
        Collections.sort(ids);
        return ids;
    }

    /**
     * Reads the ids a snapshot was written with. Metadata is preferred; bare
     * array documents carry no header and fall back to the directory name.
     */
    private StoredIds storedIds(Path extractionDir) throws IOException {
        String dirName = extractionDir.getFileName().toString();
        Path metadataFile = extractionDir.resolve(StorageKeys.METADATA_FILE);
        Path source = Files.exists(metadataFile) ? metadataFile : extractionDir.resolve(StorageKeys.NODES_FILE);
        JsonNode document = SnapshotJson.MAPPER.readTree(source.toFile());
        if (!document.isObject()) {
            return new StoredIds(null, dirName);
        }
        return new StoredIds(document.path("customer_id").asText(null),
            document.path("extraction_id").asText(dirName));
    }

    private record StoredIds(String customerId, String extractionId) {

        boolean belongsTo(String requestedCustomer) {
            return customerId == null || customerId.equals(requestedCustomer);
        }
    }

    private boolean isComplete(Path extractionDir) {
        return Files.isRegularFile(extractionDir.resolve(StorageKeys.NODES_FILE))
            && Files.isRegularFile(extractionDir.resolve(StorageKeys.EDGES_FILE));
    }

    private Path customerDir(String customerId) {
        return root.resolve(StorageKeys.ROOT_PREFIX).resolve(StorageKeys.component(customerId));
    }

    private Path extractionDir(String customerId, String extractionId) {
        return customerDir(customerId).resolve(StorageKeys.EXTRACTIONS).resolve(StorageKeys.component(extractionId));
    }

    private ObjectNode nodesDocument(GraphSnapshot snapshot) {
        ObjectNode document = header(snapshot);
        document.set("nodes", SnapshotJson.MAPPER.valueToTree(snapshot.nodes()));
        return document;
    }

    private ObjectNode edgesDocument(GraphSnapshot snapshot) {
        ObjectNode document = header(snapshot);
        document.set("edges", SnapshotJson.MAPPER.valueToTree(snapshot.edges()));
        return document;
    }

    private ObjectNode metadataDocument(GraphSnapshot snapshot) {
        ObjectNode document = header(snapshot);
        document.set("metadata", SnapshotJson.MAPPER.valueToTree(snapshot.metadata()));
        document.set("metrics", SnapshotJson.MAPPER.valueToTree(snapshot.metrics()));
        return document;
    }

    private ObjectNode header(GraphSnapshot snapshot) {
        ObjectNode document = SnapshotJson.MAPPER.createObjectNode();
        document.put("customer_id", snapshot.customerId());
        document.put("extraction_id", snapshot.extractionId());
        return document;
    }

    private <T> List<T> readList(Path file, String field, TypeReference<List<T>> type) throws IOException {
        JsonNode document = SnapshotJson.MAPPER.readTree(file.toFile());
        JsonNode array = document.isArray() ? document : document.path(field);
        if (array.isMissingNode() || array.isNull()) {
            return new ArrayList<>();
        }
        if (!array.isArray()) {
            throw new IOException("Expected an array of " + field + " in " + file.getFileName());
        }
        return SnapshotJson.MAPPER.readerFor(type).readValue(array);
    }

    private void writeJson(Path file, JsonNode document) throws IOException {
        SnapshotJson.MAPPER.writeValue(file.toFile(), document);
    }

    private void deleteQuietly(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            logger.warn("Failed to clean staging directory {}: {}", dir, e.getMessage());
        }
    }
}
