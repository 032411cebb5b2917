package com.creditrust.rag.index;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;
import java.util.zip.CheckedOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.creditrust.rag.error.IncompatibleIndexException;
import com.creditrust.rag.error.IndexCorruptionException;
import com.creditrust.rag.ingest.Chunk;
import com.creditrust.rag.ingest.SourceMetadata;
import com.creditrust.rag.ingest.TextSpan;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * On-disk format of a vector index. An index directory holds
 * <ul>
 * <li>{@code vectors.bin}: magic {@code CRVI}, schema version, dimension,
 * metric and count, followed by {@code count * dimension} big-endian
 * floats;</li>
 * <li>{@code chunks.json}: a manifest repeating the header, the CRC32 of the
 * vector payload and the chunk metadata in vector order.</li>
 * </ul>
 * Both files are written to a staging directory that replaces the target in a
 * single move.
 */
public class VectorIndexFile {

    private static final Logger LOGGER = LoggerFactory.getLogger(VectorIndexFile.class);

    static final int SCHEMA_VERSION = 1;
    static final String VECTORS_FILE = "vectors.bin";
    static final String MANIFEST_FILE = "chunks.json";

    private static final int MAGIC = 0x43525649;

    private final ObjectMapper objectMapper;

    public VectorIndexFile(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static boolean exists(Path directory) {
        return Files.isDirectory(directory) && Files.exists(directory.resolve(VECTORS_FILE))
                && Files.exists(directory.resolve(MANIFEST_FILE));
    }

    public void persist(VectorIndex index, Path directory) {
        Path target = directory.toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            Path staging = Files.createTempDirectory(target.getParent(), target.getFileName() + ".staging-");
            List<IndexEntry> entries = index.entries();
            long checksum = writeVectors(staging.resolve(VECTORS_FILE), index, entries);
            List<ChunkRecord> chunks = entries.stream().map(entry -> ChunkRecord.of(entry.chunk())).toList();
            Manifest manifest = new Manifest(SCHEMA_VERSION, index.dimension(), index.metric().name(),
                    index.corpusVersion(), entries.size(), checksum, chunks);
            objectMapper.writeValue(staging.resolve(MANIFEST_FILE).toFile(), manifest);
            replace(staging, target);
            LOGGER.info("Persisted index with {} vectors (dimension={}, metric={}) to {}", entries.size(),
                    index.dimension(), index.metric(), target);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to persist index to " + target, ex);
        }
    }

    /**
     * Load an index and verify it against the configured dimension and
     * metric.
     *
     * @throws IncompatibleIndexException if dimension or metric differ
     * @throws IndexCorruptionException   if the files fail their integrity
     *                                    checks
     */
    public ExactVectorIndex load(Path directory, int expectedDimension, DistanceMetric expectedMetric) {
        if (!exists(directory)) {
            throw new IndexCorruptionException("No complete index found at " + directory);
        }
        Manifest manifest = readManifest(directory.resolve(MANIFEST_FILE));
        if (manifest.schemaVersion() != SCHEMA_VERSION) {
            throw new IndexCorruptionException("Unsupported index schema version " + manifest.schemaVersion());
        }
        try (CheckedInputStream checked = new CheckedInputStream(
                new BufferedInputStream(Files.newInputStream(directory.resolve(VECTORS_FILE))), new CRC32());
                DataInputStream in = new DataInputStream(checked)) {
            if (in.readInt() != MAGIC) {
                throw new IndexCorruptionException("Not a vector index file: " + directory.resolve(VECTORS_FILE));
            }
            int schemaVersion = in.readInt();
            int dimension = in.readInt();
            String metricName = in.readUTF();
            int count = in.readInt();
            if (schemaVersion != manifest.schemaVersion() || dimension != manifest.dimension()
                    || !metricName.equals(manifest.metric()) || count != manifest.count()
                    || count != manifest.chunks().size()) {
                throw new IndexCorruptionException("Vector file header does not match the chunk manifest");
            }
            if (dimension != expectedDimension || !metricName.equals(expectedMetric.name())) {
                throw new IncompatibleIndexException("Index at " + directory + " was written with dimension "
                        + dimension + " and metric " + metricName + " but dimension " + expectedDimension
                        + " and metric " + expectedMetric + " are configured");
            }
            checked.getChecksum().reset();
            List<IndexEntry> entries = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                float[] vector = new float[dimension];
                for (int d = 0; d < dimension; d++) {
                    vector[d] = in.readFloat();
                }
                entries.add(new IndexEntry(manifest.chunks().get(i).toChunk(manifest.corpusVersion()), vector));
            }
            if (checked.getChecksum().getValue() != manifest.checksum()) {
                throw new IndexCorruptionException("Vector payload checksum mismatch in " + directory);
            }
            if (in.read() != -1) {
                throw new IndexCorruptionException("Unexpected trailing data in " + directory.resolve(VECTORS_FILE));
            }
            ExactVectorIndex index = ExactVectorIndex.build(entries, expectedMetric);
            LOGGER.info("Loaded index with {} vectors (dimension={}, metric={}) from {}", count, dimension,
                    metricName, directory);
            return index;
        } catch (EOFException ex) {
            throw new IndexCorruptionException("Vector file is truncated: " + directory.resolve(VECTORS_FILE), ex);
        } catch (IOException ex) {
            throw new IndexCorruptionException("Unable to read index from " + directory, ex);
        } catch (IndexCorruptionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new IndexCorruptionException("Invalid index content in " + directory + ": " + ex.getMessage(), ex);
        }
    }

    private long writeVectors(Path file, VectorIndex index, List<IndexEntry> entries) throws IOException {
        CheckedOutputStream checked = new CheckedOutputStream(
                new BufferedOutputStream(Files.newOutputStream(file)), new CRC32());
        try (DataOutputStream out = new DataOutputStream(checked)) {
            out.writeInt(MAGIC);
            out.writeInt(SCHEMA_VERSION);
            out.writeInt(index.dimension());
            out.writeUTF(index.metric().name());
            out.writeInt(entries.size());
            checked.getChecksum().reset();
            for (IndexEntry entry : entries) {
                for (float value : entry.embedding()) {
                    out.writeFloat(value);
                }
            }
            out.flush();
            return checked.getChecksum().getValue();
        }
    }

    private Manifest readManifest(Path file) {
        try {
            Manifest manifest = objectMapper.readValue(file.toFile(), Manifest.class);
            if (manifest == null || manifest.chunks() == null || manifest.metric() == null
                    || manifest.corpusVersion() == null) {
                throw new IndexCorruptionException("Incomplete chunk manifest " + file);
            }
            return manifest;
        } catch (JacksonException ex) {
            throw new IndexCorruptionException("Unreadable chunk manifest " + file, ex);
        } catch (IOException ex) {
            throw new IndexCorruptionException("Unable to read chunk manifest " + file, ex);
        }
    }

    private static void replace(Path staging, Path target) throws IOException {
        Path backup = null;
        if (Files.exists(target)) {
            backup = target.resolveSibling(target.getFileName() + ".old-" + System.nanoTime());
            Files.move(target, backup, StandardCopyOption.ATOMIC_MOVE);
        }
        Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        if (backup != null) {
            deleteRecursively(backup);
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }

    record Manifest(int schemaVersion, int dimension, String metric, String corpusVersion, int count,
            long checksum, List<ChunkRecord> chunks) {
    }

    record ChunkRecord(String id, String documentId, int start, int end, String text, String product,
            String company, String submittedOn) {

        static ChunkRecord of(Chunk chunk) {
            SourceMetadata source = chunk.source();
            return new ChunkRecord(chunk.id(), chunk.documentId(), chunk.span().start(), chunk.span().end(),
                    chunk.text(), source.product(), source.company(),
                    source.submittedOn() == null ? null : source.submittedOn().toString());
        }

        Chunk toChunk(String version) {
            if (id == null || documentId == null || text == null) {
                throw new IndexCorruptionException("Incomplete chunk record " + id);
            }
            try {
                LocalDate submitted = submittedOn == null ? null : LocalDate.parse(submittedOn);
                return new Chunk(id, documentId, new TextSpan(start, end), text,
                        new SourceMetadata(product, submitted, company), version);
            } catch (DateTimeParseException | IllegalArgumentException ex) {
                throw new IndexCorruptionException("Invalid chunk record " + id, ex);
            }
        }
    }
}
