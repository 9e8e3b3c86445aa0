package com.job.matching.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.job.matching.core.model.JobApplicationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * File-backed store made of a snapshot and an append-only log.
 *
 * <ul>
 *   <li>{@code applications.json}: object keyed by record id, rewritten only on compaction
 *       (temp file, then atomic rename).</li>
 *   <li>{@code applications.log.jsonl}: one full record per line, fsynced per append.
 *       The last line for an id wins.</li>
 * </ul>
 *
 * A trailing line without a newline is the mark of a crash mid-append; it is logged
 * and cut off. Any other unreadable content raises {@link StorageCorruptionException}.
 */
public class JsonlApplicationStore implements ApplicationStore {
    private static final Logger log = LoggerFactory.getLogger(JsonlApplicationStore.class);

    public static final String SNAPSHOT_FILE = "applications.json";
    public static final String LOG_FILE = "applications.log.jsonl";
    public static final int DEFAULT_MAX_LOG_ENTRIES = 1000;

    private final Path directory;
    private final Path snapshotPath;
    private final Path logPath;
    private final int maxLogEntries;
    private final ObjectMapper objectMapper;
    private final ObjectMapper snapshotMapper;
    private FileChannel logChannel;
    private int logEntries;

    public JsonlApplicationStore(Path directory) {
        this(directory, DEFAULT_MAX_LOG_ENTRIES);
    }

    public JsonlApplicationStore(Path directory, int maxLogEntries) {
        if (maxLogEntries <= 0) {
            throw new IllegalArgumentException("maxLogEntries must be positive");
        }
        this.directory = directory;
        this.snapshotPath = directory.resolve(SNAPSHOT_FILE);
        this.logPath = directory.resolve(LOG_FILE);
        this.maxLogEntries = maxLogEntries;
        this.objectMapper = new ObjectMapper();
        this.snapshotMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized Map<String, JobApplicationRecord> loadAll() {
        Map<String, JobApplicationRecord> records = new LinkedHashMap<>();
        readSnapshot(records);
        int replayed = replayLog(records);
        logEntries = replayed;
        log.info("store.loaded directory={} records={} logEntries={}", directory, records.size(), replayed);
        return records;
    }

    @Override
    public synchronized void append(JobApplicationRecord record) {
        try {
            byte[] line = (objectMapper.writeValueAsString(record) + "\n").getBytes(StandardCharsets.UTF_8);
            FileChannel channel = logChannel();
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(false);
            logEntries++;
            log.debug("store.append id={} logEntries={}", record.id(), logEntries);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append record " + record.id() + " to " + logPath, e);
        }
    }

    @Override
    public synchronized void rewrite(Collection<JobApplicationRecord> records) {
        Map<String, JobApplicationRecord> snapshot = new LinkedHashMap<>();
        for (JobApplicationRecord record : records) {
            snapshot.put(record.id(), record);
        }
        Path tmp = snapshotPath.resolveSibling(SNAPSHOT_FILE + ".tmp");
        try {
            Files.createDirectories(directory);
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(snapshotMapper.writeValueAsBytes(snapshot));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(tmp, snapshotPath);
            truncateLog();
            log.info("store.compacted records={}", snapshot.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to rewrite snapshot " + snapshotPath, e);
        }
    }

    @Override
    public synchronized boolean needsCompaction() {
        return logEntries >= maxLogEntries;
    }

    @Override
    public synchronized void close() {
        if (logChannel != null) {
            try {
                logChannel.close();
            } catch (IOException e) {
                log.warn("store.close.failed path={} reason={}", logPath, e.getMessage());
            }
            logChannel = null;
        }
    }

    private void readSnapshot(Map<String, JobApplicationRecord> records) {
        if (!Files.exists(snapshotPath)) {
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(snapshotPath.toFile());
        } catch (JsonProcessingException e) {
            throw new StorageCorruptionException("Snapshot " + snapshotPath + " is not valid JSON", e);
        } catch (IOException e) {
            throw new StorageCorruptionException("Snapshot " + snapshotPath + " could not be read", e);
        }
        if (root == null || root.isMissingNode()) {
            return;
        }
        if (!root.isObject()) {
            throw new StorageCorruptionException("Snapshot " + snapshotPath + " must hold a JSON object keyed by id");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JobApplicationRecord record = toRecord(entry.getValue(), entry.getKey(), snapshotPath.toString());
            records.put(record.id(), record);
        }
    }

    private int replayLog(Map<String, JobApplicationRecord> records) {
        if (!Files.exists(logPath)) {
            return 0;
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(logPath);
        } catch (IOException e) {
            throw new StorageCorruptionException("Log " + logPath + " could not be read", e);
        }

        int lastNewline = -1;
        for (int i = bytes.length - 1; i >= 0; i--) {
            if (bytes[i] == '\n') {
                lastNewline = i;
                break;
            }
        }
        if (lastNewline < bytes.length - 1) {
            log.warn("store.log.torn path={} droppedBytes={}", logPath, bytes.length - 1 - lastNewline);
            truncateTo(lastNewline + 1);
        }

        String content = new String(bytes, 0, lastNewline + 1, StandardCharsets.UTF_8);
        String[] lines = content.split("\n");
        int replayed = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode node;
            try {
                node = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                throw new StorageCorruptionException("Log " + logPath + " line " + (i + 1) + " is not valid JSON", e);
            }
            JobApplicationRecord record = toRecord(node, null, logPath + " line " + (i + 1));
            records.remove(record.id());
            records.put(record.id(), record);
            replayed++;
        }
        return replayed;
    }

    private JobApplicationRecord toRecord(JsonNode node, String fallbackId, String source) {
        if (!(node instanceof ObjectNode object)) {
            throw new StorageCorruptionException("Entry in " + source + " is not a JSON object");
        }
        if (fallbackId != null && (!object.hasNonNull("job_id") || object.get("job_id").asText().isEmpty())) {
            object.put("job_id", fallbackId);
        }
        if (!object.hasNonNull("job_id")) {
            throw new StorageCorruptionException("Entry in " + source + " has no job_id");
        }
        try {
            return objectMapper.treeToValue(object, JobApplicationRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StorageCorruptionException("Entry in " + source + " could not be mapped to a record", e);
        }
    }

    private FileChannel logChannel() throws IOException {
        if (logChannel == null || !logChannel.isOpen()) {
            Files.createDirectories(directory);
            logChannel = FileChannel.open(logPath, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        }
        return logChannel;
    }

    private void truncateLog() throws IOException {
        close();
        try (FileChannel channel = FileChannel.open(logPath, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            channel.force(true);
        }
        logEntries = 0;
    }

    private void truncateTo(long size) {
        try (FileChannel channel = FileChannel.open(logPath, StandardOpenOption.WRITE)) {
            channel.truncate(size);
            channel.force(true);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to cut torn tail from " + logPath, e);
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("store.move.nonatomic target={}", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
