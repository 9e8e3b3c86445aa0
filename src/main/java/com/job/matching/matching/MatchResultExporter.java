package com.job.matching.matching;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.job.matching.core.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes ranked match results to a pretty-printed JSON file.
 */
public class MatchResultExporter {
    private static final Logger log = LoggerFactory.getLogger(MatchResultExporter.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MatchResultExporter() {
        this(Clock.systemDefaultZone());
    }

    public MatchResultExporter(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes to {@code job_matches_<yyyyMMdd_HHmmss>.json} in {@code directory}.
     */
    public Path export(List<MatchResult> matches, Path directory) {
        String fileName = "job_matches_" + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + ".json";
        return export(matches, directory, fileName);
    }

    public Path export(List<MatchResult> matches, Path directory, String fileName) {
        Path target = directory.resolve(fileName);
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(target.toFile(), matches);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write match results to " + target, e);
        }
        log.info("match.export path={} count={}", target, matches.size());
        return target;
    }
}
