package com.ryuqq.pipeline.adapter.file.dlq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.pipeline.adapter.file.json.PipelineObjectMappers;
import com.ryuqq.pipeline.core.spi.DeadLetterEntry;
import com.ryuqq.pipeline.core.spi.DeadLetterQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 일자별 JSONL 파일 기반 {@link DeadLetterQueue} 구현체.
 *
 * <p>실패 작업 하나가 {@code dlq_yyyyMMdd.jsonl}의 한 줄이 됩니다 (UTC 기준 일자).
 * {@link #readAll()}은 파일 이름 순, 파일 안에서는 줄 순서로 읽으며 해석할 수 없는 줄은 경고 후 건너뜁니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class JsonlDeadLetterQueue implements DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(JsonlDeadLetterQueue.class);

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final String FILE_GLOB = "dlq_*.jsonl";

    private final Path directory;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Object writeLock = new Object();

    public JsonlDeadLetterQueue(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public JsonlDeadLetterQueue(Path directory, Clock clock) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.directory = directory;
        this.mapper = PipelineObjectMappers.jsonLines();
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create dead-letter directory: " + directory, e);
        }
    }

    @Override
    public void push(String taskType, Map<String, Object> payload, String error, Map<String, Object> context) {
        Instant now = clock.instant();
        DeadLetterEntry entry = new DeadLetterEntry(now, taskType, payload, error, context);
        String line;
        try {
            line = mapper.writeValueAsString(entry) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize dead letter for " + taskType, e);
        }

        Path file = directory.resolve("dlq_" + FILE_DATE.format(now) + ".jsonl");
        synchronized (writeLock) {
            try {
                Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append dead letter to " + file, e);
            }
        }
        log.debug("Dead letter recorded for {}: {}", taskType, error);
    }

    @Override
    public List<DeadLetterEntry> readAll() {
        List<DeadLetterEntry> entries = new ArrayList<>();
        synchronized (writeLock) {
            for (Path file : files()) {
                readFile(file, entries);
            }
        }
        return entries;
    }

    @Override
    public int count() {
        return readAll().size();
    }

    private void readFile(Path file, List<DeadLetterEntry> entries) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dead letters from " + file, e);
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(mapper.readValue(line, DeadLetterEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed dead letter at {}:{}: {}", file, i + 1, e.getOriginalMessage());
            }
        }
    }

    private List<Path> files() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, FILE_GLOB)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list dead-letter directory: " + directory, e);
        }
        files.sort(null);
        return files;
    }
}
