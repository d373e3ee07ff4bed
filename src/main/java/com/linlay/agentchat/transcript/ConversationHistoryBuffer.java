package com.linlay.agentchat.transcript;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.linlay.agentchat.config.HistoryBufferProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Append-only overflow journal for messages evicted from the in-memory window.
 * <p>
 * One JSON message per line in {@code <dir>/<prefix><pid>.jsonl}, readable and writable by the owner only.
 * Ids already written during the lifetime of this buffer are skipped on append; {@link #clear()} and
 * {@link #replace(List)} reset that set. A file holding a single JSON array is the legacy format and is
 * still accepted on read.
 */
@Component
public class ConversationHistoryBuffer {

    private static final Logger log = LoggerFactory.getLogger(ConversationHistoryBuffer.class);
    private static final String COMPACTION_ID_PREFIX = "compact_";
    private static final Set<PosixFilePermission> OWNER_READ_WRITE = PosixFilePermissions.fromString("rw-------");
    private static final TypeReference<List<ChatMessage>> MESSAGE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectWriter lineWriter;
    private final HistoryBufferProperties properties;
    private final Clock clock;
    private final Path path;
    private final Object lock = new Object();
    private final Set<String> writtenIds = new HashSet<>();
    private boolean seeded;

    public ConversationHistoryBuffer(ObjectMapper objectMapper, HistoryBufferProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.lineWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        this.properties = properties;
        this.clock = clock;
        this.path = resolvePath(properties, ProcessHandle.current().pid());
    }

    public Path path() {
        return path;
    }

    /**
     * Appends the messages whose ids were not written yet.
     *
     * @return number of messages written
     */
    public int append(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return 0;
        }
        synchronized (lock) {
            seedFromDisk();
            List<ChatMessage> fresh = new ArrayList<>();
            for (ChatMessage message : messages) {
                if (message == null || !StringUtils.hasText(message.id())) {
                    log.warn("Skip history message without id");
                    continue;
                }
                if (writtenIds.add(message.id())) {
                    fresh.add(message);
                }
            }
            if (fresh.isEmpty()) {
                return 0;
            }
            write(fresh, StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            return fresh.size();
        }
    }

    /**
     * Truncates the buffer and writes {@code messages} as its whole content.
     */
    public void replace(List<ChatMessage> messages) {
        synchronized (lock) {
            writtenIds.clear();
            seeded = true;
            List<ChatMessage> content = new ArrayList<>();
            if (messages != null) {
                for (ChatMessage message : messages) {
                    if (message != null && StringUtils.hasText(message.id()) && writtenIds.add(message.id())) {
                        content.add(message);
                    }
                }
            }
            write(content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        }
    }

    public void clear() {
        replace(List.of());
    }

    /**
     * Clears the buffer and leaves a single assistant message carrying the compaction summary.
     */
    public ChatMessage appendCompactionSummary(String summary) {
        Instant now = clock.instant();
        ChatMessage marker = ChatMessage.assistant(
                COMPACTION_ID_PREFIX + now.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8),
                summary,
                now
        );
        synchronized (lock) {
            clear();
            append(List.of(marker));
        }
        return marker;
    }

    public List<ChatMessage> read() {
        synchronized (lock) {
            return readFromDisk();
        }
    }

    public static boolean isCompactionMarker(ChatMessage message) {
        return message != null && message.id() != null && message.id().startsWith(COMPACTION_ID_PREFIX);
    }

    private List<ChatMessage> readFromDisk() {
        return readSnapshot().messages();
    }

    private DiskSnapshot readSnapshot() {
        if (!Files.exists(path)) {
            return DiskSnapshot.EMPTY;
        }
        String content;
        try {
            content = Files.readString(path, resolveCharset());
        } catch (IOException ex) {
            log.warn("Cannot read history buffer {}, fallback to empty history", path, ex);
            return new DiskSnapshot(List.of(), Layout.UNREADABLE);
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return DiskSnapshot.EMPTY;
        }
        if (trimmed.startsWith("[")) {
            try {
                List<ChatMessage> legacy = objectMapper.readValue(trimmed, MESSAGE_LIST);
                return new DiskSnapshot(legacy == null ? List.of() : List.copyOf(legacy), Layout.LEGACY_ARRAY);
            } catch (IOException ex) {
                log.warn("Cannot parse legacy history buffer {}, fallback to NDJSON", path);
                return new DiskSnapshot(parseLines(trimmed), Layout.BROKEN_ARRAY);
            }
        }
        return new DiskSnapshot(parseLines(trimmed), Layout.LINES);
    }

    private List<ChatMessage> parseLines(String trimmed) {
        List<ChatMessage> messages = new ArrayList<>();
        for (String line : trimmed.split("\\R")) {
            if (!StringUtils.hasText(line)) {
                continue;
            }
            try {
                ChatMessage message = objectMapper.readValue(line, ChatMessage.class);
                if (message != null) {
                    messages.add(message);
                }
            } catch (IOException ex) {
                log.warn("Skip malformed history buffer line in {}", path);
            }
        }
        return List.copyOf(messages);
    }

    private void seedFromDisk() {
        if (seeded) {
            return;
        }
        seeded = true;
        DiskSnapshot snapshot = readSnapshot();
        if (snapshot.layout() == Layout.BROKEN_ARRAY) {
            backUpBrokenFile();
            return;
        }
        for (ChatMessage message : snapshot.messages()) {
            if (StringUtils.hasText(message.id())) {
                writtenIds.add(message.id());
            }
        }
        if (snapshot.layout() == Layout.LEGACY_ARRAY) {
            // appending lines after a JSON array would hide them from the legacy reader
            write(snapshot.messages(), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            log.info("Migrated legacy history buffer {} to NDJSON, messages={}", path, snapshot.messages().size());
        }
    }

    /**
     * Moves an unparseable legacy file aside so new lines start a clean NDJSON file and the old bytes
     * stay on disk for recovery.
     */
    private void backUpBrokenFile() {
        Path backup = path.resolveSibling(path.getFileName() + ".broken-" + clock.millis());
        try {
            Files.move(path, backup);
            log.warn("Legacy history buffer {} is not a readable JSON array, moved to {}", path, backup);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot back up history buffer " + path, ex);
        }
    }

    private void write(List<ChatMessage> messages, OpenOption... options) {
        try {
            StringBuilder lines = new StringBuilder();
            for (ChatMessage message : messages) {
                lines.append(lineWriter.writeValueAsString(message)).append('\n');
            }
            Files.createDirectories(path.getParent());
            createOwnerOnly();
            Files.writeString(path, lines.toString(), resolveCharset(), options);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot write history buffer " + path, ex);
        }
    }

    private void createOwnerOnly() throws IOException {
        boolean posix = path.getFileSystem().supportedFileAttributeViews().contains("posix");
        if (!Files.exists(path)) {
            if (posix) {
                Files.createFile(path, PosixFilePermissions.asFileAttribute(OWNER_READ_WRITE));
            } else {
                Files.createFile(path);
            }
        } else if (posix) {
            Files.setPosixFilePermissions(path, OWNER_READ_WRITE);
        }
    }

    private Charset resolveCharset() {
        String configured = properties.getCharset();
        if (!StringUtils.hasText(configured)) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(configured.trim());
        } catch (Exception ignored) {
            return StandardCharsets.UTF_8;
        }
    }

    private enum Layout {
        LINES,
        LEGACY_ARRAY,
        BROKEN_ARRAY,
        UNREADABLE
    }

    private record DiskSnapshot(List<ChatMessage> messages, Layout layout) {
        private static final DiskSnapshot EMPTY = new DiskSnapshot(List.of(), Layout.LINES);
    }

    static Path resolvePath(HistoryBufferProperties properties, long pid) {
        Path dir = Paths.get(properties.getDir()).toAbsolutePath().normalize();
        String prefix = StringUtils.hasText(properties.getFilePrefix()) ? properties.getFilePrefix().trim() : "history-";
        return dir.resolve(prefix + pid + ".jsonl");
    }
}
