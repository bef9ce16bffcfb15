package com.interview.assistant.storage.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.interview.assistant.chat.entity.ChatMessage;
import com.interview.assistant.common.error.IntegrityException;
import com.interview.assistant.common.error.StorageUnavailableException;
import com.interview.assistant.config.StorageProps;
import com.interview.assistant.login.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * CSV 파일 기반 {@link RecordStore}.
 *
 * <p>쓰기는 "전체 읽기 → 다음 id 계산 → 한 행 append" 순서이고, 이 과정 전체를
 * 인스턴스가 소유한 단일 락으로 감싼다. 읽기/쓰기 구분 없이 모든 연산이 직렬화된다.
 */
@Slf4j
@Service
public class CsvRecordStore implements RecordStore {

    static final List<String> USER_COLUMNS = List.of("id", "username", "password_hash", "created_at");
    static final List<String> CHAT_COLUMNS = List.of("id", "user_id", "role", "content", "created_at");

    // 정렬 가능 + 왕복 가능한 형식 (예: 2025-03-01T10:15:30.123456+00:00)
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSxxx");

    private static final CsvSchema USER_SCHEMA = schemaOf(USER_COLUMNS);
    private static final CsvSchema CHAT_SCHEMA = schemaOf(CHAT_COLUMNS);
    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    private final ReentrantLock lock = new ReentrantLock();
    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private final Path dataDir;
    private final Path usersCsv;
    private final Path chatsCsv;
    private final Clock clock;

    public CsvRecordStore(StorageProps props, Clock clock) {
        this.dataDir = Path.of(props.getDataDir().trim());
        this.usersCsv = dataDir.resolve(props.getUsersFile());
        this.chatsCsv = dataDir.resolve(props.getChatsFile());
        this.clock = clock;
    }

    // ============================ 초기화 ======================================

    @Override
    public void initialize() {
        withLock(() -> {
            ensureTable(usersCsv, USER_COLUMNS);
            ensureTable(chatsCsv, CHAT_COLUMNS);
            return null;
        });
        log.info("record store ready: users={}, chats={}", usersCsv.toAbsolutePath(), chatsCsv.toAbsolutePath());
    }

    // ============================ 사용자 ======================================

    @Override
    public Optional<User> findUserByUsername(String username) {
        return withLock(() -> findUser(username));
    }

    @Override
    public User createUser(String username, String passwordHash) {
        return withLock(() -> insertUser(username, passwordHash));
    }

    @Override
    public Optional<User> createUserIfAbsent(String username, String passwordHash) {
        return withLock(() -> {
            if (findUser(username).isPresent()) {
                return Optional.<User>empty();
            }
            return Optional.of(insertUser(username, passwordHash));
        });
    }

    // ============================ 채팅 기록 ======================================

    @Override
    public ChatMessage appendChatMessage(long userId, String role, String content) {
        return withLock(() -> {
            long nextId = readChats().stream().mapToLong(ChatMessage::getId).max().orElse(0L) + 1;
            ChatMessage message = ChatMessage.builder()
                    .id(nextId)
                    .userId(userId)
                    .role(role)
                    .content(content)
                    .createdAt(now())
                    .build();

            Map<String, String> row = new LinkedHashMap<>();
            row.put("id", String.valueOf(message.getId()));
            row.put("user_id", String.valueOf(message.getUserId()));
            row.put("role", message.getRole());
            row.put("content", message.getContent());
            row.put("created_at", TIMESTAMP_FORMAT.format(message.getCreatedAt()));
            appendRow(chatsCsv, CHAT_COLUMNS, CHAT_SCHEMA, row);

            log.debug("chat appended: id={}, userId={}, role={}", nextId, userId, role);
            return message;
        });
    }

    @Override
    public List<ChatMessage> listChatHistory(long userId, int limit) {
        return withLock(() -> readChats().stream()
                .filter(m -> m.getUserId() == userId)
                .sorted(Comparator.comparing(ChatMessage::getCreatedAt, OffsetDateTime.timeLineOrder())
                        .thenComparingLong(ChatMessage::getId))
                .limit(Math.max(limit, 0))
                .toList());
    }

    // 테이블 전체 스냅샷 (같은 패키지의 테스트에서 행 수/내용 확인용)

    List<User> readAllUsers() {
        return withLock(this::readUsers);
    }

    List<ChatMessage> readAllChatMessages() {
        return withLock(this::readChats);
    }

    // ============================ 내부 (락 보유 상태에서만 호출) ======================================

    private Optional<User> findUser(String username) {
        for (User user : readUsers()) {
            if (user.getUsername().equals(username)) {
                return Optional.of(user);
            }
        }
        return Optional.empty();
    }

    private User insertUser(String username, String passwordHash) {
        long nextId = readUsers().stream().mapToLong(User::getId).max().orElse(0L) + 1;
        User user = User.builder()
                .id(nextId)
                .username(username)
                .passwordHash(passwordHash)
                .createdAt(now())
                .build();

        Map<String, String> row = new LinkedHashMap<>();
        row.put("id", String.valueOf(user.getId()));
        row.put("username", user.getUsername());
        row.put("password_hash", user.getPasswordHash());
        row.put("created_at", TIMESTAMP_FORMAT.format(user.getCreatedAt()));
        appendRow(usersCsv, USER_COLUMNS, USER_SCHEMA, row);

        log.debug("user appended: id={}, username={}", nextId, username);
        return user;
    }

    private List<User> readUsers() {
        List<User> users = new ArrayList<>();
        for (Map<String, String> row : readRows(usersCsv)) {
            users.add(User.builder()
                    .id(parseId(row, "id", usersCsv))
                    .username(required(row, "username", usersCsv))
                    .passwordHash(required(row, "password_hash", usersCsv))
                    .createdAt(parseTimestamp(row, usersCsv))
                    .build());
        }
        return users;
    }

    private List<ChatMessage> readChats() {
        List<ChatMessage> chats = new ArrayList<>();
        for (Map<String, String> row : readRows(chatsCsv)) {
            chats.add(ChatMessage.builder()
                    .id(parseId(row, "id", chatsCsv))
                    .userId(parseId(row, "user_id", chatsCsv))
                    .role(required(row, "role", chatsCsv))
                    .content(required(row, "content", chatsCsv))
                    .createdAt(parseTimestamp(row, chatsCsv))
                    .build());
        }
        return chats;
    }

    private List<Map<String, String>> readRows(Path file) {
        if (!Files.exists(file)) {
            return List.of();
        }
        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerForMapOf(String.class)
                .with(HEADER_SCHEMA)
                .readValues(file.toFile())) {
            return it.readAll();
        } catch (JsonProcessingException | RuntimeJsonMappingException e) {
            log.error("malformed table: {}", file, e);
            throw new IntegrityException("Malformed table " + file.getFileName() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read " + file, e);
        }
    }

    private void appendRow(Path file, List<String> columns, CsvSchema schema, Map<String, String> row) {
        String line;
        try {
            line = csvMapper.writer(schema).writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new IntegrityException("Failed to encode row for " + file.getFileName(), e);
        }
        try {
            ensureTable(file, columns);
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to append to " + file, e);
        }
    }

    private void ensureTable(Path file, List<String> columns) {
        try {
            Files.createDirectories(dataDir);
            if (!Files.exists(file)) {
                Files.writeString(file, String.join(",", columns) + "\n", StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW);
                log.info("created empty table: {}", file);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to prepare " + file, e);
        }
    }

    private OffsetDateTime now() {
        // 파일에는 마이크로초까지만 남으므로 반환 객체도 같은 정밀도로 맞춘다
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static long parseId(Map<String, String> row, String column, Path file) {
        String raw = required(row, column, file);
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IntegrityException("Non-integer " + column + " '" + raw + "' in " + file.getFileName(), e);
        }
    }

    private static OffsetDateTime parseTimestamp(Map<String, String> row, Path file) {
        String raw = required(row, "created_at", file);
        try {
            return OffsetDateTime.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IntegrityException("Unparseable created_at '" + raw + "' in " + file.getFileName(), e);
        }
    }

    private static String required(Map<String, String> row, String column, Path file) {
        String value = row.get(column);
        if (value == null) {
            throw new IntegrityException("Missing column " + column + " in " + file.getFileName());
        }
        return value;
    }

    private static CsvSchema schemaOf(List<String> columns) {
        CsvSchema.Builder builder = CsvSchema.builder();
        columns.forEach(builder::addColumn);
        return builder.build();
    }
}
