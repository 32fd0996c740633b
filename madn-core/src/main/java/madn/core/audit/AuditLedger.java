package madn.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Component
public class AuditLedger {
    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    public static final String ENTRY_HASH = "entry_hash";
    static final String PREVIOUS_HASH = "previous_hash";
    static final String SEGMENT_GLOB = "audit_*.jsonl";
    static final int INPUT_HASH_LENGTH = 32;
    private static final DateTimeFormatter SEGMENT_DATE =
            DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter EXPORT_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final Path logDir;
    private final EntryHasher hasher;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Path headSegment;
    private String headHash;
    private Instant lastTimestamp;

    @Autowired
    public AuditLedger(
            ObjectMapper objectMapper,
            @Value("${madn.audit.log-dir:audit_logs}") String logDir,
            @Value("${madn.audit.hash-length:16}") int hashLength
    ) {
        this(objectMapper, Paths.get(logDir), hashLength, Clock.systemUTC());
    }

    public AuditLedger(ObjectMapper objectMapper, Path logDir, int hashLength, Clock clock) {
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
        this.logDir = logDir;
        this.hasher = new EntryHasher(this.objectMapper, hashLength);
        this.clock = clock;
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            throw new AuditLedgerException("cannot create audit directory " + logDir, e);
        }
        this.headSegment = segmentFor(clock.instant());
        recoverHead(headSegment);
        log.info("event=audit_ledger_opened dir={} segment={} head={}", logDir, headSegment.getFileName(), headHash);
    }

    public Path logDir() {
        return logDir;
    }

    public Path currentSegment() {
        return segmentFor(clock.instant());
    }

    public String head() {
        lock.readLock().lock();
        try {
            return headHash;
        } finally {
            lock.readLock().unlock();
        }
    }

    // payload must carry inputHash only, never raw inputs
    public AuditEntry appendDiagnosis(String caseId, String inputHash, Object payload) {
        return append("AUDIT-", AuditEventType.DIAGNOSIS, caseId, inputHash, objectMapper.valueToTree(payload));
    }

    public AuditEntry appendError(String caseId, String errorType, String message, Map<String, ?> context) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("error_type", errorType);
        payload.put("error_message", message);
        payload.set("context", objectMapper.valueToTree(context == null ? Map.of() : context));
        return append("ERROR-", AuditEventType.ERROR, caseId, null, payload);
    }

    private AuditEntry append(
            String idPrefix,
            AuditEventType type,
            String caseId,
            String inputHash,
            JsonNode payload
    ) {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            if (lastTimestamp != null && now.isBefore(lastTimestamp)) {
                now = lastTimestamp;
            }
            Path segment = segmentFor(now);
            if (!segment.equals(headSegment)) {
                recoverHead(segment);
                headSegment = segment;
            }

            ObjectNode node = objectMapper.createObjectNode();
            node.put("audit_id", idPrefix + UUID.randomUUID().toString().replace("-", "")
                    .substring(0, 12).toUpperCase(Locale.ROOT));
            node.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(now));
            node.put("event_type", type.wireName());
            node.put("case_id", caseId);
            node.put("input_hash", inputHash);
            node.set("payload", payload);
            node.put(PREVIOUS_HASH, headHash);
            String entryHash = hasher.hash(node);
            node.put(ENTRY_HASH, entryHash);

            persistJsonLine(segment, serialize(node));

            headHash = entryHash;
            lastTimestamp = now;
            log.debug("event=audit_appended audit_id={} case_id={} type={} hash={}",
                    node.get("audit_id").asText(), caseId, type.wireName(), entryHash);
            return toEntry(node);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void persistJsonLine(Path segment, String line) {
        try (FileChannel channel = FileChannel.open(
                segment,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND);
             FileLock ignored = channel.lock()) {
            channel.write(ByteBuffer.wrap((line + "\n").getBytes(StandardCharsets.UTF_8)));
            channel.force(true);
        } catch (IOException e) {
            throw new AuditLedgerException("failed to append to " + segment, e);
        }
    }

    public ChainVerification verify() {
        return verify(currentSegment());
    }

    /**
     * Walks a segment from its first line. Each line must link to the previous
     * entry hash, hash to its own {@code entry_hash}, and be byte-identical to
     * the serialization it was written as. {@code brokenAtEntry} is zero-based.
     */
    public ChainVerification verify(Path segment) {
        String name = segment.getFileName().toString();
        List<String> lines;
        lock.readLock().lock();
        try {
            if (!Files.exists(segment)) {
                return new ChainVerification(name, true, 0, null, "No audit log for this period");
            }
            lines = Files.readAllLines(segment, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AuditLedgerException("failed to read " + segment, e);
        } finally {
            lock.readLock().unlock();
        }

        String previous = null;
        for (int i = 0; i < lines.size(); i++) {
            ObjectNode node = readNode(lines.get(i));
            if (node == null) {
                return broken(name, lines.size(), i, "Entry is not a JSON object");
            }
            String recordedPrevious = textOrNull(node.get(PREVIOUS_HASH));
            if (!Objects.equals(previous, recordedPrevious)) {
                return broken(name, lines.size(), i, "Chain broken: previous_hash does not match prior entry");
            }
            String recorded = textOrNull(node.get(ENTRY_HASH));
            if (recorded == null || !recorded.equals(hasher.hash(node))) {
                return broken(name, lines.size(), i, "Entry hash mismatch: content was modified");
            }
            if (!lines.get(i).equals(serialize(node))) {
                return broken(name, lines.size(), i, "Entry bytes differ from their canonical form: line was modified");
            }
            previous = recorded;
        }
        return new ChainVerification(name, true, lines.size(), null, "All entries verified");
    }

    public List<ChainVerification> verifyAll() {
        List<ChainVerification> results = new ArrayList<>();
        for (Path segment : segments()) {
            results.add(verify(segment));
        }
        return results;
    }

    public List<AuditEntry> entriesForCase(String caseId) {
        return readAll().stream()
                .filter(entry -> caseId.equals(entry.caseId()))
                .toList();
    }

    public ComplianceExport export(Instant from, Instant to) {
        List<AuditEntry> entries = readAll().stream()
                .filter(entry -> within(entry.timestamp(), from, to))
                .toList();
        return new ComplianceExport(
                DateTimeFormatter.ISO_INSTANT.format(clock.instant()),
                from == null ? null : from.toString(),
                to == null ? null : to.toString(),
                entries.size(),
                entries
        );
    }

    public Path exportToFile(Instant from, Instant to) {
        ComplianceExport export = export(from, to);
        Path target = logDir.resolve("compliance_export_" + EXPORT_STAMP.format(clock.instant()) + ".json");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), export);
        } catch (IOException e) {
            throw new AuditLedgerException("failed to write export " + target, e);
        }
        log.info("event=audit_exported file={} entries={}", target.getFileName(), export.entriesCount());
        return target;
    }

    public static String inputHash(String canonicalInput) {
        return Digests.sha256Hex(canonicalInput, INPUT_HASH_LENGTH);
    }

    List<Path> segments() {
        List<Path> segments = new ArrayList<>();
        lock.readLock().lock();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logDir, SEGMENT_GLOB)) {
            stream.forEach(segments::add);
        } catch (IOException e) {
            throw new AuditLedgerException("failed to list " + logDir, e);
        } finally {
            lock.readLock().unlock();
        }
        segments.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return segments;
    }

    private List<AuditEntry> readAll() {
        List<AuditEntry> entries = new ArrayList<>();
        for (Path segment : segments()) {
            List<String> lines;
            lock.readLock().lock();
            try {
                lines = Files.readAllLines(segment, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new AuditLedgerException("failed to read " + segment, e);
            } finally {
                lock.readLock().unlock();
            }
            for (String line : lines) {
                ObjectNode node = readNode(line);
                if (node == null) {
                    log.warn("event=audit_line_skipped segment={} reason=unparseable", segment.getFileName());
                    continue;
                }
                entries.add(toEntry(node));
            }
        }
        entries.sort(Comparator.comparing(entry -> Objects.requireNonNullElse(parseInstant(entry.timestamp()), Instant.EPOCH)));
        return entries;
    }

    private void recoverHead(Path segment) {
        headHash = null;
        if (!Files.exists(segment)) {
            return;
        }
        try {
            List<String> lines = Files.readAllLines(segment, StandardCharsets.UTF_8);
            for (int i = lines.size() - 1; i >= 0; i--) {
                if (lines.get(i).isBlank()) {
                    continue;
                }
                ObjectNode last = readNode(lines.get(i));
                if (last == null) {
                    log.warn("event=audit_head_unreadable segment={} line={}", segment.getFileName(), i);
                    return;
                }
                headHash = textOrNull(last.get(ENTRY_HASH));
                Instant recorded = parseInstant(textOrNull(last.get("timestamp")));
                if (recorded != null && (lastTimestamp == null || recorded.isAfter(lastTimestamp))) {
                    lastTimestamp = recorded;
                }
                return;
            }
        } catch (IOException e) {
            throw new AuditLedgerException("failed to recover chain head from " + segment, e);
        }
    }

    private String serialize(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AuditLedgerException("audit entry not serializable", e);
        }
    }

    private ObjectNode readNode(String line) {
        try {
            JsonNode node = objectMapper.readTree(line);
            return node instanceof ObjectNode objectNode ? objectNode : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static AuditEntry toEntry(ObjectNode node) {
        AuditEventType type;
        try {
            type = AuditEventType.fromWireName(node.path("event_type").asText(""));
        } catch (IllegalArgumentException e) {
            type = AuditEventType.ERROR;
        }
        return new AuditEntry(
                textOrNull(node.get("audit_id")),
                textOrNull(node.get("timestamp")),
                type,
                textOrNull(node.get("case_id")),
                textOrNull(node.get("input_hash")),
                node.path("payload"),
                textOrNull(node.get(PREVIOUS_HASH)),
                textOrNull(node.get(ENTRY_HASH))
        );
    }

    private static boolean within(String timestamp, Instant from, Instant to) {
        Instant at = parseInstant(timestamp);
        if (at == null) {
            return false;
        }
        return (from == null || !at.isBefore(from)) && (to == null || !at.isAfter(to));
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private Path segmentFor(Instant instant) {
        return logDir.resolve("audit_" + SEGMENT_DATE.format(instant) + ".jsonl");
    }

    private static ChainVerification broken(String segment, int entries, int index, String message) {
        log.warn("event=audit_chain_broken segment={} entry={} message={}", segment, index, message);
        return new ChainVerification(segment, false, entries, index, message);
    }
}
