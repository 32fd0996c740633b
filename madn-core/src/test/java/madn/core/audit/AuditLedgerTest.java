package madn.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AuditLedgerTest {
    private static final Instant START = Instant.parse("2026-03-14T09:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void shouldChainEntriesFromNullHead() {
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, new MutableClock(START));

        AuditEntry first = ledger.appendDiagnosis("CASE-1", "a".repeat(32), Map.of("diagnosis", "Asthma"));
        AuditEntry second = ledger.appendDiagnosis("CASE-2", "b".repeat(32), Map.of("diagnosis", "COPD"));

        assertNull(first.previousHash());
        assertEquals(first.entryHash(), second.previousHash());
        assertEquals(16, first.entryHash().length());
        assertTrue(first.auditId().startsWith("AUDIT-"));
        assertEquals(second.entryHash(), ledger.head());
        assertEquals(dir.resolve("audit_20260314.jsonl"), ledger.currentSegment());

        ChainVerification verification = ledger.verify();
        assertTrue(verification.valid());
        assertEquals(2, verification.entries());
        assertNull(verification.brokenAtEntry());
    }

    @Test
    void shouldReportTamperedEntryIndex() throws Exception {
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, new MutableClock(START));
        ledger.appendDiagnosis("CASE-1", null, Map.of("diagnosis", "Asthma"));
        ledger.appendDiagnosis("CASE-2", null, Map.of("diagnosis", "COPD"));
        ledger.appendDiagnosis("CASE-3", null, Map.of("diagnosis", "Pneumonia"));

        Path segment = ledger.currentSegment();
        List<String> lines = new ArrayList<>(Files.readAllLines(segment, StandardCharsets.UTF_8));
        ObjectNode tampered = (ObjectNode) objectMapper.readTree(lines.get(2));
        ((ObjectNode) tampered.get("payload")).put("diagnosis", "Pneumonib");
        lines.set(2, objectMapper.writeValueAsString(tampered));
        Files.write(segment, lines, StandardCharsets.UTF_8);

        ChainVerification verification = ledger.verify();

        assertFalse(verification.valid());
        assertEquals(2, verification.brokenAtEntry());
    }

    @Test
    void shouldDetectByteEditThatParsesToSameValue() throws Exception {
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, new MutableClock(START));
        ledger.appendDiagnosis("CASE-1", null, Map.of("diagnosis", "Asthma"));
        ledger.appendDiagnosis("CASE-2", null, Map.of("probability", 1.0E-4));
        ledger.appendDiagnosis("CASE-3", null, Map.of("diagnosis", "Pneumonia"));
        assertTrue(ledger.verify().valid());

        Path segment = ledger.currentSegment();
        List<String> lines = new ArrayList<>(Files.readAllLines(segment, StandardCharsets.UTF_8));
        assertTrue(lines.get(1).contains("1.0E-4"));
        lines.set(1, lines.get(1).replace("1.0E-4", "1.0e-4"));
        Files.write(segment, lines, StandardCharsets.UTF_8);

        ChainVerification verification = ledger.verify();

        assertFalse(verification.valid());
        assertEquals(1, verification.brokenAtEntry());
    }

    @Test
    void shouldDetectWhitespaceInsertedIntoEntry() throws Exception {
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, new MutableClock(START));
        ledger.appendDiagnosis("CASE-1", null, Map.of("diagnosis", "Asthma"));
        ledger.appendDiagnosis("CASE-2", null, Map.of("diagnosis", "COPD"));

        Path segment = ledger.currentSegment();
        List<String> lines = new ArrayList<>(Files.readAllLines(segment, StandardCharsets.UTF_8));
        lines.set(0, lines.get(0).replaceFirst(":", ": "));
        Files.write(segment, lines, StandardCharsets.UTF_8);

        ChainVerification verification = ledger.verify();

        assertFalse(verification.valid());
        assertEquals(0, verification.brokenAtEntry());
    }

    @Test
    void shouldDetectRemovedEntry() throws Exception {
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, new MutableClock(START));
        for (int i = 0; i < 3; i++) {
            ledger.appendDiagnosis("CASE-" + i, null, Map.of("n", i));
        }
        Path segment = ledger.currentSegment();
        List<String> lines = new ArrayList<>(Files.readAllLines(segment, StandardCharsets.UTF_8));
        lines.remove(1);
        Files.write(segment, lines, StandardCharsets.UTF_8);

        ChainVerification verification = ledger.verify();

        assertFalse(verification.valid());
        assertEquals(1, verification.brokenAtEntry());
    }

    @Test
    void shouldContinueChainAfterReopen() {
        MutableClock clock = new MutableClock(START);
        AuditLedger first = new AuditLedger(objectMapper, dir, 16, clock);
        AuditEntry last = first.appendDiagnosis("CASE-1", null, Map.of("diagnosis", "Asthma"));

        AuditLedger reopened = new AuditLedger(objectMapper, dir, 16, clock);
        AuditEntry next = reopened.appendError("CASE-1", "REPORT_PARSE_FAILED", "bad json", Map.of("analyzer", "x"));

        assertEquals(last.entryHash(), next.previousHash());
        assertEquals(AuditEventType.ERROR, next.eventType());
        assertEquals("bad json", next.payload().path("error_message").asText());
        assertTrue(reopened.verify().valid());
    }

    @Test
    void shouldStartNewSegmentEachDay() {
        MutableClock clock = new MutableClock(START);
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, clock);
        ledger.appendDiagnosis("CASE-1", null, Map.of());
        clock.advance(Duration.ofDays(1));

        AuditEntry nextDay = ledger.appendDiagnosis("CASE-2", null, Map.of());

        assertNull(nextDay.previousHash());
        assertTrue(Files.exists(dir.resolve("audit_20260315.jsonl")));
        List<ChainVerification> all = ledger.verifyAll();
        assertEquals(2, all.size());
        assertTrue(all.stream().allMatch(ChainVerification::valid));
    }

    @Test
    void shouldKeepTimestampsMonotonicWhenClockStepsBack() {
        MutableClock clock = new MutableClock(START);
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, clock);
        AuditEntry first = ledger.appendDiagnosis("CASE-1", null, Map.of());
        clock.set(START.minusSeconds(30));

        AuditEntry second = ledger.appendDiagnosis("CASE-2", null, Map.of());

        assertFalse(Instant.parse(second.timestamp()).isBefore(Instant.parse(first.timestamp())));
        assertEquals(first.entryHash(), second.previousHash());
    }

    @Test
    void shouldNotForkChainUnderConcurrentAppends() throws Exception {
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, new MutableClock(START));
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    ledger.appendDiagnosis("CASE-" + thread + "-" + i, null, Map.of("i", i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        ChainVerification verification = ledger.verify();
        assertTrue(verification.valid(), verification.message());
        assertEquals(threads * perThread, verification.entries());
    }

    @Test
    void shouldFindEntriesByCaseAndExportRange() {
        MutableClock clock = new MutableClock(START);
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, clock);
        ledger.appendDiagnosis("CASE-A", null, Map.of("diagnosis", "Asthma"));
        clock.advance(Duration.ofHours(1));
        ledger.appendDiagnosis("CASE-B", null, Map.of("diagnosis", "COPD"));
        clock.advance(Duration.ofHours(1));
        ledger.appendError("CASE-A", "STAGE_FAILED", "timeout", Map.of("stage", "explanation"));

        List<AuditEntry> trail = ledger.entriesForCase("CASE-A");
        assertEquals(2, trail.size());
        assertEquals(AuditEventType.DIAGNOSIS, trail.get(0).eventType());
        assertEquals(AuditEventType.ERROR, trail.get(1).eventType());

        ComplianceExport export = ledger.export(START.plus(Duration.ofMinutes(30)), null);
        assertEquals(2, export.entriesCount());
        assertEquals("CASE-B", export.entries().get(0).caseId());
    }

    @Test
    void shouldWriteExportFileWithoutTouchingChain() throws Exception {
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, new MutableClock(START));
        ledger.appendDiagnosis("CASE-A", null, Map.of("diagnosis", "Asthma"));

        Path exported = ledger.exportToFile(null, null);

        assertTrue(Files.exists(exported));
        assertEquals(1, objectMapper.readTree(exported.toFile()).path("entriesCount").asInt());
        assertEquals(1, ledger.verifyAll().size());
        assertTrue(ledger.verify().valid());
    }

    @Test
    void shouldRejectHashLengthOutsideBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new AuditLedger(objectMapper, dir, 8, new MutableClock(START)));
        AuditLedger full = new AuditLedger(objectMapper, dir, 64, new MutableClock(START));
        assertEquals(64, full.appendDiagnosis("CASE-1", null, Map.of()).entryHash().length());
    }

    @Test
    void shouldFailAppendWhenSegmentIsNotWritable() throws Exception {
        AuditLedger ledger = new AuditLedger(objectMapper, dir, 16, new MutableClock(START));
        Files.createDirectories(ledger.currentSegment());

        assertThrows(AuditLedgerException.class, () -> ledger.appendDiagnosis("CASE-1", null, Map.of()));
        assertNull(ledger.head());
    }
}
