package com.healthauth.core.audit;

import com.healthauth.core.domain.LedgerErrorKind;
import com.healthauth.core.event.LedgerEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hash-chained, append-only log of authority operation outcomes.
 * <p>
 * Accepted transitions arrive as ledger events; rejections are appended by the caller that
 * observed them. Each entry hashes its predecessor, so editing or reordering entries breaks
 * {@link #verifyIntegrity()}. The log only observes: it never changes an operation's result.
 */
public class AuthorityAuditLog {

    private static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    private final List<AuditEntry> entries;
    private final String authorityId;
    private final Clock clock;
    private volatile String lastHash;

    public AuthorityAuditLog(String authorityId, Clock clock) {
        this.authorityId = Objects.requireNonNull(authorityId, "Authority ID cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.entries = new CopyOnWriteArrayList<>();
        this.lastHash = GENESIS_HASH;
    }

    public synchronized AuditEntry append(AuditEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");

        String previousHash = lastHash;
        long sequenceNumber = entries.size();
        Instant timestamp = clock.instant();

        String entryHash = computeEntryHash(sequenceNumber, previousHash, event, timestamp);

        AuditEntry entry = new AuditEntry(
                sequenceNumber,
                event,
                timestamp,
                previousHash,
                entryHash,
                authorityId
        );

        entries.add(entry);
        lastHash = entryHash;

        return entry;
    }

    /**
     * Records an accepted transition. Suitable as a ledger event handler.
     */
    public AuditEntry logAccepted(LedgerEvent event) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("actor", String.valueOf(event.actor()));
        details.put("subject", String.valueOf(event.subject()));
        if (event.role() != null) {
            details.put("role", event.role().name());
        }
        if (event.recordId() != null) {
            details.put("recordId", String.valueOf(event.recordId()));
        }
        return append(new AuditEvent(
                Outcome.ACCEPTED,
                event.eventType().name(),
                details
        ));
    }

    /**
     * Records a rejected operation.
     *
     * @param operation name of the rejected operation
     * @param caller    identity that attempted it
     * @param error     rejection kind
     * @param message   rejection message
     */
    public AuditEntry logRejected(String operation, String caller, LedgerErrorKind error, String message) {
        Objects.requireNonNull(error, "Error kind cannot be null");
        return append(new AuditEvent(
                Outcome.REJECTED,
                operation,
                Map.of(
                        "caller", String.valueOf(caller),
                        "error", error.name(),
                        "message", message != null ? message : ""
                )
        ));
    }

    public List<AuditEntry> getEntries() {
        return new ArrayList<>(entries);
    }

    public List<AuditEntry> getEntries(Outcome outcome) {
        return entries.stream()
                .filter(e -> e.event().outcome() == outcome)
                .toList();
    }

    public List<AuditEntry> getLatestEntries(int count) {
        int size = entries.size();
        int start = Math.max(0, size - count);
        return new ArrayList<>(entries.subList(start, size));
    }

    /**
     * Recomputes the hash chain and reports every mismatch found.
     */
    public VerificationResult verifyIntegrity() {
        return verify(new ArrayList<>(entries));
    }

    static VerificationResult verify(List<AuditEntry> chain) {
        List<String> errors = new ArrayList<>();
        String expectedPrevHash = GENESIS_HASH;

        for (int i = 0; i < chain.size(); i++) {
            AuditEntry entry = chain.get(i);

            if (entry.sequenceNumber() != i) {
                errors.add("Sequence number mismatch at index " + i);
            }
            if (!entry.previousHash().equals(expectedPrevHash)) {
                errors.add("Previous hash mismatch at index " + i);
            }

            String computedHash = computeEntryHash(
                    entry.sequenceNumber(),
                    entry.previousHash(),
                    entry.event(),
                    entry.timestamp()
            );
            if (!entry.entryHash().equals(computedHash)) {
                errors.add("Entry hash mismatch at index " + i + " - possible tampering");
            }

            expectedPrevHash = entry.entryHash();
        }

        return new VerificationResult(errors.isEmpty(), errors, chain.size());
    }

    public int size() {
        return entries.size();
    }

    public String getLastHash() {
        return lastHash;
    }

    private static String computeEntryHash(long sequenceNumber, String previousHash,
                                           AuditEvent event, Instant timestamp) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String data = sequenceNumber + "|" + previousHash + "|" +
                    event.outcome() + "|" + event.operation() + "|" +
                    new TreeMap<>(event.details()) + "|" + timestamp.toEpochMilli();
            byte[] hash = digest.digest(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ==================== Inner Types ====================

    public enum Outcome {
        ACCEPTED,
        REJECTED
    }

    public record AuditEvent(
            Outcome outcome,
            String operation,
            Map<String, String> details
    ) {
        public AuditEvent {
            Objects.requireNonNull(outcome, "Outcome cannot be null");
            Objects.requireNonNull(operation, "Operation cannot be null");
            details = details != null ? Map.copyOf(details) : Map.of();
        }
    }

    public record AuditEntry(
            long sequenceNumber,
            AuditEvent event,
            Instant timestamp,
            String previousHash,
            String entryHash,
            String authorityId
    ) {
        public AuditEntry {
            Objects.requireNonNull(event, "Event cannot be null");
            Objects.requireNonNull(timestamp, "Timestamp cannot be null");
            Objects.requireNonNull(previousHash, "Previous hash cannot be null");
            Objects.requireNonNull(entryHash, "Entry hash cannot be null");
            Objects.requireNonNull(authorityId, "Authority ID cannot be null");
        }
    }

    public record VerificationResult(
            boolean valid,
            List<String> errors,
            int entriesVerified
    ) {
        public VerificationResult {
            errors = errors != null ? List.copyOf(errors) : List.of();
        }
    }
}
