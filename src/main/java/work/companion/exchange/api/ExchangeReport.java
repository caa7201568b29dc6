package work.companion.exchange.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.companion.exchange.reconcile.RecordOutcome;

/**
 * Outcome of an {@link ExchangeService} export or import (usable by the CLI and embedding apps).
 *
 * <p>A record-level failure does not fail the call; it shows up as a {@code FAILED} entry in
 * {@link #outcomes()}. Only unreadable or malformed documents and filesystem errors produce
 * {@link Status#FAILURE}.
 */
public record ExchangeReport(
    Status status,
    String operation,
    List<RecordOutcome> outcomes,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ExchangeReport {
        outcomes = List.copyOf(outcomes);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ExchangeReport success(String operation, List<RecordOutcome> outcomes, Map<String, Object> metadata, Instant startedAt) {
        return new ExchangeReport(Status.SUCCESS, operation, outcomes, metadata, startedAt, Instant.now());
    }

    public static ExchangeReport failure(String operation, String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new ExchangeReport(Status.FAILURE, operation, List.of(), meta, startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public Optional<String> error() {
        return Optional.ofNullable(metadata.get("error")).map(Object::toString);
    }

    public long count(RecordOutcome.Action action) {
        return outcomes.stream().filter(outcome -> outcome.action() == action).count();
    }

    public Map<RecordOutcome.Action, Long> counts() {
        Map<RecordOutcome.Action, Long> counts = new EnumMap<>(RecordOutcome.Action.class);
        for (RecordOutcome.Action action : RecordOutcome.Action.values()) {
            counts.put(action, count(action));
        }
        return counts;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("operation", operation);
        serializable.put("metadata", metadata);
        if (!outcomes.isEmpty()) {
            Map<String, Object> summary = new LinkedHashMap<>();
            counts().forEach((action, count) -> summary.put(action.name().toLowerCase(Locale.ROOT), count));
            serializable.put("summary", summary);
            List<Map<String, Object>> records = new ArrayList<>();
            outcomes.forEach(outcome -> records.add(outcome.toSerializableMap()));
            serializable.put("records", records);
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getOriginalMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
