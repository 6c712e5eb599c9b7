package com.platform.driftcontrol.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only remediation audit log.
 * 
 * Every entry is mirrored to SLF4J and appended as one JSON line to a partition file
 * per UTC calendar day ({@code remediation-yyyy-MM-dd.jsonl}). Statistics are computed
 * over all partitions on disk; unreadable files and malformed lines are skipped.
 * Only the most recent entries are kept in memory for the {@code getLogs} queries.
 */
@Slf4j
public class RemediationAuditLog {
    
    public static final String DURATION_KEY = "duration";
    public static final String FAILURE_PREFIX = "Failed:";
    public static final String ROLLBACK_SUCCEEDED = "Rollback successful";
    
    private static final String AUDIT_PREFIX = "[AUDIT]";
    private static final String PARTITION_PREFIX = "remediation-";
    private static final String PARTITION_SUFFIX = ".jsonl";
    private static final int TOP_FAILURES = 5;
    
    public static final int DEFAULT_MAX_IN_MEMORY_ENTRIES = 10_000;
    
    private final Path directory;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int maxInMemoryEntries;
    private final Deque<AuditEntry> recent = new ArrayDeque<>();
    
    public RemediationAuditLog(Path directory, Clock clock) {
        this(directory, new ObjectMapper().registerModule(new JavaTimeModule()), clock);
    }
    
    public RemediationAuditLog(Path directory, ObjectMapper objectMapper, Clock clock) {
        this(directory, objectMapper, clock, DEFAULT_MAX_IN_MEMORY_ENTRIES);
    }
    
    public RemediationAuditLog(Path directory, ObjectMapper objectMapper, Clock clock, int maxInMemoryEntries) {
        if (maxInMemoryEntries < 1) {
            throw new IllegalArgumentException("maxInMemoryEntries must be at least 1: " + maxInMemoryEntries);
        }
        this.directory = directory;
        this.maxInMemoryEntries = maxInMemoryEntries;
        this.mapper = objectMapper.copy()
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }
    
    public void info(String planId, String actionId, String message) {
        record(AuditLevel.INFO, planId, actionId, message, null);
    }
    
    public void warn(String planId, String actionId, String message) {
        record(AuditLevel.WARN, planId, actionId, message, null);
    }
    
    public void error(String planId, String actionId, String message, Map<String, Object> metadata) {
        record(AuditLevel.ERROR, planId, actionId, message, metadata);
    }
    
    public void success(String planId, String actionId, String message, Map<String, Object> metadata) {
        record(AuditLevel.SUCCESS, planId, actionId, message, metadata);
    }
    
    public AuditEntry record(AuditLevel level, String planId, String actionId, String message, Map<String, Object> metadata) {
        AuditEntry entry = new AuditEntry(clock.instant(), planId, actionId, level, message, metadata);
        log(entry);
        return entry;
    }
    
    /**
     * Append an entry. A failure to persist is logged; it never interrupts remediation.
     */
    public void log(AuditEntry entry) {
        remember(entry);
        mirror(entry);
        
        try {
            String line = mapper.writeValueAsString(entry) + System.lineSeparator();
            synchronized (this) {
                Files.createDirectories(directory);
                Files.writeString(partitionFor(entry), line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            log.error("Failed to persist audit entry for plan {} to {}", entry.planId(), directory, e);
        }
    }
    
    /**
     * Most recent entries written by this process, oldest first.
     */
    public List<AuditEntry> getLogs() {
        synchronized (recent) {
            return List.copyOf(recent);
        }
    }
    
    public List<AuditEntry> getLogsByPlan(String planId) {
        return getLogs().stream()
            .filter(e -> e.planId().equals(planId))
            .toList();
    }
    
    public List<AuditEntry> getLogsByAction(String actionId) {
        return getLogs().stream()
            .filter(e -> e.actionId().equals(actionId))
            .toList();
    }
    
    public RemediationStatistics getStatistics() {
        List<AuditEntry> all = loadAllLogs();
        
        long plans = all.stream()
            .map(AuditEntry::planId)
            .filter(id -> !id.isBlank())
            .distinct()
            .count();
        long actions = all.stream()
            .map(AuditEntry::actionId)
            .filter(id -> !id.isBlank())
            .distinct()
            .count();
        long successes = all.stream().filter(e -> e.level() == AuditLevel.SUCCESS).count();
        long errors = all.stream().filter(e -> e.level() == AuditLevel.ERROR).count();
        long rolledBack = all.stream().filter(e -> ROLLBACK_SUCCEEDED.equals(e.message())).count();
        
        double averageDuration = all.stream()
            .map(AuditEntry::durationMillis)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average()
            .orElse(0.0);
        
        Map<String, Long> failureCounts = all.stream()
            .filter(e -> e.level() == AuditLevel.ERROR)
            .map(AuditEntry::message)
            .filter(m -> m != null && m.startsWith(FAILURE_PREFIX))
            .collect(Collectors.groupingBy(m -> m, LinkedHashMap::new, Collectors.counting()));
        
        List<RemediationStatistics.FailureCount> topFailures = failureCounts.entrySet().stream()
            .map(e -> new RemediationStatistics.FailureCount(e.getKey(), e.getValue()))
            .sorted(Comparator.comparingLong(RemediationStatistics.FailureCount::count).reversed())
            .limit(TOP_FAILURES)
            .toList();
        
        return new RemediationStatistics(plans, actions, successes, errors, rolledBack, averageDuration, topFailures);
    }
    
    /**
     * Write every persisted entry to one JSON array file.
     */
    public void exportLogs(Path target) throws IOException {
        List<AuditEntry> all = loadAllLogs();
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), all);
    }
    
    /**
     * Drop in-memory entries and delete all partitions.
     */
    public synchronized void clearLogs() throws IOException {
        synchronized (recent) {
            recent.clear();
        }
        for (Path partition : listPartitions()) {
            Files.deleteIfExists(partition);
        }
    }
    
    List<AuditEntry> loadAllLogs() {
        List<AuditEntry> all = new ArrayList<>();
        for (Path partition : listPartitions()) {
            List<String> lines;
            try {
                lines = Files.readAllLines(partition, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Skipping unreadable audit partition {}: {}", partition, e.getMessage());
                continue;
            }
            int lineNumber = 0;
            for (String line : lines) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    AuditEntry entry = mapper.readValue(line, AuditEntry.class);
                    if (entry == null) {
                        log.warn("Skipping empty audit entry {}:{}", partition.getFileName(), lineNumber);
                        continue;
                    }
                    all.add(entry);
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed audit entry {}:{}", partition.getFileName(), lineNumber);
                }
            }
        }
        return all;
    }
    
    private List<Path> listPartitions() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> {
                    String name = p.getFileName().toString();
                    return name.startsWith(PARTITION_PREFIX) && name.endsWith(PARTITION_SUFFIX);
                })
                .sorted()
                .toList();
        } catch (IOException e) {
            log.warn("Could not list audit directory {}: {}", directory, e.getMessage());
            return List.of();
        }
    }
    
    private void remember(AuditEntry entry) {
        synchronized (recent) {
            recent.addLast(entry);
            while (recent.size() > maxInMemoryEntries) {
                recent.removeFirst();
            }
        }
    }
    
    private Path partitionFor(AuditEntry entry) {
        LocalDate day = LocalDate.ofInstant(entry.timestamp(), ZoneOffset.UTC);
        return directory.resolve(PARTITION_PREFIX + day + PARTITION_SUFFIX);
    }
    
    private void mirror(AuditEntry entry) {
        MDC.put("auditLevel", entry.level().wireName());
        if (!entry.planId().isEmpty()) MDC.put("auditPlanId", entry.planId());
        if (!entry.actionId().isEmpty()) MDC.put("auditActionId", entry.actionId());
        
        try {
            String logMessage = String.format("%s %s plan=%s action=%s %s",
                AUDIT_PREFIX,
                entry.level().wireName().toUpperCase(),
                shortId(entry.planId()),
                shortId(entry.actionId()),
                entry.message());
            
            switch (entry.level()) {
                case ERROR -> log.error(logMessage);
                case WARN -> log.warn(logMessage);
                default -> log.info(logMessage);
            }
        } finally {
            MDC.remove("auditLevel");
            MDC.remove("auditPlanId");
            MDC.remove("auditActionId");
        }
    }
    
    private static String shortId(String id) {
        if (id.isEmpty()) {
            return "-";
        }
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
