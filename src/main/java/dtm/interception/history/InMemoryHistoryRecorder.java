package dtm.interception.history;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link HistoryRecorder} em memória, seguro para uso concorrente.
 * O instante de cada registro vem do {@link Clock} informado.
 */
@Slf4j
public class InMemoryHistoryRecorder implements HistoryRecorder {

    private static final Comparator<Entry> NEWEST_FIRST = Comparator
            .comparing((Entry entry) -> entry.record().timestamp())
            .thenComparingLong(Entry::sequence)
            .reversed();

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, Map<UUID, List<Entry>>> recordsByType = new ConcurrentHashMap<>();

    public InMemoryHistoryRecorder() {
        this(Clock.systemUTC());
    }

    public InMemoryHistoryRecorder(@NonNull Clock clock) {
        this.clock = clock;
    }

    @Override
    public <T extends BaseEntity> HistoryRecord<T> add(@NonNull T entity, @NonNull HistoryAction action, @NonNull String actor) {
        UUID entityId = entity.getId();
        if (entityId == null) {
            throw new IllegalArgumentException("Entidade sem id: " + entity.getClass().getName());
        }

        String entityType = entity.getClass().getName();
        HistoryRecord<T> record = new HistoryRecord<>(
                UUID.randomUUID(),
                entityId,
                entityType,
                action,
                clock.instant(),
                entity,
                actor
        );

        List<Entry> entries = recordsByType
                .computeIfAbsent(entityType, key -> new ConcurrentHashMap<>())
                .computeIfAbsent(entityId, key -> new ArrayList<>());

        synchronized (entries) {
            entries.add(new Entry(record, sequence.incrementAndGet()));
        }

        log.debug("Histórico {} registrado para {}#{} por {}", action, entityType, entityId, actor);
        return record;
    }

    @Override
    public <T extends BaseEntity> List<HistoryRecord<T>> getAll(@NonNull Class<T> type, @NonNull UUID entityId) {
        return toRecords(entriesOf(type, entityId));
    }

    @Override
    public <T extends BaseEntity> Optional<T> getAtPointInTime(@NonNull Class<T> type, @NonNull UUID entityId, @NonNull Instant instant) {
        for (Entry entry : entriesOf(type, entityId)) {
            HistoryRecord<?> record = entry.record();
            if (record.timestamp().isAfter(instant)) continue;

            if (record.action() == HistoryAction.DELETE) {
                return Optional.empty();
            }
            return Optional.ofNullable(type.cast(record.snapshot()));
        }
        return Optional.empty();
    }

    @Override
    public <T extends BaseEntity> List<HistoryRecord<T>> getByDateRange(@NonNull Class<T> type, @NonNull Instant from, @NonNull Instant to) {
        Map<UUID, List<Entry>> byEntity = recordsByType.get(type.getName());
        if (byEntity == null) return List.of();

        List<Entry> matching = new ArrayList<>();
        for (List<Entry> entries : byEntity.values()) {
            synchronized (entries) {
                for (Entry entry : entries) {
                    Instant timestamp = entry.record().timestamp();
                    if (!timestamp.isBefore(from) && !timestamp.isAfter(to)) {
                        matching.add(entry);
                    }
                }
            }
        }
        matching.sort(NEWEST_FIRST);
        return toRecords(matching);
    }

    @Override
    public <T extends BaseEntity> Optional<HistoryRecord<T>> getLatest(@NonNull Class<T> type, @NonNull UUID entityId) {
        List<HistoryRecord<T>> records = getAll(type, entityId);
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    }

    /**
     * Cópia ordenada do mais recente para o mais antigo.
     */
    private List<Entry> entriesOf(Class<?> type, UUID entityId) {
        Map<UUID, List<Entry>> byEntity = recordsByType.get(type.getName());
        if (byEntity == null) return List.of();

        List<Entry> entries = byEntity.get(entityId);
        if (entries == null) return List.of();

        List<Entry> copy;
        synchronized (entries) {
            copy = new ArrayList<>(entries);
        }
        copy.sort(NEWEST_FIRST);
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static <T extends BaseEntity> List<HistoryRecord<T>> toRecords(List<Entry> entries) {
        List<HistoryRecord<T>> records = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            records.add((HistoryRecord<T>) entry.record());
        }
        return List.copyOf(records);
    }

    private record Entry(HistoryRecord<?> record, long sequence) {
    }

}
