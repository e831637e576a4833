package generator;

import config.ScaleConfig;
import dao.BatchOutcome;
import lombok.AccessLevel;
import lombok.Getter;
import model.EntityKind;
import org.apache.commons.rng.UniformRandomProvider;
import util.RandomSources;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State of one generation run, created per run and handed to whatever needs it.
 */
@Getter
public class GenerationContext {

    private final ScaleConfig config;
    private final long seed;
    private final UniformRandomProvider rng;
    private final IdentityGenerator identities;
    private final LocalDateTime referenceTime;
    private final Instant startedAt;

    @Getter(AccessLevel.NONE)
    private final Set<String> directChatKeys = ConcurrentHashMap.newKeySet();
    @Getter(AccessLevel.NONE)
    private final Map<EntityKind, AtomicLong> committed = new EnumMap<>(EntityKind.class);
    @Getter(AccessLevel.NONE)
    private final Map<EntityKind, AtomicLong> skipped = new EnumMap<>(EntityKind.class);
    @Getter(AccessLevel.NONE)
    private final AtomicInteger batchIndex = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancelled = new AtomicBoolean();
    @Getter(AccessLevel.NONE)
    private final List<String> warnings = new CopyOnWriteArrayList<>();

    private GenerationContext(ScaleConfig config, long seed, LocalDateTime referenceTime, Instant startedAt) {
        this.config = config;
        this.seed = seed;
        this.rng = RandomSources.create(seed);
        this.identities = new IdentityGenerator(config.resolvedIdentityMode(), rng);
        this.referenceTime = referenceTime;
        this.startedAt = startedAt;
        for (EntityKind kind : EntityKind.values()) {
            committed.put(kind, new AtomicLong());
            skipped.put(kind, new AtomicLong());
        }
    }

    public static GenerationContext create(ScaleConfig config) {
        return create(config, Clock.systemDefaultZone());
    }

    /**
     * Uses the configured seed and reference time, or draws a seed and takes "now" from {@code clock}.
     */
    public static GenerationContext create(ScaleConfig config, Clock clock) {
        long seed = config.getSeed() != null ? config.getSeed() : RandomSources.newSeed();
        LocalDateTime reference = config.parsedReferenceTime();
        if (reference == null) {
            reference = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        }
        return new GenerationContext(config, seed, reference, clock.instant());
    }

    /** @return false when the key was already taken in this run */
    public boolean registerDirectChatKey(String key) {
        return directChatKeys.add(key);
    }

    public boolean hasDirectChatKey(String key) {
        return directChatKeys.contains(key);
    }

    public int nextBatchIndex() {
        return batchIndex.getAndIncrement();
    }

    public int batchCount() {
        return batchIndex.get();
    }

    public void recordOutcome(BatchOutcome outcome) {
        outcome.getInserted().forEach((kind, n) -> committed.get(kind).addAndGet(n));
        outcome.getSkipped().forEach((kind, n) -> skipped.get(kind).addAndGet(n));
    }

    public long committed(EntityKind kind) {
        return committed.get(kind).get();
    }

    public long skipped(EntityKind kind) {
        return skipped.get(kind).get();
    }

    public Map<EntityKind, Long> committedCounts() {
        return snapshot(committed);
    }

    public Map<EntityKind, Long> skippedCounts() {
        return snapshot(skipped);
    }

    public void cancel() {
        cancelled.set(true);
    }

    /** Cancelled explicitly or through interruption of the running thread. */
    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void warn(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    private static Map<EntityKind, Long> snapshot(Map<EntityKind, AtomicLong> counters) {
        Map<EntityKind, Long> copy = new EnumMap<>(EntityKind.class);
        counters.forEach((kind, n) -> copy.put(kind, n.get()));
        return copy;
    }
}
