package generator;

import config.DatasetMode;
import config.IdentityMode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import model.EntityKind;
import util.JsonSupport;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationReport {

    public enum Status {
        SUCCESS,
        FAILED,
        CANCELLED
    }

    Status status;
    DatasetMode mode;
    IdentityMode identityMode;
    long seed;
    String referenceTime;
    Map<EntityKind, Long> committed;
    Map<EntityKind, Long> skipped;
    int batches;
    long durationMs;
    double messagesPerSecond;

    // Set when status is FAILED
    Integer failedBatchIndex;
    String failureCause;
    List<String> failedRowSample;

    @Singular
    List<String> warnings;

    public long committed(EntityKind kind) {
        return committed == null ? 0L : committed.getOrDefault(kind, 0L);
    }

    public long skipped(EntityKind kind) {
        return skipped == null ? 0L : skipped.getOrDefault(kind, 0L);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public String toJson() {
        return JsonSupport.toJson(this);
    }

    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Generation ").append(status)
                .append(" (mode=").append(mode)
                .append(", ids=").append(identityMode)
                .append(", seed=").append(seed)
                .append(", reference=").append(referenceTime).append(")\n");
        for (EntityKind kind : EntityKind.values()) {
            sb.append(String.format("  - %-12s %,d committed, %,d skipped%n",
                    kind.label() + ":", committed(kind), skipped(kind)));
        }
        sb.append(String.format("  Batches: %d, duration: %.1f s, messages/s: %.0f%n",
                batches, durationMs / 1000.0, messagesPerSecond));
        if (status == Status.FAILED) {
            sb.append("  Failed batch: ").append(failedBatchIndex).append('\n');
            sb.append("  Cause: ").append(failureCause).append('\n');
            if (failedRowSample != null && !failedRowSample.isEmpty()) {
                sb.append("  Rows: ").append(String.join(", ", failedRowSample)).append('\n');
            }
        } else if (status == Status.CANCELLED && failureCause != null) {
            sb.append("  ").append(failureCause).append('\n');
        }
        for (String warning : warnings) {
            sb.append("  WARNING: ").append(warning).append('\n');
        }
        return sb.toString();
    }
}
