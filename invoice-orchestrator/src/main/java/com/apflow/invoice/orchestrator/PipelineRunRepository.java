package com.apflow.invoice.orchestrator;

import com.apflow.invoice.canonical.PipelineRunRecord;
import com.apflow.invoice.canonical.enums.PipelineState;
import com.apflow.invoice.orchestrator.state.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

/**
 * In-memory store of pipeline runs.
 *
 * Holds the latest attempt of every run id and an archive of the snapshots
 * taken when attempts terminated. Both live for the lifetime of the process:
 * a run id has to stay known for a resubmission to be answered with the
 * completed run instead of a second record.
 */
public class PipelineRunRepository {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunRepository.class);

    // runId -> latest attempt
    private final Map<String, PipelineRun> runs = new ConcurrentHashMap<>();
    private final List<PipelineRunRecord> archive = new CopyOnWriteArrayList<>();

    /**
     * Admit a run for the given id.
     *
     * A COMPLETED run is returned as is. A FAILED or CANCELLED run is replaced
     * by a new attempt created by the factory (which receives the attempt number).
     *
     * @throws IllegalStateException if an attempt for this id is still active
     */
    public synchronized PipelineRun admit(String runId, IntFunction<PipelineRun> newAttempt) {
        PipelineRun existing = runs.get(runId);
        if (existing != null) {
            PipelineState state = existing.getState();
            if (state == PipelineState.COMPLETED) {
                log.info("Run already completed, returning it - runId={}, attempt={}", runId, existing.getAttempt());
                return existing;
            }
            if (!state.isTerminal()) {
                throw new IllegalStateException("Run " + runId + " is still active in state " + state);
            }
        }

        int attempt = existing == null ? 1 : existing.getAttempt() + 1;
        PipelineRun run = newAttempt.apply(attempt);
        runs.put(runId, run);
        log.info("Run admitted - runId={}, attempt={}, stage=RECEIVED", runId, attempt);
        return run;
    }

    public Optional<PipelineRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * Latest attempt of every run, oldest first.
     */
    public List<PipelineRun> findAll() {
        return runs.values().stream()
            .sorted(Comparator.comparing(PipelineRun::getCreatedAt))
            .collect(Collectors.toList());
    }

    public PipelineRunRecord archive(PipelineRun run) {
        PipelineRunRecord record = run.toRecord();
        archive.add(record);
        return record;
    }

    public List<PipelineRunRecord> getArchivedRecords() {
        return Collections.unmodifiableList(new ArrayList<>(archive));
    }

    public List<PipelineRunRecord> getArchivedRecords(String runId) {
        return archive.stream()
            .filter(r -> r.getRunId().equals(runId))
            .collect(Collectors.toList());
    }
}
