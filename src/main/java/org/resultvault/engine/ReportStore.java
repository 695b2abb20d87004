package org.resultvault.engine;

import java.util.List;
import java.util.Optional;

/**
 * Storage of runs, their generations and report rows.
 *
 * <p>Readers always see a complete committed generation. Commits of one run are totally ordered; commits of
 * different runs never wait for each other.
 */
public interface ReportStore {
    default GenerationHandle beginIngestion(String runName) {
        return beginIngestion(runName, GenerationOptions.DEFAULT);
    }

    /**
     * @throws RunLimitExceededException when {@code runName} is new and the run limit is reached
     */
    GenerationHandle beginIngestion(String runName, GenerationOptions options);

    /**
     * Stages a report; a second report with the same fingerprint is merged into the first.
     */
    void addReport(GenerationHandle handle, StagedReport report);

    /**
     * @throws StorageConflictException when another generation of the run was committed after {@code handle}
     *     was opened; the handle is aborted and the stored run is unchanged
     */
    CommitResult commit(GenerationHandle handle);

    void abort(GenerationHandle handle);

    Optional<Run> run(String runName);

    List<Run> runs();

    /**
     * Every report row of the latest generation, including resolved ones.
     *
     * @throws RunNotFoundException when the run does not exist
     */
    List<Report> reports(String runName);

    /**
     * Reports that were open once the most recent generation carrying {@code tag} was committed.
     *
     * @throws RunNotFoundException when the run or the tag does not exist
     */
    List<Report> openReportsAt(String runName, String tag);

    Optional<ReviewDecision> reviewStatus(String fingerprint);

    void setReviewStatus(String fingerprint, ReviewDecision decision);

    /**
     * @throws RunNotFoundException when the run does not exist
     * @throws RunLockedException while a generation of the run is open
     */
    void deleteRun(String runName);

    ReportStoreState exportState();
}
