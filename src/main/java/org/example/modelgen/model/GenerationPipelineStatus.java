package org.example.modelgen.model;

public record GenerationPipelineStatus(
        long queued,
        long downloading,
        long completed,
        long failed,
        long timedOut,
        long downloadFailed,
        long jobsScheduled,
        long jobsRunning
) {
    public static GenerationPipelineStatus of(
            long queued,
            long downloading,
            long completed,
            long failed,
            long timedOut,
            long downloadFailed,
            long jobsScheduled,
            long jobsRunning) {
        return new GenerationPipelineStatus(
                Math.max(0L, queued),
                Math.max(0L, downloading),
                Math.max(0L, completed),
                Math.max(0L, failed),
                Math.max(0L, timedOut),
                Math.max(0L, downloadFailed),
                Math.max(0L, jobsScheduled),
                Math.max(0L, jobsRunning)
        );
    }

    public long unsuccessful() {
        return failed + timedOut + downloadFailed;
    }
}
