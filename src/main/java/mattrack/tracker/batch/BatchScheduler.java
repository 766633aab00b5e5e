package mattrack.tracker.batch;

import java.util.Map;

/**
 * Seam to the external batch scheduler. Calls may block on external commands;
 * never invoke them inside a store transaction.
 */
public interface BatchScheduler {

    /**
     * Submit a job.
     *
     * @param request job description
     * @return the scheduler's job id
     * @throws BatchSchedulerException when the submission is not acknowledged
     */
    String submit(SubmitRequest request) throws BatchSchedulerException;

    /**
     * List this user's jobs currently known to the scheduler.
     *
     * @return job id to normalized state; finished jobs may be absent
     * @throws BatchSchedulerException when the queue cannot be read
     */
    Map<String, ExternalJobState> poll() throws BatchSchedulerException;

    /**
     * Request cancellation of a job.
     *
     * @param jobId scheduler job id
     * @return true if the scheduler accepted the request
     */
    boolean cancel(String jobId);
}
