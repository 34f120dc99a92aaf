package org.janelia.coreprep.transfer;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Tracks the transfer of one channel image. Once SUCCEEDED or FAILED a job can no longer change.
 */
public class TransferJob {

    private final String channel;
    private final TransferLocation location;
    private final String taskId;
    private final int attemptCount;
    private TransferStatus status;
    private String statusDetails;

    TransferJob(String channel, TransferLocation location, String taskId, int attemptCount) {
        this.channel = channel;
        this.location = location;
        this.taskId = taskId;
        this.attemptCount = attemptCount;
        this.status = TransferStatus.PENDING;
    }

    public String getChannel() {
        return channel;
    }

    public TransferLocation getLocation() {
        return location;
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * @return the number of submission attempts it took to create the task
     */
    public int getAttemptCount() {
        return attemptCount;
    }

    public TransferStatus getStatus() {
        return status;
    }

    void updateStatus(TransferStatus newStatus, String details) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Transfer " + taskId + " for " + channel + " already " + status);
        }
        this.status = newStatus;
        this.statusDetails = details;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("channel", channel)
                .append("taskId", taskId)
                .append("status", status)
                .append("statusDetails", statusDetails)
                .toString();
    }
}
