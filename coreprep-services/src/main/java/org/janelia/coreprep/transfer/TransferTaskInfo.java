package org.janelia.coreprep.transfer;

import org.apache.commons.lang3.builder.ToStringBuilder;

public class TransferTaskInfo {

    private final String taskId;
    private final TransferStatus status;
    private final String serviceStatus;
    private final String details;

    public TransferTaskInfo(String taskId, String serviceStatus, String details) {
        this.taskId = taskId;
        this.status = TransferStatus.fromServiceStatus(serviceStatus);
        this.serviceStatus = serviceStatus;
        this.details = details;
    }

    public String getTaskId() {
        return taskId;
    }

    public TransferStatus getStatus() {
        return status;
    }

    public String getServiceStatus() {
        return serviceStatus;
    }

    public String getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("taskId", taskId)
                .append("serviceStatus", serviceStatus)
                .append("details", details)
                .toString();
    }
}
