package org.janelia.coreprep.transfer;

import java.util.List;

/**
 * Remote transfer service. Implementations throw {@link TransientTransferException} for errors
 * that may go away on a retry and {@link TransferException} for any other failure.
 */
public interface TransferClient {

    void activateEndpoint(String endpointId);

    /**
     * @return the id of the submitted task
     */
    String submitTransfer(TransferRequest transferRequest);

    TransferTaskInfo getTaskStatus(String taskId);

    /**
     * @return the names of the regular files from the remote directory
     */
    List<String> listDirectory(String endpointId, String path);
}
