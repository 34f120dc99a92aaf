package org.janelia.coreprep.transfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches channel images from a remote endpoint. One transfer per channel is submitted when the instance is created;
 * afterwards every check only polls the state of the channel's task.
 */
public class RemoteAvailability implements FileAvailability {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteAvailability.class);

    private final TransferClient transferClient;
    private final Map<String, TransferLocation> transferMap;
    private final TransferEndpoints endpoints;
    private final RetryPolicy retryPolicy;
    private final boolean cleanupEnabled;
    private final Map<String, TransferJob> pendingJobs = new LinkedHashMap<>();
    private final Set<String> availableChannels = new HashSet<>();
    private final Map<String, String> failedChannels = new LinkedHashMap<>();

    public RemoteAvailability(TransferClient transferClient,
                              Map<String, TransferLocation> transferMap,
                              TransferEndpoints endpoints,
                              RetryPolicy retryPolicy,
                              boolean cleanupEnabled) {
        this.transferClient = transferClient;
        this.transferMap = ImmutableMap.copyOf(transferMap);
        this.endpoints = endpoints;
        this.retryPolicy = retryPolicy;
        this.cleanupEnabled = cleanupEnabled;
        submitAllTransfers();
    }

    private void submitAllTransfers() {
        transferMap.forEach((channel, location) -> {
            if (Files.exists(location.getLocalPath())) {
                LOG.info("Skipping transfer for {}; file already exists: {}", channel, location.getLocalPath());
                availableChannels.add(channel);
                return;
            }
            try {
                TransferJob job = submitTransfer(channel, location);
                pendingJobs.put(channel, job);
                LOG.info("Submitted transfer for {} to {} (task_id={}, attempts={})", channel, location.getTransferPath(), job.getTaskId(), job.getAttemptCount());
            } catch (RuntimeException e) {
                LOG.error("Transfer submission failed for {} from {}", channel, location.getRemotePath(), e);
                failedChannels.put(channel, "transfer submission failed: " + e.getMessage());
            }
        });
    }

    private TransferJob submitTransfer(String channel, TransferLocation location) {
        TransferRequest transferRequest = TransferRequest.checksumVerified(endpoints, location.getRemotePath(), location.getTransferPath());
        AtomicInteger attempts = new AtomicInteger();
        String taskId = retryPolicy.execute("Transfer submission for " + channel, () -> {
            attempts.incrementAndGet();
            activateEndpoints();
            return transferClient.submitTransfer(transferRequest);
        });
        return new TransferJob(channel, location, taskId, attempts.get());
    }

    private void activateEndpoints() {
        for (String endpointId : new String[] {endpoints.getSourceEndpoint(), endpoints.getDestinationEndpoint()}) {
            try {
                transferClient.activateEndpoint(endpointId);
            } catch (RuntimeException e) {
                LOG.warn("Endpoint {} activation failed: {}", endpointId, e.getMessage());
            }
        }
    }

    @Override
    public boolean fetchOrWait(String channel, Path localPath) {
        if (availableChannels.contains(channel)) {
            return true;
        }
        TransferJob job = pendingJobs.get(channel);
        if (job == null) {
            if (failedChannels.containsKey(channel)) {
                return false;
            }
            if (Files.exists(localPath)) {
                availableChannels.add(channel);
                return true;
            }
            LOG.warn("No transfer task for {}, and file not found: {}", channel, localPath);
            return false;
        }
        TransferTaskInfo taskInfo;
        try {
            taskInfo = transferClient.getTaskStatus(job.getTaskId());
        } catch (TransientTransferException e) {
            LOG.warn("Could not get the status of transfer {} for {} - will check again: {}", job.getTaskId(), channel, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            LOG.error("Transfer status lookup failed for {} (task {})", channel, job.getTaskId(), e);
            job.updateStatus(TransferStatus.FAILED, e.getMessage());
            pendingJobs.remove(channel);
            failedChannels.put(channel, "transfer status lookup failed: " + e.getMessage());
            return false;
        }
        switch (taskInfo.getStatus()) {
            case SUCCEEDED:
                job.updateStatus(TransferStatus.SUCCEEDED, taskInfo.getDetails());
                pendingJobs.remove(channel);
                availableChannels.add(channel);
                LOG.info("Transfer for {} complete: {}", channel, job.getLocation().getLocalPath());
                return true;
            case FAILED:
                job.updateStatus(TransferStatus.FAILED, taskInfo.getDetails());
                pendingJobs.remove(channel);
                failedChannels.put(channel, "transfer failed: " + taskInfo.getDetails());
                LOG.error("Transfer failed for {} (task {}): {}", channel, job.getTaskId(), taskInfo.getDetails());
                return false;
            default:
                LOG.debug("Transfer for {} (task {}) is {}", channel, job.getTaskId(), taskInfo.getServiceStatus());
                return false;
        }
    }

    @Override
    public void cleanup(String channel, Path localPath, boolean force) {
        if (!cleanupEnabled && !force) {
            LOG.info("Skipping cleanup for {}; cleanup is disabled.", localPath);
            return;
        }
        try {
            if (Files.deleteIfExists(localPath)) {
                LOG.info("Cleaned up file: {}", localPath);
            }
        } catch (IOException e) {
            LOG.warn("Cleanup failed for {}: {}", localPath, e.toString());
        }
    }

    @Override
    public Set<String> getFailedChannels() {
        return Collections.unmodifiableSet(failedChannels.keySet());
    }

    @Override
    public Optional<String> getFailureReason(String channel) {
        return Optional.ofNullable(failedChannels.get(channel));
    }

    Optional<TransferJob> getPendingJob(String channel) {
        return Optional.ofNullable(pendingJobs.get(channel));
    }
}
