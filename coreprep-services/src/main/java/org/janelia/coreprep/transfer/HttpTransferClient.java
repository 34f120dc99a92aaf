package org.janelia.coreprep.transfer;

import java.util.ArrayList;
import java.util.List;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.client.WebTarget;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;
import org.janelia.coreprep.utils.HttpUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transfer client for a Globus Transfer style REST API.
 */
public class HttpTransferClient implements TransferClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpTransferClient.class);

    private static final ImmutableSet<Integer> TRANSIENT_STATUS_CODES = ImmutableSet.of(500, 502, 503, 504);

    private final String transferServiceURL;
    private final String accessToken;
    private final ObjectMapper objectMapper;

    public HttpTransferClient(String transferServiceURL, String accessToken, ObjectMapper objectMapper) {
        this.transferServiceURL = transferServiceURL;
        this.accessToken = accessToken;
        this.objectMapper = objectMapper;
    }

    @Override
    public void activateEndpoint(String endpointId) {
        Client httpclient = HttpUtils.createHttpClient();
        try {
            WebTarget target = httpclient.target(transferServiceURL)
                    .path("endpoint")
                    .path(endpointId)
                    .path("autoactivate");
            Response response = createRequestWithCredentials(target).post(Entity.entity("{}", MediaType.APPLICATION_JSON));
            readJsonResponse(target, response, "activate endpoint " + endpointId);
        } catch (ProcessingException e) {
            throw new TransientTransferException("Error connecting to " + transferServiceURL + " to activate " + endpointId, e);
        } finally {
            httpclient.close();
        }
    }

    @Override
    public String submitTransfer(TransferRequest transferRequest) {
        Client httpclient = HttpUtils.createHttpClient();
        try {
            WebTarget target = httpclient.target(transferServiceURL).path("transfer");
            String body = objectMapper.writeValueAsString(createTransferDocument(transferRequest));
            LOG.debug("Submit transfer {} to {}", transferRequest, target.getUri());
            Response response = createRequestWithCredentials(target).post(Entity.entity(body, MediaType.APPLICATION_JSON));
            JsonNode result = readJsonResponse(target, response, "submit " + transferRequest);
            String taskId = result.path("task_id").asText(null);
            if (StringUtils.isBlank(taskId)) {
                throw new TransferException("No task id returned by " + target.getUri() + " for " + transferRequest);
            }
            return taskId;
        } catch (JsonProcessingException e) {
            throw new TransferException("Error encoding " + transferRequest, e);
        } catch (ProcessingException e) {
            throw new TransientTransferException("Error connecting to " + transferServiceURL + " to submit " + transferRequest, e);
        } finally {
            httpclient.close();
        }
    }

    @Override
    public TransferTaskInfo getTaskStatus(String taskId) {
        Client httpclient = HttpUtils.createHttpClient();
        try {
            WebTarget target = httpclient.target(transferServiceURL)
                    .path("task")
                    .path(taskId);
            Response response = createRequestWithCredentials(target).get();
            JsonNode result = readJsonResponse(target, response, "get status of task " + taskId);
            return new TransferTaskInfo(taskId,
                    result.path("status").asText(null),
                    result.path("nice_status_details").asText(null));
        } catch (ProcessingException e) {
            throw new TransientTransferException("Error connecting to " + transferServiceURL + " to get task " + taskId, e);
        } finally {
            httpclient.close();
        }
    }

    @Override
    public List<String> listDirectory(String endpointId, String path) {
        Client httpclient = HttpUtils.createHttpClient();
        try {
            WebTarget target = httpclient.target(transferServiceURL)
                    .path("operation/endpoint")
                    .path(endpointId)
                    .path("ls")
                    .queryParam("path", path);
            Response response = createRequestWithCredentials(target).get();
            JsonNode result = readJsonResponse(target, response, "list " + path + " on " + endpointId);
            List<String> fileNames = new ArrayList<>();
            for (JsonNode entry : result.path("DATA")) {
                if ("file".equals(entry.path("type").asText("file"))) {
                    fileNames.add(entry.path("name").asText());
                }
            }
            return fileNames;
        } catch (ProcessingException e) {
            throw new TransientTransferException("Error connecting to " + transferServiceURL + " to list " + path + " on " + endpointId, e);
        } finally {
            httpclient.close();
        }
    }

    private ObjectNode createTransferDocument(TransferRequest transferRequest) {
        ObjectNode transferDocument = objectMapper.createObjectNode()
                .put("DATA_TYPE", "transfer")
                .put("source_endpoint", transferRequest.getSourceEndpoint())
                .put("destination_endpoint", transferRequest.getDestinationEndpoint())
                .put("label", transferRequest.getLabel())
                .put("sync_level", transferRequest.getSyncLevel())
                .put("verify_checksum", transferRequest.isVerifyChecksum())
                .put("notify_on_succeeded", false)
                .put("notify_on_failed", false)
                .put("notify_on_inactive", false);
        ArrayNode items = transferDocument.putArray("DATA");
        items.addObject()
                .put("DATA_TYPE", "transfer_item")
                .put("source_path", transferRequest.getSourcePath())
                .put("destination_path", transferRequest.getDestinationPath());
        return transferDocument;
    }

    private Invocation.Builder createRequestWithCredentials(WebTarget target) {
        Invocation.Builder requestBuilder = target.request(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(accessToken)) {
            requestBuilder = requestBuilder.header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        }
        return requestBuilder;
    }

    private JsonNode readJsonResponse(WebTarget target, Response response, String operation) {
        int responseStatus = response.getStatus();
        String responseBody = response.hasEntity() ? response.readEntity(String.class) : null;
        if (responseStatus >= Response.Status.BAD_REQUEST.getStatusCode()) {
            LOG.warn("Request {} to {} returned status {}: {}", target.getUri(), operation, responseStatus, responseBody);
            String message = "Request " + target.getUri() + " to " + operation + " returned status " + responseStatus;
            if (TRANSIENT_STATUS_CODES.contains(responseStatus)) {
                throw new TransientTransferException(message, responseStatus, null);
            } else {
                throw new TransferException(message, responseStatus, null);
            }
        }
        if (StringUtils.isBlank(responseBody)) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new TransferException("Invalid response from " + target.getUri() + " to " + operation, e);
        }
    }
}
