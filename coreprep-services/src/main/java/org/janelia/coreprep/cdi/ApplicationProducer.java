package org.janelia.coreprep.cdi;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.janelia.coreprep.cdi.qualifier.ApplicationProperties;
import org.janelia.coreprep.cdi.qualifier.PropertyValue;
import org.janelia.coreprep.config.ApplicationConfig;
import org.janelia.coreprep.config.PreparationSettings;
import org.janelia.coreprep.transfer.HttpTransferClient;
import org.janelia.coreprep.transfer.RetryPolicy;
import org.janelia.coreprep.transfer.TransferClient;

@ApplicationScoped
public class ApplicationProducer {

    static final String TRANSFER_URL = "Transfer.URL";
    static final String TRANSFER_ACCESS_TOKEN = "Transfer.AccessToken";
    static final String RETRY_MAX_ATTEMPTS = "Transfer.Retry.MaxAttempts";
    static final String RETRY_BASE_DELAY_MILLIS = "Transfer.Retry.BaseDelayMillis";
    static final String RETRY_MAX_DELAY_MILLIS = "Transfer.Retry.MaxDelayMillis";

    @Produces
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.instance().getDefaultObjectMapper();
    }

    @PropertyValue(name = "")
    @Produces
    public String stringPropertyValue(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final PropertyValue property = injectionPoint.getAnnotated().getAnnotation(PropertyValue.class);
        return applicationConfig.getStringPropertyValue(property.name());
    }

    @Produces
    public PreparationSettings preparationSettings(@ApplicationProperties ApplicationConfig applicationConfig) {
        return PreparationSettings.fromConfig(applicationConfig);
    }

    @Produces
    public RetryPolicy transferRetryPolicy(@ApplicationProperties ApplicationConfig applicationConfig) {
        return new RetryPolicy(
                applicationConfig.getIntegerPropertyValue(RETRY_MAX_ATTEMPTS, 5),
                applicationConfig.getLongPropertyValue(RETRY_BASE_DELAY_MILLIS, 1000L),
                applicationConfig.getLongPropertyValue(RETRY_MAX_DELAY_MILLIS, 30000L));
    }

    @Produces
    public TransferClient transferClient(@ApplicationProperties ApplicationConfig applicationConfig, ObjectMapper objectMapper) {
        String transferServiceURL = applicationConfig.getStringPropertyValue(TRANSFER_URL);
        if (StringUtils.isBlank(transferServiceURL)) {
            throw new IllegalStateException(TRANSFER_URL + " must be set in order to fetch remote channel images");
        }
        return new HttpTransferClient(transferServiceURL, applicationConfig.getStringPropertyValue(TRANSFER_ACCESS_TOKEN), objectMapper);
    }

    @ApplicationProperties
    @ApplicationScoped
    @Produces
    public ApplicationConfig applicationConfig() {
        return new ApplicationConfigProvider()
                .fromDefaultResources()
                .fromEnvVar("COREPREP_CONFIG")
                .fromMap(ApplicationConfigProvider.getAppDynamicArgs())
                .build();
    }
}
