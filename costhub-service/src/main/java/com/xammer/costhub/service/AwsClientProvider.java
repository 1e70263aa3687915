package com.xammer.costhub.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.costoptimizationhub.CostOptimizationHubClient;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;

import javax.annotation.PreDestroy;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Builds and caches one SDK client per service and region. When {@code costhub.aws.role-arn} is set the
 * clients run under that assumed role, otherwise under the default credentials chain.
 */
@Service
public class AwsClientProvider {

    private static final Logger logger = LoggerFactory.getLogger(AwsClientProvider.class);

    /** Cost Explorer and Cost Optimization Hub are only served from us-east-1. */
    public static final String GLOBAL_BILLING_REGION = "us-east-1";

    private final StsClient stsClient;
    private final String roleArn;
    private final String externalId;
    private final Map<String, SdkClient> clients = new ConcurrentHashMap<>();
    private volatile AwsCredentialsProvider credentialsProvider;

    public AwsClientProvider(StsClient stsClient,
                             @Value("${costhub.aws.role-arn:}") String roleArn,
                             @Value("${costhub.aws.external-id:}") String externalId) {
        this.stsClient = stsClient;
        this.roleArn = roleArn;
        this.externalId = externalId;
        logger.info("AwsClientProvider initialized (assume role: {})", roleArn.isBlank() ? "none" : roleArn);
    }

    public AwsCredentialsProvider getCredentialsProvider() {
        AwsCredentialsProvider provider = credentialsProvider;
        if (provider == null) {
            synchronized (this) {
                if (credentialsProvider == null) {
                    credentialsProvider = buildCredentialsProvider();
                }
                provider = credentialsProvider;
            }
        }
        return provider;
    }

    private AwsCredentialsProvider buildCredentialsProvider() {
        if (roleArn.isBlank()) {
            return DefaultCredentialsProvider.create();
        }
        logger.debug("Creating assume-role credentials provider for roleArn={}", roleArn);
        return StsAssumeRoleCredentialsProvider.builder()
                .stsClient(stsClient)
                .refreshRequest(req -> {
                    req.roleArn(roleArn).roleSessionName("costhub-session");
                    if (!externalId.isBlank()) {
                        req.externalId(externalId);
                    }
                })
                .build();
    }

    public CostOptimizationHubClient getCostOptimizationHubClient(String region) {
        return cached(CostOptimizationHubClient.class, region,
                () -> getClient(CostOptimizationHubClient.class, CostOptimizationHubClient.builder(), region));
    }

    public CostExplorerClient getCostExplorerClient() {
        return cached(CostExplorerClient.class, GLOBAL_BILLING_REGION,
                () -> getClient(CostExplorerClient.class, CostExplorerClient.builder(), GLOBAL_BILLING_REGION));
    }

    private <BuilderT extends AwsClientBuilder<BuilderT, ClientT>, ClientT> ClientT getClient(
            Class<ClientT> clientClass, BuilderT builder, String region) {
        logger.debug("Creating {} in region {}", clientClass.getSimpleName(), region);
        return builder
                .credentialsProvider(getCredentialsProvider())
                .region(Region.of(region))
                .build();
    }

    private <T extends SdkClient> T cached(Class<T> clientClass, String region, Supplier<T> factory) {
        String key = clientClass.getSimpleName() + ":" + region;
        return clientClass.cast(clients.computeIfAbsent(key, k -> factory.get()));
    }

    @PreDestroy
    public void close() {
        clients.values().forEach(client -> {
            try {
                client.close();
            } catch (RuntimeException e) {
                logger.warn("Failed to close {}: {}", client.serviceName(), e.getMessage());
            }
        });
        clients.clear();
    }
}
