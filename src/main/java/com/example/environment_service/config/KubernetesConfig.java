package com.example.environment_service.config;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.AppsV1Api;
import io.kubernetes.client.openapi.apis.BatchV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.apis.NetworkingV1Api;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.KubeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Configuration
@Slf4j
public class KubernetesConfig {

    @Value("${kubernetes.kubeconfig:}")
    private String kubeconfigPath;

    @Value("${kubernetes.connect-timeout-seconds:10}")
    private int connectTimeoutSeconds;

    @Value("${kubernetes.read-timeout-seconds:30}")
    private int readTimeoutSeconds;

    @Bean
    public ApiClient apiClient() throws IOException {
        ApiClient client;
        if (kubeconfigPath != null && !kubeconfigPath.isBlank() && Files.exists(Path.of(kubeconfigPath))) {
            log.info("Loading Kubernetes client from kubeconfig '{}'", kubeconfigPath);
            try (Reader reader = new FileReader(kubeconfigPath, StandardCharsets.UTF_8)) {
                client = ClientBuilder.kubeconfig(KubeConfig.loadKubeConfig(reader)).build();
            }
        } else {
            log.info("Loading Kubernetes client from in-cluster or default configuration");
            client = ClientBuilder.standard().build();
        }

        // Per-call timeouts for every adapter request.
        client.setHttpClient(client.getHttpClient().newBuilder()
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .build());
        return client;
    }

    @Bean
    public CoreV1Api coreV1Api(ApiClient apiClient) {
        return new CoreV1Api(apiClient);
    }

    @Bean
    public AppsV1Api appsV1Api(ApiClient apiClient) {
        return new AppsV1Api(apiClient);
    }

    @Bean
    public NetworkingV1Api networkingV1Api(ApiClient apiClient) {
        return new NetworkingV1Api(apiClient);
    }

    @Bean
    public BatchV1Api batchV1Api(ApiClient apiClient) {
        return new BatchV1Api(apiClient);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
