package com.example.environment_service.kafka;

public final class KafkaTopics {

    public static final String GROUP_ID = "environment-service";

    public static final String PROVISION_REQUESTS = "environment-provision-requests";
    public static final String ACTION_REQUESTS = "environment-action-requests";
    public static final String BATCH_REQUESTS = "environment-batch-requests";
    public static final String EXPIRY_SWEEP = "environment-expiry-sweep";

    public static final String STATUS_EVENTS = "environment-status-events";
    public static final String BATCH_RESULTS = "environment-batch-results";
    public static final String ALERTS = "environment-alerts";

    private KafkaTopics() {
    }
}
