package com.id.beacon.modules.decoder.logic;

import com.id.beacon.model.BeaconTelemetryBatch;

import java.util.List;
import java.util.Map;

public final class ClusterIdResolver {

    public static final String CLUSTER_ID_KEY = "cluster_id";
    public static final List<String> SERVICE_NAME_KEYS = List.of("service.name", "service_name");

    private ClusterIdResolver() {
    }

    /**
     * Resolves the tenant/cluster a record belongs to: {@code cluster_id}, then a service name
     * attribute, then {@link BeaconTelemetryBatch#UNKNOWN_CLUSTER}.
     *
     * @param attributes labels or attributes of the record
     * @return the cluster id, never null
     */
    public static String resolve(Map<String, String> attributes) {
        if (attributes == null) {
            return BeaconTelemetryBatch.UNKNOWN_CLUSTER;
        }
        String clusterId = attributes.get(CLUSTER_ID_KEY);
        if (clusterId != null && !clusterId.isBlank()) {
            return clusterId;
        }
        for (String key : SERVICE_NAME_KEYS) {
            String serviceName = attributes.get(key);
            if (serviceName != null && !serviceName.isBlank()) {
                return serviceName;
            }
        }
        return BeaconTelemetryBatch.UNKNOWN_CLUSTER;
    }
}
