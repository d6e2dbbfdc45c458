package com.phonepe.agentrecall.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;

/**
 * Partition key that scopes every memory operation to one organization, application, agent and (optionally) user.
 */
@Value
@Builder
@Jacksonized
public class Namespace {
    @NonNull
    String orgId;
    @NonNull
    String appId;
    @NonNull
    String agentId;
    String userId;

    public static Namespace of(String orgId, String appId, String agentId) {
        return new Namespace(orgId, appId, agentId, null);
    }

    public static Namespace of(String orgId, String appId, String agentId, String userId) {
        return new Namespace(orgId, appId, agentId, userId);
    }

    /**
     * Colon joined key for this namespace. The user id is left out when absent.
     */
    public String key() {
        final var parts = new ArrayList<String>(4);
        parts.add(orgId);
        parts.add(appId);
        parts.add(agentId);
        if (userId != null && !userId.isEmpty()) {
            parts.add(userId);
        }
        return String.join(":", parts);
    }
}
