package com.tollgate.quota;

import java.util.UUID;

/**
 * Source of a project's monthly quota, typically its subscription plan.
 */
@FunctionalInterface
public interface PlanLimitProvider {

    long monthlyQuotaLimit(UUID projectId);
}
