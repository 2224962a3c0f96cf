package com.campaign.canon.run;

/**
 * Result of {@link RunController#startRun(RunRequest)}.
 *
 * @param run     the new or reused run
 * @param created false when an existing run was returned
 */
public record RunStart(Run run, boolean created) {
}
