package com.campaign.canon.run;

public enum StepStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED
}
