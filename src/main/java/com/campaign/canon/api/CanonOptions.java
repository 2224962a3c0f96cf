package com.campaign.canon.api;

import com.campaign.canon.cache.CacheConfig;
import com.campaign.canon.evidence.EvidenceOptions;
import com.campaign.canon.lock.LockConfig;
import com.campaign.canon.run.RetryPolicy;
import com.campaign.canon.run.RunController;

import java.util.Objects;

/**
 * Options of a {@link CampaignCanon} instance.
 * The prompt version and model are part of every run's idempotency key.
 */
public class CanonOptions {

    private static final String DEFAULT_PROMPT_VERSION = "v1";
    private static final String DEFAULT_MODEL = "default";

    private final String promptVersion;
    private final String model;
    private final RetryPolicy retryPolicy;
    private final LockConfig lockConfig;
    private final CacheConfig cacheConfig;
    private final EvidenceOptions evidenceOptions;
    private final int errorTruncateLength;

    private CanonOptions(Builder builder) {
        this.promptVersion = builder.promptVersion;
        this.model = builder.model;
        this.retryPolicy = builder.retryPolicy;
        this.lockConfig = builder.lockConfig;
        this.cacheConfig = builder.cacheConfig;
        this.evidenceOptions = builder.evidenceOptions;
        this.errorTruncateLength = builder.errorTruncateLength;
    }

    public String getPromptVersion() {
        return promptVersion;
    }

    public String getModel() {
        return model;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public LockConfig getLockConfig() {
        return lockConfig;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public EvidenceOptions getEvidenceOptions() {
        return evidenceOptions;
    }

    public int getErrorTruncateLength() {
        return errorTruncateLength;
    }

    public static CanonOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String promptVersion = DEFAULT_PROMPT_VERSION;
        private String model = DEFAULT_MODEL;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private LockConfig lockConfig = LockConfig.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private EvidenceOptions evidenceOptions = EvidenceOptions.defaults();
        private int errorTruncateLength = RunController.DEFAULT_ERROR_TRUNCATE_LENGTH;

        public Builder promptVersion(String promptVersion) {
            if (promptVersion == null || promptVersion.isBlank()) {
                throw new IllegalArgumentException("promptVersion must not be blank");
            }
            this.promptVersion = promptVersion;
            return this;
        }

        public Builder model(String model) {
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("model must not be blank");
            }
            this.model = model;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
            return this;
        }

        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = Objects.requireNonNull(lockConfig, "lockConfig is required");
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public Builder evidenceOptions(EvidenceOptions evidenceOptions) {
            this.evidenceOptions = Objects.requireNonNull(evidenceOptions, "evidenceOptions is required");
            return this;
        }

        public Builder errorTruncateLength(int errorTruncateLength) {
            if (errorTruncateLength <= 0) {
                throw new IllegalArgumentException("errorTruncateLength must be positive");
            }
            this.errorTruncateLength = errorTruncateLength;
            return this;
        }

        public CanonOptions build() {
            return new CanonOptions(this);
        }
    }
}
