package com.archivist.sync.api;

import com.archivist.sync.mapping.MappingPresets;
import com.archivist.sync.remote.RemoteCampaignService;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration of a {@link CampaignSync} instance.
 */
public class SyncOptions {

    public static final String PREFIX = "campaign-sync.";

    private static final double DEFAULT_AUTO_IMPORT_THRESHOLD = 0.75;
    private static final double DEFAULT_REVIEW_THRESHOLD = 0.40;
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_PAGE_SIZE = 100;

    private final String campaignId;
    private final String apiBaseUrl;
    private final String apiKey;
    private final String systemId;
    private final int descriptionMaxLength;
    private final double autoImportThreshold;
    private final double reviewThreshold;
    private final Duration requestTimeout;
    private final int pageSize;

    private SyncOptions(Builder builder) {
        this.campaignId = builder.campaignId;
        this.apiBaseUrl = builder.apiBaseUrl;
        this.apiKey = builder.apiKey;
        this.systemId = builder.systemId;
        this.descriptionMaxLength = builder.descriptionMaxLength;
        this.autoImportThreshold = builder.autoImportThreshold;
        this.reviewThreshold = builder.reviewThreshold;
        this.requestTimeout = builder.requestTimeout;
        this.pageSize = builder.pageSize;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getSystemId() {
        return systemId;
    }

    public int getDescriptionMaxLength() {
        return descriptionMaxLength;
    }

    public double getAutoImportThreshold() {
        return autoImportThreshold;
    }

    public double getReviewThreshold() {
        return reviewThreshold;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public int getPageSize() {
        return pageSize;
    }

    /**
     * Default thresholds for a campaign.
     */
    public static SyncOptions defaults(String campaignId) {
        return builder().campaignId(campaignId).build();
    }

    /**
     * Imports only near-certain proposals and sends more of them to review.
     */
    public static SyncOptions conservative(String campaignId) {
        return builder()
                .campaignId(campaignId)
                .autoImportThreshold(0.90)
                .reviewThreshold(0.30)
                .build();
    }

    /**
     * Reads {@code campaign-sync.*} keys. Missing keys keep their defaults.
     *
     * <pre>
     * campaign-sync.campaign-id=c-42
     * campaign-sync.api.base-url=https://api.example.com/v1
     * campaign-sync.api.key=...
     * campaign-sync.api.timeout-seconds=30
     * campaign-sync.api.page-size=100
     * campaign-sync.system-id=dnd5e
     * campaign-sync.description.max-length=10000
     * campaign-sync.import.auto-threshold=0.75
     * campaign-sync.import.review-threshold=0.4
     * </pre>
     *
     * @throws IllegalArgumentException if a numeric value cannot be parsed or is out of range
     */
    public static SyncOptions fromProperties(Properties properties) {
        Builder builder = builder()
                .campaignId(properties.getProperty(PREFIX + "campaign-id"))
                .apiBaseUrl(properties.getProperty(PREFIX + "api.base-url"))
                .apiKey(properties.getProperty(PREFIX + "api.key"));
        String systemId = properties.getProperty(PREFIX + "system-id");
        if (systemId != null && !systemId.isBlank()) {
            builder.systemId(systemId.trim());
        }
        String timeout = properties.getProperty(PREFIX + "api.timeout-seconds");
        if (timeout != null) {
            builder.requestTimeout(Duration.ofSeconds(parseInt(timeout, "api.timeout-seconds")));
        }
        String pageSize = properties.getProperty(PREFIX + "api.page-size");
        if (pageSize != null) {
            builder.pageSize(parseInt(pageSize, "api.page-size"));
        }
        String maxLength = properties.getProperty(PREFIX + "description.max-length");
        if (maxLength != null) {
            builder.descriptionMaxLength(parseInt(maxLength, "description.max-length"));
        }
        String auto = properties.getProperty(PREFIX + "import.auto-threshold");
        if (auto != null) {
            builder.autoImportThreshold(parseDouble(auto, "import.auto-threshold"));
        }
        String review = properties.getProperty(PREFIX + "import.review-threshold");
        if (review != null) {
            builder.reviewThreshold(parseDouble(review, "import.review-threshold"));
        }
        return builder.build();
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: " + value, e);
        }
    }

    private static double parseDouble(String value, String key) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String campaignId;
        private String apiBaseUrl;
        private String apiKey;
        private String systemId = MappingPresets.GENERIC_ID;
        private int descriptionMaxLength = RemoteCampaignService.DEFAULT_DESCRIPTION_LIMIT;
        private double autoImportThreshold = DEFAULT_AUTO_IMPORT_THRESHOLD;
        private double reviewThreshold = DEFAULT_REVIEW_THRESHOLD;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private int pageSize = DEFAULT_PAGE_SIZE;

        public Builder campaignId(String campaignId) {
            this.campaignId = campaignId;
            return this;
        }

        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder systemId(String systemId) {
            this.systemId = Objects.requireNonNull(systemId, "systemId");
            return this;
        }

        public Builder descriptionMaxLength(int descriptionMaxLength) {
            if (descriptionMaxLength <= 0) {
                throw new IllegalArgumentException("descriptionMaxLength must be positive");
            }
            this.descriptionMaxLength = descriptionMaxLength;
            return this;
        }

        public Builder autoImportThreshold(double autoImportThreshold) {
            validateThreshold(autoImportThreshold, "autoImportThreshold");
            this.autoImportThreshold = autoImportThreshold;
            return this;
        }

        public Builder reviewThreshold(double reviewThreshold) {
            validateThreshold(reviewThreshold, "reviewThreshold");
            this.reviewThreshold = reviewThreshold;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
                throw new IllegalArgumentException("requestTimeout must be positive");
            }
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder pageSize(int pageSize) {
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive");
            }
            this.pageSize = pageSize;
            return this;
        }

        public SyncOptions build() {
            Objects.requireNonNull(campaignId, "campaignId is required");
            if (autoImportThreshold < reviewThreshold) {
                throw new IllegalArgumentException("autoImportThreshold must be >= reviewThreshold");
            }
            return new SyncOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "SyncOptions{" +
                "campaignId='" + campaignId + '\'' +
                ", apiBaseUrl='" + apiBaseUrl + '\'' +
                ", systemId='" + systemId + '\'' +
                ", descriptionMaxLength=" + descriptionMaxLength +
                ", autoImportThreshold=" + autoImportThreshold +
                ", reviewThreshold=" + reviewThreshold +
                ", requestTimeout=" + requestTimeout +
                ", pageSize=" + pageSize +
                '}';
    }
}
