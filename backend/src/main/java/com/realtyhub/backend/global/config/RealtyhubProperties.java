package com.realtyhub.backend.global.config;

import java.time.ZoneId;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Typed view of the {@code realtyhub.*} configuration tree.
 */
@ConfigurationProperties(prefix = "realtyhub")
public record RealtyhubProperties(
        @DefaultValue("UTC") ZoneId timeZone,
        @DefaultValue Pagination pagination,
        @DefaultValue Review review,
        @DefaultValue Listing listing,
        @DefaultValue Lead lead,
        @DefaultValue Storage storage,
        @DefaultValue Errors errors,
        @DefaultValue SuperAdmin superAdmin
) {

    public record Pagination(
            @DefaultValue("10") int defaultSize,
            @DefaultValue("100") int maxSize
    ) {
    }

    public record Review(
            @DefaultValue("500") int reasonMaxLength,
            @DefaultValue("1000") int notesMaxLength
    ) {
    }

    public record Listing(
            @DefaultValue("10") int maxImages,
            @DefaultValue("properties") String imageFolder
    ) {
    }

    public record Lead(
            @DefaultValue("false") boolean rescoreOnUpdate,
            @DefaultValue Scoring scoring
    ) {
    }

    /**
     * Additive lead score weights. The sum is capped at {@code cap}.
     */
    public record Scoring(
            @DefaultValue("10") int name,
            @DefaultValue("15") int phone,
            @DefaultValue("10") int email,
            @DefaultValue("50") int messageLengthThreshold,
            @DefaultValue("10") int message,
            @DefaultValue("100") int longMessageLengthThreshold,
            @DefaultValue("5") int longMessage,
            @DefaultValue("15") int budget,
            @DefaultValue("5") int budgetMin,
            @DefaultValue("5") int budgetMax,
            @DefaultValue("10") int location,
            @DefaultValue("5") int locationCity,
            @DefaultValue("5") int locationState,
            @DefaultValue("5") int perPropertyInterest,
            @DefaultValue("2") int perTag,
            @DefaultValue("100") int cap
    ) {
    }

    public record Storage(
            String bucket,
            @DefaultValue("us-east-1") String region,
            String endpoint,
            String publicBaseUrl,
            @DefaultValue({"image/jpeg", "image/png", "image/gif"}) List<String> allowedContentTypes,
            @DefaultValue("10485760") long maxFileSize
    ) {
    }

    public record Errors(@DefaultValue("false") boolean includeDetail) {
    }

    public record SuperAdmin(@DefaultValue("false") boolean bootstrapEnabled) {
    }
}
