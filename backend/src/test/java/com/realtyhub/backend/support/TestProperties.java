package com.realtyhub.backend.support;

import java.time.ZoneId;
import java.util.List;

import com.realtyhub.backend.global.config.RealtyhubProperties;

/**
 * {@link RealtyhubProperties} with the same values as the bound defaults, for tests that build services by hand.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static RealtyhubProperties defaults() {
        return with(ZoneId.of("UTC"), false);
    }

    public static RealtyhubProperties with(ZoneId timeZone, boolean rescoreOnUpdate) {
        return new RealtyhubProperties(
                timeZone,
                new RealtyhubProperties.Pagination(10, 100),
                new RealtyhubProperties.Review(500, 1000),
                new RealtyhubProperties.Listing(10, "properties"),
                new RealtyhubProperties.Lead(rescoreOnUpdate, defaultScoring()),
                new RealtyhubProperties.Storage(
                        "realtyhub-test",
                        "us-east-1",
                        null,
                        "https://cdn.example.com",
                        List.of("image/jpeg", "image/png", "image/gif"),
                        10_485_760L
                ),
                new RealtyhubProperties.Errors(false),
                new RealtyhubProperties.SuperAdmin(false)
        );
    }

    public static RealtyhubProperties.Scoring defaultScoring() {
        return new RealtyhubProperties.Scoring(10, 15, 10, 50, 10, 100, 5, 15, 5, 5, 10, 5, 5, 5, 2, 100);
    }
}
