package com.payment.wire.config;

import com.payment.wire.codec.DecodeOptions;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under {@code payment.wire.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "payment.wire")
public class WireCodecProperties {

    /**
     * Reject coupons with both amount_off and percent_off, and customers with both sources and cards.
     * Off by default: the API does not promise exclusivity in its schema.
     */
    private boolean strictExclusivity = false;

    /** Deepest JSON nesting accepted when the service parses raw bodies. */
    @Min(8)
    @Max(1000)
    private int maxNestingDepth = 64;

    public DecodeOptions toDecodeOptions() {
        return DecodeOptions.builder()
                .strictExclusivity(strictExclusivity)
                .build();
    }
}
