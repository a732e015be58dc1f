package com.payment.wire.config;

import com.payment.wire.core.PaymentWireService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers {@link PaymentWireService} in applications that have this module on the classpath.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(WireCodecProperties.class)
public class WireCodecAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PaymentWireService paymentWireService(WireCodecProperties properties) {
        log.info("Payment wire codecs configured: strictExclusivity={}, maxNestingDepth={}",
                properties.isStrictExclusivity(), properties.getMaxNestingDepth());
        return new PaymentWireService(properties);
    }
}
