package com.dcarunner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * Mongo mapping for the job and execution-record collections.
 * <p>
 * {@code ExecutionRecord.referencePriceUsd}, {@code ExecutionRecord.annualizedPremiumPct} and the options
 * thresholds on {@code OptionsTradeParams} are stored as Decimal128 so that history queries compare them
 * numerically. Token amounts never pass through here: they are persisted as decimal strings.
 * Indexes (due-job lookup, unique tx hash) come from the annotations on the documents.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(
                new BigDecimalToDecimal128Converter(),
                new Decimal128ToBigDecimalConverter()));
    }
}
