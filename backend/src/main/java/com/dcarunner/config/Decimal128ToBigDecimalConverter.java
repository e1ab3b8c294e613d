package com.dcarunner.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigDecimal;

/**
 * Reads stored prices and percentages back as BigDecimal. Negative zero reads as zero.
 * NaN and infinities have no BigDecimal form and are rejected rather than silently mapped.
 */
@ReadingConverter
public class Decimal128ToBigDecimalConverter implements Converter<Decimal128, BigDecimal> {

    @Override
    public BigDecimal convert(Decimal128 source) {
        if (source.isNaN() || source.isInfinite()) {
            throw new IllegalArgumentException("Stored decimal " + source + " has no numeric value");
        }
        try {
            return source.bigDecimalValue();
        } catch (ArithmeticException negativeZero) {
            // the driver refuses -0 since BigDecimal cannot represent it
            return BigDecimal.ZERO;
        }
    }
}
