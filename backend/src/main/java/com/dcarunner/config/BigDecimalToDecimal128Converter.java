package com.dcarunner.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Writes prices and percentages as Decimal128.
 * Oracle prices and premium ratios can carry more than the 34 significant digits Decimal128 holds, so the value is
 * rounded half-even to that precision first instead of failing the record write.
 */
@WritingConverter
public class BigDecimalToDecimal128Converter implements Converter<BigDecimal, Decimal128> {

    @Override
    public Decimal128 convert(BigDecimal source) {
        if (source.precision() > MathContext.DECIMAL128.getPrecision()) {
            source = source.round(MathContext.DECIMAL128);
        }
        return new Decimal128(source);
    }
}
