package com.oru.governance.normalization;

import com.oru.governance.domain.exception.MalformedQuantityException;
import com.oru.governance.domain.model.ResourceKind;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Kubernetes resource quantities into canonical units.
 *
 * GRAMMAR:
 * {@code <number>[<suffix>]} where the number is a non-negative decimal
 * with an optional exponent ({@code 1.5}, {@code .5}, {@code 2e3}) and the
 * suffix is one of {@link QuantitySuffix}.
 *
 * CANONICAL UNITS:
 * - CPU: millicores, rounded up ({@code 0.1} -> 100, {@code 1.5m} -> 2)
 * - Memory: bytes, rounded up ({@code 1Mi} -> 1048576, {@code 1.5k} -> 1500)
 */
@Component
public class ResourceQuantityParser {

    private static final Pattern QUANTITY = Pattern.compile(
            "^\\+?((?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?)([a-zA-Z]{0,2})$");

    private static final BigDecimal MILLIS_PER_CORE = BigDecimal.valueOf(1000);

    public long parseCpuMillicores(String quantity) {
        return toCanonical(parse(quantity).multiply(MILLIS_PER_CORE), quantity);
    }

    public long parseMemoryBytes(String quantity) {
        return toCanonical(parse(quantity), quantity);
    }

    public long parse(String quantity, ResourceKind kind) {
        return kind == ResourceKind.CPU ? parseCpuMillicores(quantity) : parseMemoryBytes(quantity);
    }

    /**
     * Parses {@code quantity} into a base-unit amount (cores or bytes).
     *
     * @throws MalformedQuantityException for blank, negative or unparseable input
     */
    BigDecimal parse(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            throw new MalformedQuantityException(String.valueOf(quantity), "empty quantity");
        }
        String trimmed = quantity.trim();
        if (trimmed.startsWith("-")) {
            throw new MalformedQuantityException(quantity, "negative quantity");
        }
        Matcher matcher = QUANTITY.matcher(trimmed);
        if (!matcher.matches()) {
            throw new MalformedQuantityException(quantity, "not a Kubernetes quantity");
        }

        BigDecimal number;
        try {
            number = new BigDecimal(matcher.group(1));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedQuantityException(quantity, "invalid number");
        }

        String symbol = matcher.group(2);
        BigDecimal amount = number;
        if (!symbol.isEmpty()) {
            QuantitySuffix suffix = QuantitySuffix.fromSymbol(symbol)
                    .orElseThrow(() -> new MalformedQuantityException(quantity, "unknown suffix '" + symbol + "'"));
            amount = number.multiply(suffix.getFactor());
        }
        return amount;
    }

    private static long toCanonical(BigDecimal amount, String quantity) {
        if (amount.precision() - amount.scale() > 19) {
            throw new MalformedQuantityException(quantity, "quantity too large");
        }
        try {
            return amount.setScale(0, RoundingMode.CEILING).longValueExact();
        } catch (ArithmeticException e) {
            throw new MalformedQuantityException(quantity, "quantity too large");
        }
    }
}
