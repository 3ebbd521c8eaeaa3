package com.oru.governance.normalization;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Binary and decimal SI suffixes of the Kubernetes quantity grammar.
 * See k8s.io/apimachinery/pkg/api/resource.
 */
enum QuantitySuffix {
    Ki(BigDecimal.valueOf(2).pow(10)),
    Mi(BigDecimal.valueOf(2).pow(20)),
    Gi(BigDecimal.valueOf(2).pow(30)),
    Ti(BigDecimal.valueOf(2).pow(40)),
    Pi(BigDecimal.valueOf(2).pow(50)),
    Ei(BigDecimal.valueOf(2).pow(60)),
    n(new BigDecimal("1e-9")),
    u(new BigDecimal("1e-6")),
    m(new BigDecimal("1e-3")),
    k(new BigDecimal("1e3")),
    M(new BigDecimal("1e6")),
    G(new BigDecimal("1e9")),
    T(new BigDecimal("1e12")),
    P(new BigDecimal("1e15")),
    E(new BigDecimal("1e18"));

    private static final Map<String, QuantitySuffix> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));

    private final BigDecimal factor;

    QuantitySuffix(BigDecimal factor) {
        this.factor = factor;
    }

    BigDecimal getFactor() {
        return factor;
    }

    static Optional<QuantitySuffix> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }
}
