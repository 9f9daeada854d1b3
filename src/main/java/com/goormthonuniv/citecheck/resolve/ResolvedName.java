package com.goormthonuniv.citecheck.resolve;

public record ResolvedName(String name, NameStrategy strategy) {
    public double confidence() {
        return strategy.confidence();
    }
}
