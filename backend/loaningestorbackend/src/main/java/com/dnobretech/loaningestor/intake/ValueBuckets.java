package com.dnobretech.loaningestor.intake;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Resultado da classificação de uma linha: valores normalizados por balde, em ordem de entrada. */
public class ValueBuckets {

    private final Map<ValueBucket, List<String>> values = new EnumMap<>(ValueBucket.class);
    private final List<Long> numbers = new ArrayList<>();

    void add(ValueBucket bucket, String value) {
        values.computeIfAbsent(bucket, b -> new ArrayList<>()).add(value);
    }

    void addNumber(String digits, long value) {
        add(ValueBucket.NUMERIC, digits);
        numbers.add(value);
    }

    public List<String> get(ValueBucket bucket) {
        return Collections.unmodifiableList(values.getOrDefault(bucket, List.of()));
    }

    public Optional<String> first(ValueBucket bucket) {
        List<String> l = values.get(bucket);
        return (l == null || l.isEmpty()) ? Optional.empty() : Optional.of(l.get(0));
    }

    public List<Long> numbers() {
        return Collections.unmodifiableList(numbers);
    }

    public int size() {
        return values.values().stream().mapToInt(List::size).sum();
    }
}
