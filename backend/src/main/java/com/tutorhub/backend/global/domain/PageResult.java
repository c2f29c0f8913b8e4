package com.tutorhub.backend.global.domain;

import java.util.List;
import java.util.function.Function;

public record PageResult<T>(List<T> items, long total, int offset, int limit) {

    public PageResult {
        items = List.copyOf(items);
    }

    public <R> PageResult<R> map(Function<? super T, ? extends R> mapper) {
        return new PageResult<>(items.stream().<R>map(mapper).toList(), total, offset, limit);
    }
}
