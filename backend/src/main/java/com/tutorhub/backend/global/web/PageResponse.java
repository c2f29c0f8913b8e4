package com.tutorhub.backend.global.web;

import java.util.List;
import java.util.function.Function;

import com.tutorhub.backend.global.domain.PageResult;

public record PageResponse<T>(
        List<T> items,
        long total,
        int offset,
        int limit
) {

    public static <S, T> PageResponse<T> from(PageResult<S> page, Function<? super S, ? extends T> mapper) {
        List<T> items = page.items().stream().<T>map(mapper).toList();
        return new PageResponse<>(items, page.total(), page.offset(), page.limit());
    }
}
