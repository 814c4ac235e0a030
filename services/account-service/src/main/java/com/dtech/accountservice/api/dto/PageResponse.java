package com.dtech.accountservice.api.dto;

import com.dtech.accountservice.domain.Page;
import java.util.List;
import java.util.function.Function;

public record PageResponse<T>(long total, List<T> data) {

    public static <S, T> PageResponse<T> of(Page<S> page, Function<S, T> mapper) {
        return new PageResponse<>(page.total(), page.items().stream().map(mapper).toList());
    }
}
