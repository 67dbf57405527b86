package com.bookcatalog.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

public record PagedResponse<T>(
    List<T> items,
    int page,
    long offset,
    long total
) {

    public PagedResponse {
        if (page < 0 || offset < 0 || total < 0) {
            throw new IllegalArgumentException(
                "page, offset and total must be >= 0 (got " + page + ", " + offset + ", " + total + ")");
        }
        items = List.copyOf(items);
    }

    @JsonProperty("prev")
    public Optional<Integer> prev() {
        return page - 1 >= 0 ? Optional.of(page - 1) : Optional.empty();
    }

    @JsonProperty("next")
    public Optional<Integer> next() {
        return offset + items.size() < total ? Optional.of(page + 1) : Optional.empty();
    }

    public <R> PagedResponse<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PagedResponse<>(mapped, page, offset, total);
    }
}
