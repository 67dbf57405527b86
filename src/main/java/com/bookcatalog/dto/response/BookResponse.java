package com.bookcatalog.dto.response;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

public record BookResponse(
    Long id,
    String name,
    String author,
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate publishDate,
    String description
) {}
