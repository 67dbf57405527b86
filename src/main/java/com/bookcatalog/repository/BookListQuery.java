package com.bookcatalog.repository;

import com.bookcatalog.dto.response.PagedResponse;
import com.bookcatalog.entity.Book;

public interface BookListQuery {

    PagedResponse<Book> list(int page, int pageSize, int orderBy, String filter);
}
