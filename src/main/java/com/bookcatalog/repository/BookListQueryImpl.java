package com.bookcatalog.repository;

import com.bookcatalog.dto.response.PagedResponse;
import com.bookcatalog.entity.Book;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public class BookListQueryImpl implements BookListQuery {

    private final EntityManager entityManager;

    private static final String LIST_QUERY = """
        SELECT b.* FROM book b
        WHERE LOWER(b.name) LIKE LOWER(:filter)
        ORDER BY %s
        LIMIT :limit OFFSET :offset
        """;

    private static final String COUNT_QUERY = """
        SELECT COUNT(*) FROM book b
        WHERE LOWER(b.name) LIKE LOWER(:filter)
        """;

    @Override
    @SuppressWarnings("unchecked")
    public PagedResponse<Book> list(int page, int pageSize, int orderBy, String filter) {
        String orderByClause = SortColumn.orderByClause(orderBy);
        String pattern = filter != null ? filter : "%";
        long offset = (long) pageSize * page;

        Query listQ = entityManager.createNativeQuery(LIST_QUERY.formatted(orderByClause), Book.class);
        listQ.setParameter("filter", pattern);
        listQ.setParameter("limit", pageSize);
        listQ.setParameter("offset", offset);
        List<Book> books = listQ.getResultList();

        Query countQ = entityManager.createNativeQuery(COUNT_QUERY);
        countQ.setParameter("filter", pattern);
        long total = ((Number) countQ.getSingleResult()).longValue();

        return new PagedResponse<>(books, page, offset, total);
    }
}
