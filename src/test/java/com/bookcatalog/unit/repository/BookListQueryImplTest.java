package com.bookcatalog.unit.repository;

import com.bookcatalog.dto.response.PagedResponse;
import com.bookcatalog.entity.Book;
import com.bookcatalog.repository.BookListQueryImpl;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookListQueryImplTest {

    @Mock
    private EntityManager entityManager;

    @Mock
    private Query listQuery;

    @Mock
    private Query countQuery;

    @InjectMocks
    private BookListQueryImpl bookListQuery;

    @Test
    void list_ordersByRequestedColumnAndAppliesOffset() {
        Book dune = new Book();
        dune.setName("Dune");
        when(entityManager.createNativeQuery(anyString(), eq(Book.class))).thenReturn(listQuery);
        when(entityManager.createNativeQuery(anyString())).thenReturn(countQuery);
        when(listQuery.getResultList()).thenReturn(List.of(dune));
        when(countQuery.getSingleResult()).thenReturn(11L);

        PagedResponse<Book> page = bookListQuery.list(1, 10, 2, "%Dune%");

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(entityManager).createNativeQuery(sql.capture(), eq(Book.class));
        assertThat(sql.getValue()).contains("ORDER BY name ASC NULLS LAST, id ASC");
        verify(listQuery).setParameter("filter", "%Dune%");
        verify(listQuery).setParameter("limit", 10);
        verify(listQuery).setParameter("offset", 10L);
        verify(countQuery).setParameter("filter", "%Dune%");

        assertThat(page.items()).containsExactly(dune);
        assertThat(page.offset()).isEqualTo(10);
        assertThat(page.total()).isEqualTo(11);
        assertThat(page.next()).isEmpty();
    }

    @Test
    void list_pastTheLastMatch_returnsEmptyPageWithTotal() {
        when(entityManager.createNativeQuery(anyString(), eq(Book.class))).thenReturn(listQuery);
        when(entityManager.createNativeQuery(anyString())).thenReturn(countQuery);
        when(listQuery.getResultList()).thenReturn(Collections.emptyList());
        when(countQuery.getSingleResult()).thenReturn(5L);

        PagedResponse<Book> page = bookListQuery.list(1, 10, 2, "%Dune%");

        assertThat(page.items()).isEmpty();
        assertThat(page.total()).isEqualTo(5);
        assertThat(page.prev()).contains(0);
        assertThat(page.next()).isEmpty();
    }

    @Test
    void list_descendingIndex_sortsDescending() {
        when(entityManager.createNativeQuery(anyString(), eq(Book.class))).thenReturn(listQuery);
        when(entityManager.createNativeQuery(anyString())).thenReturn(countQuery);
        when(listQuery.getResultList()).thenReturn(Collections.emptyList());
        when(countQuery.getSingleResult()).thenReturn(0L);

        bookListQuery.list(0, 10, -4, "%");

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(entityManager).createNativeQuery(sql.capture(), eq(Book.class));
        assertThat(sql.getValue()).contains("ORDER BY publish_date DESC NULLS LAST, id ASC");
        verify(listQuery).setParameter("offset", 0L);
    }

    @Test
    void list_withOffsetBeyondIntRange_returnsEmptyPage() {
        when(entityManager.createNativeQuery(anyString(), eq(Book.class))).thenReturn(listQuery);
        when(entityManager.createNativeQuery(anyString())).thenReturn(countQuery);
        when(listQuery.getResultList()).thenReturn(Collections.emptyList());
        when(countQuery.getSingleResult()).thenReturn(5L);

        PagedResponse<Book> page = bookListQuery.list(300_000_000, 10, 1, "%");

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(entityManager).createNativeQuery(sql.capture(), eq(Book.class));
        assertThat(sql.getValue()).contains("LIMIT :limit OFFSET :offset");
        verify(listQuery).setParameter("offset", 3_000_000_000L);
        assertThat(page.items()).isEmpty();
        assertThat(page.offset()).isEqualTo(3_000_000_000L);
        assertThat(page.total()).isEqualTo(5);
        assertThat(page.prev()).contains(299_999_999);
        assertThat(page.next()).isEmpty();
    }

    @Test
    void list_withNullFilter_matchesEverything() {
        when(entityManager.createNativeQuery(anyString(), eq(Book.class))).thenReturn(listQuery);
        when(entityManager.createNativeQuery(anyString())).thenReturn(countQuery);
        when(listQuery.getResultList()).thenReturn(Collections.emptyList());
        when(countQuery.getSingleResult()).thenReturn(0L);

        bookListQuery.list(0, 10, 1, null);

        verify(listQuery).setParameter("filter", "%");
        verify(countQuery).setParameter("filter", "%");
    }
}
