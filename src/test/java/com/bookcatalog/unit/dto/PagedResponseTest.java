package com.bookcatalog.unit.dto;

import com.bookcatalog.dto.response.PagedResponse;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PagedResponseTest {

    @Test
    void firstPage_hasNoPrevious() {
        PagedResponse<String> page = new PagedResponse<>(List.of("a", "b"), 0, 0, 5);

        assertThat(page.prev()).isEmpty();
        assertThat(page.next()).contains(1);
    }

    @Test
    void middlePage_hasBothNeighbours() {
        PagedResponse<String> page = new PagedResponse<>(List.of("c", "d"), 1, 2, 5);

        assertThat(page.prev()).contains(0);
        assertThat(page.next()).contains(2);
    }

    @Test
    void lastPage_hasNoNext() {
        PagedResponse<String> page = new PagedResponse<>(List.of("e"), 2, 4, 5);

        assertThat(page.prev()).contains(1);
        assertThat(page.next()).isEmpty();
    }

    @Test
    void pageBeyondTheEnd_isEmptyWithPreviousOnly() {
        // five matches, page size ten, second page requested
        PagedResponse<String> page = new PagedResponse<>(Collections.emptyList(), 1, 10, 5);

        assertThat(page.items()).isEmpty();
        assertThat(page.total()).isEqualTo(5);
        assertThat(page.prev()).contains(0);
        assertThat(page.next()).isEmpty();
    }

    @Test
    void map_keepsPagingFields() {
        PagedResponse<Integer> lengths = new PagedResponse<>(List.of("Dune", "Emma"), 3, 6, 20)
            .map(String::length);

        assertThat(lengths.items()).containsExactly(4, 4);
        assertThat(lengths.page()).isEqualTo(3);
        assertThat(lengths.offset()).isEqualTo(6);
        assertThat(lengths.total()).isEqualTo(20);
    }

    @Test
    void negativeFields_areRejected() {
        assertThatThrownBy(() -> new PagedResponse<>(List.of(), -1, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PagedResponse<>(List.of(), 0, 0, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
