package com.bookcatalog.unit.repository;

import com.bookcatalog.repository.SortColumn;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SortColumnTest {

    @Test
    void fromIndex_mapsTablePositions() {
        assertThat(SortColumn.fromIndex(1)).isEqualTo(SortColumn.ID);
        assertThat(SortColumn.fromIndex(2)).isEqualTo(SortColumn.NAME);
        assertThat(SortColumn.fromIndex(-3)).isEqualTo(SortColumn.AUTHOR);
        assertThat(SortColumn.fromIndex(4).columnName()).isEqualTo("publish_date");
    }

    @Test
    void orderByClause_ascendingPutsNullsLastAndBreaksTiesById() {
        assertThat(SortColumn.orderByClause(2)).isEqualTo("name ASC NULLS LAST, id ASC");
    }

    @Test
    void orderByClause_negativeIndexSortsDescending() {
        assertThat(SortColumn.orderByClause(-4)).isEqualTo("publish_date DESC NULLS LAST, id ASC");
        assertThat(SortColumn.orderByClause(-1)).isEqualTo("id DESC");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 6, -6, 42, Integer.MIN_VALUE})
    void fromIndex_rejectsPositionsOutsideTheTable(int orderBy) {
        assertThatThrownBy(() -> SortColumn.fromIndex(orderBy))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unsupported orderBy");
    }
}
