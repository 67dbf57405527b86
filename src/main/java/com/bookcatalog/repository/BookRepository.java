package com.bookcatalog.repository;

import com.bookcatalog.entity.Book;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface BookRepository extends JpaRepository<Book, Long>, BookListQuery {

    List<Book> findAllByOrderByNameAsc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Book b
        SET b.name = :name, b.author = :author, b.publishDate = :publishDate, b.description = :description
        WHERE b.id = :id
        """)
    int updateById(@Param("id") Long id,
                   @Param("name") String name,
                   @Param("author") String author,
                   @Param("publishDate") LocalDate publishDate,
                   @Param("description") String description);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Book b WHERE b.id = :id")
    int deleteByIdReturningCount(@Param("id") Long id);
}
