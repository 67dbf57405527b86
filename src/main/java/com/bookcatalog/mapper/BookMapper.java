package com.bookcatalog.mapper;

import com.bookcatalog.dto.request.BookForm;
import com.bookcatalog.dto.response.BookResponse;
import com.bookcatalog.entity.Book;

public final class BookMapper {

    private BookMapper() {}

    public static Book toEntity(BookForm form) {
        Book book = new Book();
        book.setName(form.getName());
        book.setAuthor(form.getAuthor());
        book.setPublishDate(form.getPublishDate());
        book.setDescription(form.getDescription());
        return book;
    }

    public static BookResponse toResponse(Book book) {
        return new BookResponse(
            book.getId(),
            book.getName(),
            book.getAuthor(),
            book.getPublishDate(),
            book.getDescription()
        );
    }

    public static BookForm toForm(BookResponse book) {
        return new BookForm(book.name(), book.author(), book.publishDate(), book.description());
    }
}
