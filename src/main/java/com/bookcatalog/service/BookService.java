package com.bookcatalog.service;

import com.bookcatalog.dto.request.BookForm;
import com.bookcatalog.dto.response.BookResponse;
import com.bookcatalog.dto.response.PagedResponse;
import com.bookcatalog.entity.Book;
import com.bookcatalog.mapper.BookMapper;
import com.bookcatalog.repository.BookRepository;
import com.bookcatalog.repository.SortColumn;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class BookService {

    private final BookRepository bookRepository;

    @Transactional(readOnly = true)
    public Optional<BookResponse> findById(Long id) {
        return bookRepository.findById(id).map(BookMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public PagedResponse<BookResponse> list(int page, int pageSize, int orderBy, String filter) {
        // Checked here: the repository proxy would rethrow these as InvalidDataAccessApiUsageException
        if (page < 0) {
            throw new IllegalArgumentException("Page must be >= 0, got " + page);
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be > 0, got " + pageSize);
        }
        SortColumn.fromIndex(orderBy);
        return bookRepository.list(page, pageSize, orderBy, filter)
            .map(BookMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public List<BookResponse> findAll() {
        return bookRepository.findAllByOrderByNameAsc().stream()
            .map(BookMapper::toResponse)
            .toList();
    }

    @Transactional
    public int update(Long id, BookForm form) {
        return bookRepository.updateById(id, form.getName(), form.getAuthor(),
                                         form.getPublishDate(), form.getDescription());
    }

    @Transactional
    public Optional<Long> insert(BookForm form) {
        Book saved = bookRepository.save(BookMapper.toEntity(form));
        return Optional.ofNullable(saved.getId());
    }

    @Transactional
    public int delete(Long id) {
        return bookRepository.deleteByIdReturningCount(id);
    }
}
