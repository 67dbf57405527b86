package com.bookcatalog.controller;

import com.bookcatalog.config.CatalogProperties;
import com.bookcatalog.dto.request.BookForm;
import com.bookcatalog.dto.response.BookResponse;
import com.bookcatalog.dto.response.PagedResponse;
import com.bookcatalog.exception.ResourceNotFoundException;
import com.bookcatalog.service.BookService;
import com.bookcatalog.service.cache.ListPageCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Book catalog operations")
public class BookApiController {

    private final BookService bookService;
    private final ListPageCache listPageCache;
    private final CatalogProperties properties;

    @GetMapping
    @Operation(summary = "List books", description = "One page of books whose name contains the filter, "
        + "ordered by column position 1..5 (negative for descending).")
    @ApiResponse(responseCode = "200", description = "Page returned")
    @ApiResponse(responseCode = "400", description = "Unsupported orderBy or page")
    public ResponseEntity<PagedResponse<BookResponse>> list(@RequestParam(defaultValue = "0") int page,
                                                            @RequestParam(defaultValue = "1") int orderBy,
                                                            @RequestParam(defaultValue = "") String filter) {
        return ResponseEntity.ok(bookService.list(page, properties.pageSize(), orderBy, "%" + filter + "%"));
    }

    @GetMapping("/all")
    @Operation(summary = "List every book ordered by name")
    public ResponseEntity<List<BookResponse>> findAll() {
        return ResponseEntity.ok(bookService.findAll());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get book by ID")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(bookService.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id)));
    }

    @PostMapping
    @Operation(summary = "Create a new book", description = "Name, author and description are required; "
        + "publishDate uses yyyy-MM-dd.")
    @ApiResponse(responseCode = "201", description = "Book created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    public ResponseEntity<BookResponse> create(@Valid @RequestBody BookForm form) {
        Long id = bookService.insert(form)
            .orElseThrow(() -> new IllegalStateException("Book " + form.getName() + " has not been created"));
        listPageCache.invalidateAll();
        return ResponseEntity.status(HttpStatus.CREATED).body(bookService.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id)));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a book", description = "Replaces every field of the book.")
    @ApiResponse(responseCode = "200", description = "Book updated")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> update(@PathVariable Long id, @Valid @RequestBody BookForm form) {
        if (bookService.update(id, form) == 0) {
            throw new ResourceNotFoundException("Book", id);
        }
        listPageCache.invalidateAll();
        return ResponseEntity.ok(bookService.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a book")
    @ApiResponse(responseCode = "204", description = "Book deleted")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        if (bookService.delete(id) == 0) {
            throw new ResourceNotFoundException("Book", id);
        }
        listPageCache.invalidateAll();
        return ResponseEntity.noContent().build();
    }
}
