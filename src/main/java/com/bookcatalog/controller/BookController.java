package com.bookcatalog.controller;

import com.bookcatalog.config.CatalogProperties;
import com.bookcatalog.dto.request.BookForm;
import com.bookcatalog.dto.response.BookResponse;
import com.bookcatalog.dto.response.PagedResponse;
import com.bookcatalog.exception.ResourceNotFoundException;
import com.bookcatalog.mapper.BookMapper;
import com.bookcatalog.repository.SortColumn;
import com.bookcatalog.service.BookService;
import com.bookcatalog.service.TimeoutGuard;
import com.bookcatalog.service.cache.ListPageCache;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Controller
@RequiredArgsConstructor
public class BookController {

    private static final Logger log = LoggerFactory.getLogger(BookController.class);

    static final String HOME = "redirect:/books";
    static final String LIST_VIEW = "books/list";
    static final String CREATE_FORM = "books/createForm";
    static final String EDIT_FORM = "books/editForm";

    static final String FLASH_SUCCESS = "success";
    static final String FLASH_ERROR = "error";

    private final BookService bookService;
    private final TimeoutGuard timeoutGuard;
    private final ListPageCache listPageCache;
    private final CatalogProperties properties;

    @GetMapping("/")
    public String index() {
        return HOME;
    }

    @GetMapping("/books")
    public CompletableFuture<ModelAndView> list(@RequestParam(defaultValue = "0") int page,
                                                @RequestParam(defaultValue = "1") int orderBy,
                                                @RequestParam(defaultValue = "") String filter) {
        return timeoutGuard.supply(() -> fetchPage(page, orderBy, filter))
            .thenApply(result -> listView(result, orderBy, filter));
    }

    @GetMapping("/books/sync")
    public ModelAndView listSynchronously(@RequestParam(defaultValue = "0") int page,
                                          @RequestParam(defaultValue = "1") int orderBy,
                                          @RequestParam(defaultValue = "") String filter) {
        return listView(fetchPage(page, orderBy, filter), orderBy, filter);
    }

    @GetMapping("/books/cached/async")
    public CompletableFuture<ModelAndView> listCachedAsynchronously(@RequestParam(defaultValue = "0") int page,
                                                                    @RequestParam(defaultValue = "1") int orderBy,
                                                                    @RequestParam(defaultValue = "") String filter) {
        ListPageCache.Variant variant = ListPageCache.Variant.ASYNCHRONOUS;
        String key = ListPageCache.key(variant, page, orderBy, filter);

        Optional<PagedResponse<BookResponse>> cached = listPageCache.get(variant, key);
        CompletableFuture<PagedResponse<BookResponse>> result = cached
            .map(CompletableFuture::completedFuture)
            .orElseGet(() -> timeoutGuard.supply(() -> fetchPage(page, orderBy, filter))
                .thenApply(fresh -> {
                    listPageCache.put(variant, key, fresh);
                    return fresh;
                }));
        return result.thenApply(books -> listView(books, orderBy, filter));
    }

    @GetMapping("/books/cached/sync")
    public ModelAndView listCachedSynchronously(@RequestParam(defaultValue = "0") int page,
                                                @RequestParam(defaultValue = "1") int orderBy,
                                                @RequestParam(defaultValue = "") String filter) {
        ListPageCache.Variant variant = ListPageCache.Variant.SYNCHRONOUS;
        String key = ListPageCache.key(variant, page, orderBy, filter);

        PagedResponse<BookResponse> books = listPageCache.get(variant, key).orElseGet(() -> {
            PagedResponse<BookResponse> fresh = fetchPage(page, orderBy, filter);
            listPageCache.put(variant, key, fresh);
            return fresh;
        });
        return listView(books, orderBy, filter);
    }

    @GetMapping("/books/{id}/edit")
    public CompletableFuture<ModelAndView> edit(@PathVariable Long id) {
        return timeoutGuard.supply(() -> bookService.findById(id))
            .thenApply(found -> found
                .map(book -> new ModelAndView(EDIT_FORM)
                    .addObject("bookId", id)
                    .addObject("book", BookMapper.toForm(book)))
                .orElseThrow(() -> new ResourceNotFoundException("Book", id)));
    }

    @PostMapping("/books/{id}")
    public CompletableFuture<ModelAndView> update(@PathVariable Long id,
                                                  @Valid @ModelAttribute("book") BookForm form,
                                                  BindingResult bindingResult,
                                                  RedirectAttributes redirectAttributes) {
        if (bindingResult.hasErrors()) {
            return CompletableFuture.completedFuture(
                new ModelAndView(EDIT_FORM, HttpStatus.BAD_REQUEST).addObject("bookId", id));
        }
        return timeoutGuard.supply(() -> bookService.update(id, form))
            .thenApply(updated -> {
                if (updated > 0) {
                    listPageCache.invalidateAll();
                    redirectAttributes.addFlashAttribute(FLASH_SUCCESS,
                        "Book " + form.getName() + " has been updated");
                } else {
                    redirectAttributes.addFlashAttribute(FLASH_ERROR,
                        "Book " + form.getName() + " has not been updated");
                }
                return new ModelAndView(HOME);
            });
    }

    @GetMapping("/books/new")
    public ModelAndView create() {
        return new ModelAndView(CREATE_FORM).addObject("book", new BookForm());
    }

    @PostMapping("/books")
    public CompletableFuture<ModelAndView> save(@Valid @ModelAttribute("book") BookForm form,
                                                BindingResult bindingResult,
                                                RedirectAttributes redirectAttributes) {
        if (bindingResult.hasErrors()) {
            return CompletableFuture.completedFuture(new ModelAndView(CREATE_FORM, HttpStatus.BAD_REQUEST));
        }
        return timeoutGuard.supply(() -> bookService.insert(form))
            .thenApply(bookId -> {
                if (bookId.isPresent()) {
                    listPageCache.invalidateAll();
                    String msg = "Book " + form.getName() + " has been created";
                    log.info("{} with id {}", msg, bookId.get());
                    redirectAttributes.addFlashAttribute(FLASH_SUCCESS, msg);
                } else {
                    String msg = "Book " + form.getName() + " has not been created";
                    log.info(msg);
                    redirectAttributes.addFlashAttribute(FLASH_ERROR, msg);
                }
                return new ModelAndView(HOME);
            });
    }

    @PostMapping("/books/{id}/delete")
    public CompletableFuture<ModelAndView> delete(@PathVariable Long id,
                                                  RedirectAttributes redirectAttributes) {
        return timeoutGuard.supply(() -> bookService.delete(id))
            .thenApply(deleted -> {
                if (deleted > 0) {
                    listPageCache.invalidateAll();
                    redirectAttributes.addFlashAttribute(FLASH_SUCCESS, "Book has been deleted");
                } else {
                    redirectAttributes.addFlashAttribute(FLASH_ERROR, "Book has not been deleted");
                }
                return new ModelAndView(HOME);
            });
    }

    private PagedResponse<BookResponse> fetchPage(int page, int orderBy, String filter) {
        return bookService.list(page, properties.pageSize(), orderBy, "%" + filter + "%");
    }

    private static ModelAndView listView(PagedResponse<BookResponse> books, int orderBy, String filter) {
        return new ModelAndView(LIST_VIEW)
            .addObject("page", books)
            .addObject("orderBy", orderBy)
            .addObject("filter", filter)
            .addObject("sortColumns", SortColumn.values());
    }
}
