package com.bookcatalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * JPA entity representing a catalog book, one row of the {@code book} table.
 *
 * <p><strong>publish_date</strong> is a {@code TIMESTAMP} column (migration V1) read back as
 * a calendar date.
 */
@Entity
@Table(name = "book")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
public class Book {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "author", nullable = false, length = 1000)
    private String author;

    @Column(name = "publish_date", columnDefinition = "TIMESTAMP")
    private LocalDate publishDate;

    @Column(name = "description", nullable = false, length = 255)
    private String description;
}
