package com.biblioteca.backend.support;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicInteger;

import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.domain.UserRole;
import com.biblioteca.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.biblioteca.backend.modules.catalog.domain.Book;
import com.biblioteca.backend.modules.catalog.domain.BookStatus;
import com.biblioteca.backend.modules.catalog.infrastructure.persistence.BookRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final LibraryUserRepository libraryUserRepository;
    private final BookRepository bookRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public TestUserFactory(
            LibraryUserRepository libraryUserRepository,
            BookRepository bookRepository,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.libraryUserRepository = libraryUserRepository;
        this.bookRepository = bookRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    public LibraryUser createUser(String email, String rawPassword, UserRole role) {
        int n = SEQUENCE.incrementAndGet();
        LibraryUser user = new LibraryUser();
        user.setFirstName("Nombre" + n);
        user.setLastName("Apellido" + n);
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setAge(30);
        user.setIdentityNumber("0801-" + n);
        user.setPhone("9999-" + n);
        user.setRole(role);
        user.setActive(true);
        user.setFines(BigDecimal.ZERO.setScale(2));
        user.setRegisteredAt(OffsetDateTime.now(clock));
        return libraryUserRepository.save(user);
    }

    public LibraryUser createPatron(String email, String rawPassword) {
        return createUser(email, rawPassword, UserRole.USUARIO);
    }

    public LibraryUser createLibrarian(String email, String rawPassword) {
        return createUser(email, rawPassword, UserRole.BIBLIOTECARIO);
    }

    public LibraryUser createAdmin(String email, String rawPassword) {
        return createUser(email, rawPassword, UserRole.ADMIN);
    }

    public LibraryUser setFines(Long userId, String amount) {
        LibraryUser user = libraryUserRepository.findById(userId).orElseThrow();
        user.setFines(new BigDecimal(amount));
        return user;
    }

    public LibraryUser setActive(Long userId, boolean active) {
        LibraryUser user = libraryUserRepository.findById(userId).orElseThrow();
        user.setActive(active);
        return user;
    }

    public Book createBook(String title, int totalCopies, int availableCopies) {
        int n = SEQUENCE.incrementAndGet();
        Book book = new Book();
        book.setTitle(title);
        book.setAuthor("Autor " + n);
        book.setIsbn("978-" + n);
        book.setCategory("Novela");
        book.setPublisher("Editorial " + n);
        book.setPublicationYear(2001);
        book.setLocation("Estante " + n);
        book.setAddedAt(OffsetDateTime.now(clock));
        book.setStatus(BookStatus.DISPONIBLE);
        book.changeCopies(totalCopies, availableCopies);
        return bookRepository.save(book);
    }

    public Book findBook(Long bookId) {
        return bookRepository.findById(bookId).orElseThrow();
    }

    public LibraryUser findUser(Long userId) {
        return libraryUserRepository.findById(userId).orElseThrow();
    }
}
