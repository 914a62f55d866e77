package dev.fathom.project;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * A source-code project registered for search.
 *
 * <p>The name is the sole external lookup key. The path is stored in canonical form (absolute,
 * normalised, symlinks resolved) so that repeated registrations and lookups compare
 * byte-for-byte. {@code lastIndexedAt} is only set by a completed semantic index run.
 *
 * <p>Maps to the {@code projects} table managed by Flyway migrations.
 *
 * @see ProjectRepository
 * @see ProjectRegistry
 */
@Entity
@Table(name = "projects")
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false)
    private String path;

    @Column(name = "last_indexed_at")
    private @Nullable Instant lastIndexedAt;

    protected Project() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a project that has never been indexed.
     *
     * @param name unique project name
     * @param path canonical absolute path of the project root
     */
    public Project(String name, String path) {
        this.name = name;
        this.path = path;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getPath() {
        return path;
    }

    public Path getRoot() {
        return Path.of(path);
    }

    public @Nullable Instant getLastIndexedAt() {
        return lastIndexedAt;
    }

    public void setLastIndexedAt(@Nullable Instant lastIndexedAt) {
        this.lastIndexedAt = lastIndexedAt;
    }
}
