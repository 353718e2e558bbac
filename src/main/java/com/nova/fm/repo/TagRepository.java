package com.nova.fm.repo;

import com.nova.fm.exception.CorruptStoreException;
import com.nova.fm.exception.TagPersistException;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, duplicate-free tags per path. Every mutation is written through before it returns.
 */
public interface TagRepository {

    List<String> get(Path path);

    void add(Path path, String tag) throws TagPersistException;

    void remove(Path path, String tag) throws TagPersistException;

    void set(Path path, List<String> tags) throws TagPersistException;

    void move(Path from, Path to) throws TagPersistException;

    Set<String> paths();

    /** Problem met while loading, if the stored document had to be discarded. */
    Optional<CorruptStoreException> loadFailure();
}
