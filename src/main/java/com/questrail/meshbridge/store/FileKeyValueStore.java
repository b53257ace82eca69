package com.questrail.meshbridge.store;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * File-backed {@link KeyValueStore}.
 *
 * <p>Layout: one directory per namespace under a root directory, one file per
 * key. Writes are staged in memory; {@link #commit()} writes each staged value
 * to a temporary file and atomically moves it over the key's file, so a crash
 * leaves either the old or the new value, never a torn one.</p>
 *
 * <p>Keys are restricted to {@code [A-Za-z0-9._-]}, must not start with a dot
 * and must not end with {@value #TEMP_SUFFIX}.</p>
 */
public final class FileKeyValueStore implements KeyValueStore
{
    static final String TEMP_SUFFIX = ".tmp";

    private final String namespace;
    private final Path directory;
    private final Map<String, byte[]> staged = new LinkedHashMap<>();

    private FileKeyValueStore(String namespace, Path directory) {
        this.namespace = namespace;
        this.directory = directory;
    }

    /**
     * Opens (creating if necessary) the namespace directory under {@code root}.
     *
     * @throws StoreException if the directory cannot be created
     */
    public static FileKeyValueStore open(Path root, String namespace) {
        Objects.requireNonNull(root, "root");
        requireValidName(namespace, "namespace");
        Path directory = root.resolve(namespace);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreException("Failed to open namespace directory " + directory, e);
        }
        return new FileKeyValueStore(namespace, directory);
    }

    @Override
    public String namespace() {
        return namespace;
    }

    @Override
    public synchronized Optional<byte[]> get(String key) {
        requireValidName(key, "key");
        byte[] pending = staged.get(key);
        if (pending != null) {
            return Optional.of(pending.clone());
        }
        try {
            return Optional.of(Files.readAllBytes(directory.resolve(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreException("Failed to read key " + key, e);
        }
    }

    @Override
    public synchronized void put(String key, byte[] value) {
        requireValidName(key, "key");
        Objects.requireNonNull(value, "value");
        staged.put(key, value.clone());
    }

    @Override
    public synchronized Set<String> keys() {
        Set<String> keys = new HashSet<>(staged.keySet());
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (!name.endsWith(TEMP_SUFFIX) && Files.isRegularFile(entry)) {
                    keys.add(name);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list namespace " + namespace, e);
        }
        return keys;
    }

    @Override
    public synchronized void commit() {
        var it = staged.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, byte[]> entry = it.next();
            Path target = directory.resolve(entry.getKey());
            Path temp = directory.resolve(entry.getKey() + TEMP_SUFFIX);
            try {
                Files.write(temp, entry.getValue());
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new StoreException("Failed to commit key " + entry.getKey(), e);
            }
            it.remove();
        }
    }

    @Override
    public synchronized void eraseAll() {
        staged.clear();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry)) {
                    Files.delete(entry);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to erase namespace " + namespace, e);
        }
    }

    private static void requireValidName(String name, String what) {
        Objects.requireNonNull(name, what);
        if (name.isEmpty() || name.startsWith(".") || name.endsWith(TEMP_SUFFIX)) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + name + "'");
        }
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            if (!ok) {
                throw new IllegalArgumentException("Invalid " + what + ": '" + name + "'");
            }
        }
    }
}
