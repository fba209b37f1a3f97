/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.securecomms.keys;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Base64;
import java.util.EnumSet;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.securecomms.StorageFailureException;

/**
 * A {@link KeyStorage} that writes each blob to its own file in a directory. The file name is the URL-safe Base64
 * encoding of the UTF-8 tag, so any tag maps to a safe file name. Writes go to a temporary file first and are then
 * moved into place, so a reader never sees a partially-written blob. On POSIX file systems new files are readable
 * only by their owner.
 */
public final class FileKeyStorage implements KeyStorage {
    private static final Logger logger = LoggerFactory.getLogger(FileKeyStorage.class);
    private static final Base64.Encoder FILE_NAME_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final String SUFFIX = ".key";

    private final Path directory;

    public FileKeyStorage(Path directory) {
        this.directory = requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void put(String tag, byte[] blob) throws StorageFailureException {
        requireNonNull(blob, "blob");
        var target = fileFor(tag);
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, ".tmp-", SUFFIX);
            restrictPermissions(tmp);
            Files.write(tmp, blob);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported in {}, falling back to plain replace", directory);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Stored {} bytes for tag {} in {}", blob.length, tag, target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageFailureException("Unable to store key blob for tag " + tag, e);
        }
    }

    @Override
    public Optional<byte[]> get(String tag) throws StorageFailureException {
        var file = fileFor(tag);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageFailureException("Unable to read key blob for tag " + tag, e);
        }
    }

    @Override
    public void delete(String tag) throws StorageFailureException {
        var file = fileFor(tag);
        try {
            if (Files.deleteIfExists(file)) {
                logger.debug("Deleted key blob for tag {}", tag);
            }
        } catch (IOException e) {
            throw new StorageFailureException("Unable to delete key blob for tag " + tag, e);
        }
    }

    private Path fileFor(String tag) {
        requireNonNull(tag, "tag");
        if (tag.isEmpty()) {
            throw new IllegalArgumentException("Tag must not be empty");
        }
        return directory.resolve(FILE_NAME_ENCODER.encodeToString(tag.getBytes(UTF_8)) + SUFFIX);
    }

    private static void restrictPermissions(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file,
                    EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE));
        } catch (UnsupportedOperationException e) {
            logger.trace("File system does not support POSIX permissions: {}", e.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Unable to clean up temporary file {}", file, e);
        }
    }
}
