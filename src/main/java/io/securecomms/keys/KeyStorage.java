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

import java.util.Optional;

import io.securecomms.StorageFailureException;

/**
 * Persists opaque blobs under a string tag. Implementations never interpret the blob contents: for a hardware-backed
 * key the blob is a reference to the key, never the private scalar itself.
 * <p>
 * Implementations may keep the array passed to {@link #put} and return the same array from {@link #get}. Callers
 * must not modify either.
 */
public interface KeyStorage {

    /**
     * Stores a blob under the given tag, replacing any existing blob.
     *
     * @param tag the tag.
     * @param blob the blob to store.
     * @throws StorageFailureException if the blob could not be written.
     */
    void put(String tag, byte[] blob) throws StorageFailureException;

    /**
     * Retrieves the blob stored under the given tag.
     *
     * @param tag the tag.
     * @return the blob, or an empty result if nothing is stored under that tag.
     * @throws StorageFailureException if the storage could not be read.
     */
    Optional<byte[]> get(String tag) throws StorageFailureException;

    /**
     * Deletes the blob stored under the given tag. Deleting a tag that is not present is not an error.
     *
     * @param tag the tag.
     * @throws StorageFailureException if the blob could not be deleted.
     */
    void delete(String tag) throws StorageFailureException;
}
