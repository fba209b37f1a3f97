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

import static java.util.Objects.requireNonNull;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link KeyStorage} that keeps blobs in memory for the lifetime of the instance. Blobs are copied on the way in
 * and out, so callers can wipe their own arrays.
 */
public final class InMemoryKeyStorage implements KeyStorage {
    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public void put(String tag, byte[] blob) {
        blobs.put(requireNonNull(tag, "tag"), requireNonNull(blob, "blob").clone());
    }

    @Override
    public Optional<byte[]> get(String tag) {
        return Optional.ofNullable(blobs.get(requireNonNull(tag, "tag"))).map(byte[]::clone);
    }

    @Override
    public void delete(String tag) {
        blobs.remove(requireNonNull(tag, "tag"));
    }
}
