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

package io.securecomms;

import static java.util.Objects.requireNonNull;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Objects;

import javax.crypto.SecretKey;

/**
 * A symmetric key derived from an ECDH shared secret, held as an in-memory byte array. This is similar to
 * {@link javax.crypto.spec.SecretKeySpec}, except that the {@link #destroy()} method actually works (it scrubs the
 * key material from memory). Derived keys are never persisted by this library: destroy them, or use them in a
 * try-with-resources block, once the cipher or MAC operation they were derived for has completed.
 */
public final class SymmetricKey implements SecretKey, AutoCloseable {
    static final String ALGORITHM = "HKDF-SHA512";

    private final String algorithm;
    private final byte[] keyMaterial;
    private volatile boolean destroyed = false;

    SymmetricKey(String algorithm, byte[] keyMaterial, int offset, int length) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        Objects.checkFromIndexSize(offset, length, requireNonNull(keyMaterial, "keyMaterial").length);
        this.keyMaterial = Arrays.copyOfRange(keyMaterial, offset, offset + length);
    }

    SymmetricKey(String algorithm, byte[] keyMaterial) {
        this(algorithm, keyMaterial, 0, requireNonNull(keyMaterial, "keyMaterial").length);
    }

    /**
     * Imports raw symmetric key material, for example a key agreed by some other means in a test. The array is
     * copied, so the caller should wipe its own copy afterwards.
     *
     * @param keyMaterial exactly 32 bytes of key material.
     * @return the key.
     * @throws IllegalArgumentException if the key material is not 32 bytes long or is all zero.
     */
    public static SymmetricKey of(byte[] keyMaterial) {
        Utils.require(requireNonNull(keyMaterial, "keyMaterial").length == Crypto.SYMMETRIC_KEY_SIZE_BYTES,
                "Key must be " + Crypto.SYMMETRIC_KEY_SIZE_BYTES + " bytes");
        Utils.require(!Utils.allZero(keyMaterial), "Key material has been zeroed");
        return new SymmetricKey(ALGORITHM, keyMaterial);
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        checkDestroyed();
        return keyMaterial.clone();
    }

    /**
     * Returns the length of the key material in bytes.
     */
    public int size() {
        return keyMaterial.length;
    }

    /**
     * Copies this key under a different JCA algorithm name, as some providers check the algorithm of the keys they
     * are initialised with.
     */
    SymmetricKey withAlgorithm(String algorithm) {
        checkDestroyed();
        return new SymmetricKey(algorithm, keyMaterial);
    }

    @Override
    public void destroy() {
        destroyed = true;
        Utils.wipe(keyMaterial);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public boolean equals(Object other) {
        checkDestroyed();
        if (this == other) { return true; }
        if (!(other instanceof SymmetricKey)) { return false; }
        SymmetricKey that = (SymmetricKey) other;
        return algorithm.equals(that.algorithm)
                && MessageDigest.isEqual(keyMaterial, that.keyMaterial);
    }

    @Override
    public int hashCode() {
        checkDestroyed();
        // Do not let the hash code leak key bits
        return Objects.hash(algorithm, keyMaterial.length);
    }

    @Override
    public String toString() {
        return "SymmetricKey{" +
                "algorithm='" + algorithm + '\'' +
                ", destroyed=" + destroyed +
                '}';
    }

    private void checkDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Key material has been destroyed");
        }
    }
}
