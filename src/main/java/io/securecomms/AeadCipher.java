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

import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.spec.AlgorithmParameterSpec;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;

/**
 * An authenticated encryption algorithm that seals byte payloads under a {@link SymmetricKey}. A sealed message is
 * laid out as {@code nonce || ciphertext || tag} with no length prefixes; the nonce and tag sizes are fixed by the
 * algorithm, so both parties must agree on the algorithm out of band.
 * <p>
 * Nonces are drawn at random for every call to {@link #seal(byte[], SymmetricKey)}. There is no counter, so a nonce
 * repeat under the same key is only prevented with high probability. With 96-bit nonces, limit each key to well
 * under 2<sup>32</sup> messages. Keys derived with a fresh salt per conversation stay far below that.
 */
public abstract class AeadCipher {
    private static final Map<String, AeadCipher> algorithms = new ConcurrentHashMap<>();

    public static final AeadCipher AES_GCM = register(new AesGcmCipher());
    public static final AeadCipher CHACHA20_POLY1305 = register(new ChaCha20Poly1305Cipher());

    private static final RedactedLogger logger = RedactedLogger.getLogger(AeadCipher.class);

    /**
     * A short name for the algorithm, such as {@code AES-GCM}.
     */
    public abstract String getIdentifier();

    public abstract int nonceSizeBytes();

    public abstract int tagSizeBytes();

    /**
     * The JCA transformation passed to {@link Cipher#getInstance(String)}.
     */
    abstract String transformation();

    /**
     * The algorithm name the JCA provider expects on keys.
     */
    abstract String keyAlgorithm();

    abstract AlgorithmParameterSpec parameters(byte[] nonce);

    /**
     * Encrypts and authenticates a message under a fresh random nonce.
     *
     * @param plaintext the message to seal. May be empty.
     * @param key the key.
     * @return the sealed message, {@code nonce || ciphertext || tag}.
     */
    public byte[] seal(byte[] plaintext, SymmetricKey key) {
        requireNonNull(plaintext, "plaintext");
        var nonce = Crypto.randomBytes(nonceSizeBytes());
        try (var cipherKey = cipherKey(key)) {
            var cipher = cipher();
            cipher.init(Cipher.ENCRYPT_MODE, cipherKey, parameters(nonce));
            var sealed = new byte[nonce.length + plaintext.length + tagSizeBytes()];
            System.arraycopy(nonce, 0, sealed, 0, nonce.length);
            int written = cipher.doFinal(plaintext, 0, plaintext.length, sealed, nonce.length);
            assert written == plaintext.length + tagSizeBytes();
            return sealed;
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Verifies and decrypts a sealed message. No plaintext is released unless the tag verifies.
     *
     * @param sealed the sealed message, {@code nonce || ciphertext || tag}.
     * @param key the key.
     * @return the original plaintext.
     * @throws AuthenticationFailedException if the message is too short to be valid, has been tampered with, or was
     * sealed under a different key.
     */
    public byte[] open(byte[] sealed, SymmetricKey key) throws AuthenticationFailedException {
        requireNonNull(sealed, "sealed");
        if (sealed.length < nonceSizeBytes() + tagSizeBytes()) {
            logger.debug("Rejecting {}-byte {} message: shorter than nonce and tag", sealed.length, getIdentifier());
            throw new AuthenticationFailedException("Sealed message is truncated");
        }
        var nonce = Arrays.copyOf(sealed, nonceSizeBytes());
        try (var cipherKey = cipherKey(key)) {
            var cipher = cipher();
            cipher.init(Cipher.DECRYPT_MODE, cipherKey, parameters(nonce));
            return cipher.doFinal(sealed, nonce.length, sealed.length - nonce.length);
        } catch (AEADBadTagException e) {
            logger.debug("Authentication tag mismatch for {} message", getIdentifier());
            throw new AuthenticationFailedException("Sealed message failed authentication", e);
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    private SymmetricKey cipherKey(SymmetricKey key) {
        Utils.require(!requireNonNull(key, "key").isDestroyed(), "Key has been destroyed");
        Utils.require(key.size() == Crypto.SYMMETRIC_KEY_SIZE_BYTES,
                "Key must be " + Crypto.SYMMETRIC_KEY_SIZE_BYTES + " bytes");
        return key.withAlgorithm(keyAlgorithm());
    }

    private Cipher cipher() {
        try {
            return Cipher.getInstance(transformation());
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new AssertionError("JVM doesn't support " + transformation(), e);
        }
    }

    static AeadCipher register(AeadCipher algorithm) {
        var previous = algorithms.putIfAbsent(algorithm.getIdentifier(), algorithm);
        return previous != null ? previous : algorithm;
    }

    public static AeadCipher valueOf(String identifier) {
        var algorithm = algorithms.get(requireNonNull(identifier, "identifier"));
        if (algorithm == null) {
            throw new IllegalArgumentException("Unknown AEAD algorithm: " + identifier);
        }
        return algorithm;
    }

    public static AeadCipher[] values() {
        return algorithms.values().toArray(AeadCipher[]::new);
    }

    @Override
    public String toString() {
        return getIdentifier();
    }
}
