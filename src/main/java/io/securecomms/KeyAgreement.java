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

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import io.securecomms.keys.HardwareKeyProvider;
import io.securecomms.keys.KeyHandle;
import io.securecomms.keys.KeyStorage;

/**
 * Owns the local P-256 key agreement key and derives symmetric keys shared with a peer.
 * <p>
 * The private key lives inside a {@link HardwareKeyProvider}; only its persistent reference is written to the
 * {@link KeyStorage}, under a fixed tag. The key is created on first use if the storage holds nothing under that tag,
 * and loaded again from storage on every later use. Deleting it with {@link #deleteLocalKey()} changes the local
 * identity: the next operation creates a new key.
 * <p>
 * A symmetric key is derived by performing ECDH between the local private key and the peer's public key, then
 * applying HKDF-SHA-512 to the shared secret with the agreed salt and empty context info, producing 32 bytes. Both
 * parties derive the same key when each uses its own private key and the other's public key with the same salt.
 * Derived keys are never cached.
 * <p>
 * Instances are thread-safe. Key creation is serialized per storage tag across every instance in the JVM, so
 * concurrent first use creates exactly one key. The lock for a tag is kept for the life of the JVM once that tag has
 * been used, so an application that uses an unbounded number of distinct tags grows this table without limit.
 */
public final class KeyAgreement {
    /**
     * The tag used when none is configured.
     */
    public static final String DEFAULT_TAG = "securecomms.keystore.p256.keyagreement.privatekey";

    private static final RedactedLogger logger = RedactedLogger.getLogger(KeyAgreement.class);
    private static final Map<String, ReentrantLock> CREATION_LOCKS = new ConcurrentHashMap<>();
    private static final Set<String> CREATING_TAGS = ConcurrentHashMap.newKeySet();
    private static final byte[] EMPTY_CONTEXT = new byte[0];

    /**
     * The lifecycle of the local private key.
     */
    public enum KeyState {
        /**
         * Nothing is stored under the tag. The next operation creates a key.
         */
        ABSENT,
        /**
         * Some thread is generating and storing a key.
         */
        CREATING,
        /**
         * A key reference is stored under the tag.
         */
        PRESENT
    }

    private final HardwareKeyProvider provider;
    private final KeyStorage storage;
    private final String tag;

    private KeyAgreement(Builder builder) {
        this.provider = builder.provider;
        this.storage = builder.storage;
        this.tag = builder.tag;
    }

    public static Builder builder(HardwareKeyProvider provider, KeyStorage storage) {
        return new Builder(provider, storage);
    }

    public String getTag() {
        return tag;
    }

    /**
     * Returns the local public key, creating the key pair if necessary.
     *
     * @throws HardwareUnavailableException if the key provider has no root of trust.
     * @throws StorageFailureException if the stored key reference cannot be read or written.
     */
    public P256PublicKey localPublicKey() throws HardwareUnavailableException, StorageFailureException {
        return provider.publicKeyOf(localKey());
    }

    /**
     * Returns the local public key in the given encoding, creating the key pair if necessary. This is the value to
     * publish to peers.
     *
     * @param encoding the encoding.
     * @return the encoded public key.
     * @throws HardwareUnavailableException if the key provider has no root of trust.
     * @throws StorageFailureException if the stored key reference cannot be read or written.
     */
    public byte[] localPublicKey(PublicKeyEncoding encoding)
            throws HardwareUnavailableException, StorageFailureException {
        requireNonNull(encoding, "encoding");
        return localPublicKey().encode(encoding);
    }

    /**
     * Decodes and validates a peer's public key.
     *
     * @param encoded the encoded key.
     * @param encoding the encoding it is in.
     * @return the public key.
     * @throws MalformedKeyException if the encoding is invalid or the point is not on P-256.
     */
    public static P256PublicKey parsePublicKey(byte[] encoded, PublicKeyEncoding encoding)
            throws MalformedKeyException {
        return P256PublicKey.decode(encoded, encoding);
    }

    /**
     * Derives a 32-byte symmetric key shared with the given peer.
     *
     * @param peerPublicKey the peer's public key.
     * @param salt the salt agreed with the peer. It need not be secret, and may be empty.
     * @return the derived key. The caller should destroy it once it has been used.
     * @throws HardwareUnavailableException if the key provider has no root of trust.
     * @throws StorageFailureException if the stored key reference cannot be read or written.
     */
    public SymmetricKey deriveSymmetricKey(P256PublicKey peerPublicKey, byte[] salt)
            throws HardwareUnavailableException, StorageFailureException {
        requireNonNull(peerPublicKey, "peerPublicKey");
        requireNonNull(salt, "salt");
        var handle = localKey();
        var sharedSecret = provider.deriveSharedSecret(handle, peerPublicKey);
        try {
            var key = HKDF.deriveKey(sharedSecret, salt, EMPTY_CONTEXT, Crypto.SYMMETRIC_KEY_SIZE_BYTES);
            logger.trace("Derived key with peer {}: salt={}, ss={}, key={}", peerPublicKey, salt, sharedSecret, key);
            return key;
        } finally {
            Utils.wipe(sharedSecret);
        }
    }

    /**
     * Deletes the stored key reference. The next operation that needs the local key creates a new one, with a
     * different public key.
     *
     * @throws StorageFailureException if the reference could not be deleted.
     */
    public void deleteLocalKey() throws StorageFailureException {
        var lock = creationLock();
        lock.lock();
        try {
            storage.delete(tag);
            logger.info("Deleted local key agreement key stored under tag {}", tag);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports the current state of the local key.
     *
     * @throws StorageFailureException if the storage cannot be read.
     */
    public KeyState keyState() throws StorageFailureException {
        if (CREATING_TAGS.contains(tag)) {
            return KeyState.CREATING;
        }
        return storage.get(tag).isPresent() ? KeyState.PRESENT : KeyState.ABSENT;
    }

    private KeyHandle localKey() throws HardwareUnavailableException, StorageFailureException {
        if (!provider.isAvailable()) {
            throw new HardwareUnavailableException("No hardware root of trust available for key " + tag);
        }

        var stored = storage.get(tag);
        if (stored.isPresent()) {
            return load(stored.get());
        }

        var lock = creationLock();
        lock.lock();
        try {
            // Another thread may have created the key while we waited
            stored = storage.get(tag);
            if (stored.isPresent()) {
                return load(stored.get());
            }

            CREATING_TAGS.add(tag);
            try {
                var handle = provider.generate();
                // The storage may keep this array, so it is not wiped here
                storage.put(tag, handle.persistentReference());
                logger.info("Created new key agreement key {} under tag {}", provider.publicKeyOf(handle), tag);
                return handle;
            } finally {
                CREATING_TAGS.remove(tag);
            }
        } finally {
            lock.unlock();
        }
    }

    private KeyHandle load(byte[] stored) throws HardwareUnavailableException, StorageFailureException {
        // The storage owns the array it returned, so only a private copy is wiped
        var reference = stored.clone();
        try {
            var handle = provider.load(reference);
            logger.debug("Loaded key agreement key stored under tag {}", tag);
            return handle;
        } finally {
            Utils.wipe(reference);
        }
    }

    private ReentrantLock creationLock() {
        return CREATION_LOCKS.computeIfAbsent(tag, t -> new ReentrantLock());
    }

    @Override
    public String toString() {
        return "KeyAgreement{tag='" + tag + "', provider=" + provider.getClass().getSimpleName() + '}';
    }

    public static final class Builder {
        private final HardwareKeyProvider provider;
        private final KeyStorage storage;
        private String tag = DEFAULT_TAG;

        private Builder(HardwareKeyProvider provider, KeyStorage storage) {
            this.provider = requireNonNull(provider, "provider");
            this.storage = requireNonNull(storage, "storage");
        }

        /**
         * Sets the tag under which the key reference is stored. Instances sharing a storage and a tag share a key.
         */
        public Builder tag(String tag) {
            Utils.require(!requireNonNull(tag, "tag").isBlank(), "Tag must not be blank");
            this.tag = tag;
            return this;
        }

        public KeyAgreement build() {
            return new KeyAgreement(this);
        }
    }
}
