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

import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.interfaces.ECPrivateKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Arrays;

import javax.crypto.KeyAgreement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.securecomms.MalformedKeyException;
import io.securecomms.P256PublicKey;
import io.securecomms.PublicKeyEncoding;
import io.securecomms.StorageFailureException;

import software.pando.crypto.nacl.Bytes;

/**
 * A {@link HardwareKeyProvider} that keeps P-256 keys in process memory using the JCA {@code EC} and {@code ECDH}
 * algorithms. There is no root of trust: the persistent reference of each handle contains the private key in PKCS#8
 * form, so anyone who can read the {@link KeyStorage} can recover it. Use it for tests and on hosts that have no
 * secure enclave or HSM.
 * <p>
 * The persistent reference is laid out as a version byte, the 65-byte X9.63 public key, then the PKCS#8 private key.
 */
public final class SoftwareKeyProvider implements HardwareKeyProvider {
    private static final Logger logger = LoggerFactory.getLogger(SoftwareKeyProvider.class);
    private static final byte VERSION = 1;
    private static final int PUBLIC_KEY_OFFSET = 1;
    private static final int PRIVATE_KEY_OFFSET = PUBLIC_KEY_OFFSET + 65;

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public KeyHandle generate() {
        var handle = newHandle();
        logger.debug("Generated new software P-256 key {}", handle.publicKey);
        return handle;
    }

    private static SoftwareKeyHandle newHandle() {
        try {
            var generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec("secp256r1"));
            var keyPair = generator.generateKeyPair();
            var publicKey = P256PublicKey.fromJavaKey(keyPair.getPublic());
            return new SoftwareKeyHandle((ECPrivateKey) keyPair.getPrivate(), publicKey);
        } catch (NoSuchAlgorithmException | InvalidAlgorithmParameterException e) {
            throw new AssertionError("JVM doesn't support P-256 key generation", e);
        } catch (MalformedKeyException e) {
            throw new IllegalStateException("JVM generated an invalid P-256 key", e);
        }
    }

    @Override
    public KeyHandle load(byte[] persistentReference) throws StorageFailureException {
        requireNonNull(persistentReference, "persistentReference");
        if (persistentReference.length <= PRIVATE_KEY_OFFSET || persistentReference[0] != VERSION) {
            throw new StorageFailureException("Unrecognised software key reference");
        }
        P256PublicKey publicKey;
        PrivateKey privateKey;
        var pkcs8 = Arrays.copyOfRange(persistentReference, PRIVATE_KEY_OFFSET, persistentReference.length);
        try {
            publicKey = PublicKeyEncoding.X963.decode(
                    Arrays.copyOfRange(persistentReference, PUBLIC_KEY_OFFSET, PRIVATE_KEY_OFFSET));
            privateKey = KeyFactory.getInstance("EC").generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
        } catch (MalformedKeyException e) {
            throw new StorageFailureException("Stored public key is corrupt", e);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("JVM doesn't support EC keys", e);
        } catch (InvalidKeySpecException e) {
            throw new StorageFailureException("Stored private key is corrupt", e);
        } finally {
            Arrays.fill(pkcs8, (byte) 0);
        }

        if (!(privateKey instanceof ECPrivateKey) || !((ECPrivateKey) privateKey).getParams().getCurve()
                .equals(publicKey.toJavaKey().getParams().getCurve())) {
            throw new StorageFailureException("Stored private key is not a P-256 key");
        }
        var handle = new SoftwareKeyHandle((ECPrivateKey) privateKey, publicKey);
        if (!isConsistentPair(handle)) {
            throw new StorageFailureException("Stored public key does not match the stored private key");
        }
        return handle;
    }

    /**
     * Checks that the handle's public key belongs to its private key, by running ECDH from both sides against a fresh
     * ephemeral key.
     */
    private boolean isConsistentPair(SoftwareKeyHandle handle) {
        var ephemeral = newHandle();
        var fromPrivate = deriveSharedSecret(handle, ephemeral.publicKey);
        var fromPublic = deriveSharedSecret(ephemeral, handle.publicKey);
        try {
            return Bytes.equal(fromPrivate, fromPublic);
        } finally {
            Arrays.fill(fromPrivate, (byte) 0);
            Arrays.fill(fromPublic, (byte) 0);
        }
    }

    @Override
    public P256PublicKey publicKeyOf(KeyHandle handle) {
        return checkHandle(handle).publicKey;
    }

    @Override
    public byte[] deriveSharedSecret(KeyHandle handle, P256PublicKey peerPublicKey) {
        var privateKey = checkHandle(handle).privateKey;
        requireNonNull(peerPublicKey, "peerPublicKey");
        try {
            var ecdh = KeyAgreement.getInstance("ECDH");
            ecdh.init(privateKey);
            ecdh.doPhase(peerPublicKey.toJavaKey(), true);
            return ecdh.generateSecret();
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("JVM doesn't support ECDH", e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static SoftwareKeyHandle checkHandle(KeyHandle handle) {
        if (!(requireNonNull(handle, "handle") instanceof SoftwareKeyHandle)) {
            throw new IllegalArgumentException("Handle was not issued by a SoftwareKeyProvider");
        }
        return (SoftwareKeyHandle) handle;
    }

    private static final class SoftwareKeyHandle implements KeyHandle {
        private final ECPrivateKey privateKey;
        private final P256PublicKey publicKey;

        SoftwareKeyHandle(ECPrivateKey privateKey, P256PublicKey publicKey) {
            this.privateKey = privateKey;
            this.publicKey = publicKey;
        }

        @Override
        public byte[] persistentReference() {
            var publicBytes = publicKey.encode(PublicKeyEncoding.X963);
            var privateBytes = privateKey.getEncoded();
            var reference = new byte[1 + publicBytes.length + privateBytes.length];
            reference[0] = VERSION;
            System.arraycopy(publicBytes, 0, reference, PUBLIC_KEY_OFFSET, publicBytes.length);
            System.arraycopy(privateBytes, 0, reference, PRIVATE_KEY_OFFSET, privateBytes.length);
            Arrays.fill(privateBytes, (byte) 0);
            return reference;
        }

        @Override
        public String toString() {
            return "SoftwareKeyHandle{publicKey=" + publicKey + '}';
        }
    }
}
