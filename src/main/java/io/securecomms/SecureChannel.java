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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * One-call helpers that derive a symmetric key with a peer and immediately use it to seal, open or authenticate a
 * message. Every call derives a fresh key and destroys it before returning, so a rotated or deleted local key takes
 * effect immediately.
 * <p>
 * The text methods carry plaintexts as UTF-8 strings and sealed messages and authentication codes as standard
 * Base64. Salts for the text methods are UTF-8 encoded.
 */
public final class SecureChannel {
    private final KeyAgreement keyAgreement;
    private final AeadCipher cipher;
    private final MessageAuthenticator authenticator = new MessageAuthenticator();

    public SecureChannel(KeyAgreement keyAgreement, AeadCipher cipher) {
        this.keyAgreement = requireNonNull(keyAgreement, "keyAgreement");
        this.cipher = requireNonNull(cipher, "cipher");
    }

    public AeadCipher getCipher() {
        return cipher;
    }

    /**
     * Seals a message for the given recipient.
     */
    public byte[] seal(byte[] plaintext, P256PublicKey recipient, byte[] salt)
            throws HardwareUnavailableException, StorageFailureException {
        requireNonNull(plaintext, "plaintext");
        try (var key = keyAgreement.deriveSymmetricKey(recipient, salt)) {
            return cipher.seal(plaintext, key);
        }
    }

    /**
     * Opens a message sealed by the given sender.
     */
    public byte[] open(byte[] sealed, P256PublicKey sender, byte[] salt)
            throws HardwareUnavailableException, StorageFailureException, AuthenticationFailedException {
        requireNonNull(sealed, "sealed");
        try (var key = keyAgreement.deriveSymmetricKey(sender, salt)) {
            return cipher.open(sealed, key);
        }
    }

    public byte[] computeCode(byte[] message, P256PublicKey peer, byte[] salt)
            throws HardwareUnavailableException, StorageFailureException {
        requireNonNull(message, "message");
        try (var key = keyAgreement.deriveSymmetricKey(peer, salt)) {
            return authenticator.computeCode(message, key);
        }
    }

    public boolean verifyCode(byte[] code, byte[] message, P256PublicKey peer, byte[] salt)
            throws HardwareUnavailableException, StorageFailureException {
        try (var key = keyAgreement.deriveSymmetricKey(peer, salt)) {
            return authenticator.verifyCode(code, message, key);
        }
    }

    public String sealText(String plaintext, P256PublicKey recipient, String salt)
            throws HardwareUnavailableException, StorageFailureException {
        requireNonNull(plaintext, "plaintext");
        return TextEncoding.encode(seal(plaintext.getBytes(UTF_8), recipient, saltBytes(salt)));
    }

    /**
     * Opens a Base64 sealed message from the given sender and decodes the plaintext as UTF-8.
     *
     * @throws EncodingFailureException if the sealed message is not valid Base64, or the plaintext is not UTF-8.
     * @throws AuthenticationFailedException if the sealed message fails authentication.
     */
    public String openText(String sealed, P256PublicKey sender, String salt)
            throws HardwareUnavailableException, StorageFailureException, AuthenticationFailedException,
            EncodingFailureException {
        var plaintext = open(TextEncoding.decode(sealed), sender, saltBytes(salt));
        try {
            return TextEncoding.toText(plaintext);
        } finally {
            Utils.wipe(plaintext);
        }
    }

    public String computeTextCode(String message, P256PublicKey peer, String salt)
            throws HardwareUnavailableException, StorageFailureException {
        requireNonNull(message, "message");
        return TextEncoding.encode(computeCode(message.getBytes(UTF_8), peer, saltBytes(salt)));
    }

    /**
     * Checks a Base64 authentication code. A code that is not valid Base64 simply fails to verify.
     */
    public boolean verifyTextCode(String code, String message, P256PublicKey peer, String salt)
            throws HardwareUnavailableException, StorageFailureException {
        if (code == null || message == null) {
            return false;
        }
        byte[] codeBytes;
        try {
            codeBytes = TextEncoding.decode(code);
        } catch (EncodingFailureException e) {
            return false;
        }
        return verifyCode(codeBytes, message.getBytes(UTF_8), peer, saltBytes(salt));
    }

    private static byte[] saltBytes(String salt) {
        return requireNonNull(salt, "salt").getBytes(UTF_8);
    }
}
