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

import software.pando.crypto.nacl.Bytes;

/**
 * Computes and verifies HMAC-SHA-512 authentication codes over messages, keyed by a {@link SymmetricKey}. Codes give
 * integrity and authenticity but no confidentiality.
 */
public final class MessageAuthenticator {
    private static final RedactedLogger logger = RedactedLogger.getLogger(MessageAuthenticator.class);

    /**
     * The size of an authentication code in bytes.
     */
    public static final int CODE_SIZE_BYTES = Crypto.HMAC_TAG_SIZE_BYTES;

    /**
     * Computes the authentication code for a message. The result depends only on the message and the key.
     *
     * @param message the message. May be empty.
     * @param key the key.
     * @return the 64-byte code.
     */
    public byte[] computeCode(byte[] message, SymmetricKey key) {
        requireNonNull(message, "message");
        Utils.require(!requireNonNull(key, "key").isDestroyed(), "Key has been destroyed");
        try (var macKey = key.withAlgorithm(Crypto.HMAC_ALGORITHM)) {
            return Crypto.hmac(macKey, message);
        }
    }

    /**
     * Checks an authentication code in constant time. Never throws on bad input: a code of the wrong length, a
     * missing code or message, or a destroyed key all simply fail to verify.
     *
     * @param code the code to check.
     * @param message the message it claims to authenticate.
     * @param key the key.
     * @return whether the code is valid for the message under the key.
     */
    public boolean verifyCode(byte[] code, byte[] message, SymmetricKey key) {
        if (code == null || message == null || key == null || key.isDestroyed()) {
            logger.debug("Rejecting authentication code: missing input or destroyed key");
            return false;
        }
        if (code.length != CODE_SIZE_BYTES) {
            logger.debug("Rejecting authentication code of {} bytes", code.length);
            return false;
        }
        byte[] computed;
        try {
            computed = computeCode(message, key);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // Key destroyed concurrently
            logger.debug("Rejecting authentication code: {}", e.getMessage());
            return false;
        }
        try {
            var valid = Bytes.equal(computed, code);
            if (!valid) {
                logger.debug("Authentication code mismatch");
            }
            return valid;
        } finally {
            Utils.wipe(computed);
        }
    }
}
