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

import static io.securecomms.Crypto.HMAC_TAG_SIZE_BYTES;
import static io.securecomms.Crypto.hmac;
import static io.securecomms.Crypto.hmacKey;

/**
 * HKDF (<a href="https://datatracker.ietf.org/doc/html/rfc5869">RFC 5869</a>) over HMAC-SHA-512.
 */
final class HKDF {
    private static final byte[] EMPTY = new byte[0];

    static SymmetricKey extract(byte[] salt, byte[] inputKeyMaterial) {
        // An absent salt is defined as HashLen zero bytes. JCA refuses empty HMAC keys, so substitute explicitly.
        var saltKey = salt.length == 0 ? new byte[HMAC_TAG_SIZE_BYTES] : salt.clone();
        try (var key = hmacKey(saltKey)) {
            return hmacKey(hmac(key, inputKeyMaterial));
        }
    }

    static byte[] expand(SymmetricKey prk, byte[] context, int outputKeySizeBytes) {
        if (outputKeySizeBytes <= 0 || outputKeySizeBytes > 255 * HMAC_TAG_SIZE_BYTES) {
            throw new IllegalArgumentException("Output size must be >= 1 and <= " + 255 * HMAC_TAG_SIZE_BYTES);
        }
        byte[] last = EMPTY;
        byte[] counter = new byte[1];
        byte[] output = new byte[outputKeySizeBytes];
        for (int i = 0; i < outputKeySizeBytes; i += HMAC_TAG_SIZE_BYTES) {
            counter[0]++;
            var next = hmac(prk, last, context, counter);
            Utils.wipe(last);
            last = next;
            System.arraycopy(last, 0, output, i, Math.min(outputKeySizeBytes - i, HMAC_TAG_SIZE_BYTES));
        }
        Utils.wipe(last);
        return output;
    }

    /**
     * Extract-then-expand into a fresh symmetric key. The input key material is not wiped; that is the caller's job.
     */
    static SymmetricKey deriveKey(byte[] inputKeyMaterial, byte[] salt, byte[] context, int outputKeySizeBytes) {
        try (var prk = extract(salt, inputKeyMaterial)) {
            var okm = expand(prk, context, outputKeySizeBytes);
            try {
                return new SymmetricKey(SymmetricKey.ALGORITHM, okm);
            } finally {
                Utils.wipe(okm);
            }
        }
    }

    private HKDF() {}
}
