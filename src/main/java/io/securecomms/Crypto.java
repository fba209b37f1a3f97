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

import java.security.InvalidKeyException;
import java.security.Key;
import java.security.NoSuchAlgorithmException;

import javax.crypto.Mac;

import software.pando.crypto.nacl.Bytes;

final class Crypto {
    static final String HMAC_ALGORITHM = "HmacSHA512";
    static final int HMAC_TAG_SIZE_BYTES = 64;
    static final int SYMMETRIC_KEY_SIZE_BYTES = 32;

    static byte[] hmac(Key key, byte[]... data) {
        try {
            var hmac = Mac.getInstance(HMAC_ALGORITHM);
            hmac.init(key);
            for (byte[] block : data) {
                hmac.update(block);
            }
            return hmac.doFinal();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        }
    }

    static SymmetricKey hmacKey(byte[] keyData) {
        try {
            return new SymmetricKey(HMAC_ALGORITHM, keyData);
        } finally {
            Utils.wipe(keyData);
        }
    }

    static byte[] randomBytes(int numBytes) {
        return Bytes.secureRandom(numBytes);
    }

    private Crypto() {}
}
