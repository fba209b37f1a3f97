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

import java.security.spec.AlgorithmParameterSpec;

import javax.crypto.spec.IvParameterSpec;

/**
 * ChaCha20-Poly1305 as specified in <a href="https://datatracker.ietf.org/doc/html/rfc8439">RFC 8439</a>, with a
 * 96-bit nonce and a 128-bit tag.
 */
final class ChaCha20Poly1305Cipher extends AeadCipher {

    @Override
    public String getIdentifier() {
        return "ChaCha20-Poly1305";
    }

    @Override
    public int nonceSizeBytes() {
        return 12;
    }

    @Override
    public int tagSizeBytes() {
        return 16;
    }

    @Override
    String transformation() {
        return "ChaCha20-Poly1305";
    }

    @Override
    String keyAlgorithm() {
        return "ChaCha20";
    }

    @Override
    AlgorithmParameterSpec parameters(byte[] nonce) {
        return new IvParameterSpec(nonce);
    }
}
