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

import javax.crypto.spec.GCMParameterSpec;

/**
 * AES-256 in Galois/Counter Mode with a 96-bit nonce and a 128-bit tag.
 */
final class AesGcmCipher extends AeadCipher {
    private static final int TAG_SIZE_BYTES = 16;

    @Override
    public String getIdentifier() {
        return "AES-GCM";
    }

    @Override
    public int nonceSizeBytes() {
        return 12;
    }

    @Override
    public int tagSizeBytes() {
        return TAG_SIZE_BYTES;
    }

    @Override
    String transformation() {
        return "AES/GCM/NoPadding";
    }

    @Override
    String keyAlgorithm() {
        return "AES";
    }

    @Override
    AlgorithmParameterSpec parameters(byte[] nonce) {
        return new GCMParameterSpec(TAG_SIZE_BYTES * 8, nonce);
    }
}
