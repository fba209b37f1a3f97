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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.Base64;

/**
 * Utilities for carrying binary messages as text: standard Base64 for sealed messages and authentication codes, and
 * strict UTF-8 for plaintexts. Failures are reported as {@link EncodingFailureException}, kept apart from
 * cryptographic failures.
 */
public final class TextEncoding {
    private static final Base64.Encoder ENCODER = Base64.getEncoder();
    private static final Base64.Decoder DECODER = Base64.getDecoder();

    /**
     * Encodes the given data as a standard Base64 string, with padding.
     *
     * @param data the binary data to encode.
     * @return the base64 encoding of the data.
     */
    public static String encode(byte[] data) {
        return ENCODER.encodeToString(requireNonNull(data, "data"));
    }

    /**
     * Decodes some standard Base64-encoded data, returning the decoded data.
     *
     * @param encoded the encoded data to decode.
     * @return the decoded data.
     * @throws EncodingFailureException if the encoded data is not valid.
     */
    public static byte[] decode(String encoded) throws EncodingFailureException {
        try {
            return DECODER.decode(requireNonNull(encoded, "encoded"));
        } catch (IllegalArgumentException e) {
            throw new EncodingFailureException("Invalid Base64 data", e);
        }
    }

    /**
     * Decodes UTF-8 bytes, rejecting malformed sequences rather than substituting replacement characters.
     *
     * @param utf8 the bytes to decode.
     * @return the decoded string.
     * @throws EncodingFailureException if the bytes are not valid UTF-8.
     */
    public static String toText(byte[] utf8) throws EncodingFailureException {
        try {
            return UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(requireNonNull(utf8, "utf8")))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new EncodingFailureException("Invalid UTF-8 text", e);
        }
    }

    private TextEncoding() {}
}
