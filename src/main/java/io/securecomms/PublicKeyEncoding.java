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

import static io.securecomms.P256PublicKey.COORDINATE_SIZE_BYTES;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;

import java.math.BigInteger;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * The interchangeable encodings of a {@link P256PublicKey}. Every encoding is lossless: decoding the output of
 * {@link #encode(P256PublicKey)} in any encoding yields a key equal to the original.
 */
public enum PublicKeyEncoding {
    /**
     * The 32-byte big-endian X coordinate followed by the 32-byte Y coordinate.
     */
    RAW {
        @Override
        public byte[] encode(P256PublicKey key) {
            return key.rawCoordinates();
        }

        @Override
        public P256PublicKey decode(byte[] encoded) throws MalformedKeyException {
            checkLength(encoded, 2 * COORDINATE_SIZE_BYTES);
            return fromRawCoordinates(encoded, 0);
        }
    },
    /**
     * The ANSI X9.63 uncompressed point: a {@code 0x04} prefix byte followed by the {@link #RAW} coordinates.
     */
    X963 {
        @Override
        public byte[] encode(P256PublicKey key) {
            return Utils.concat(new byte[] { UNCOMPRESSED_POINT }, key.rawCoordinates());
        }

        @Override
        public P256PublicKey decode(byte[] encoded) throws MalformedKeyException {
            checkLength(encoded, 1 + 2 * COORDINATE_SIZE_BYTES);
            if (encoded[0] != UNCOMPRESSED_POINT) {
                throw new MalformedKeyException("Unsupported point format: " + (encoded[0] & 0xFF));
            }
            return fromRawCoordinates(encoded, 1);
        }
    },
    /**
     * An ASN.1 DER SubjectPublicKeyInfo structure naming the prime256v1 curve and wrapping the {@link #X963} point,
     * as produced by {@link java.security.PublicKey#getEncoded()}.
     */
    DER {
        @Override
        public byte[] encode(P256PublicKey key) {
            return key.toJavaKey().getEncoded();
        }

        @Override
        public P256PublicKey decode(byte[] encoded) throws MalformedKeyException {
            requireNonNull(encoded, "encoded");
            try {
                var keyFactory = KeyFactory.getInstance("EC");
                var key = P256PublicKey.fromJavaKey(keyFactory.generatePublic(new X509EncodedKeySpec(encoded)));
                // Reject trailing garbage and non-canonical forms, otherwise encodings would not be lossless
                if (!Arrays.equals(encoded, encode(key))) {
                    throw new MalformedKeyException("Non-canonical SubjectPublicKeyInfo encoding");
                }
                return key;
            } catch (NoSuchAlgorithmException e) {
                throw new AssertionError("JVM doesn't support EC keys", e);
            } catch (InvalidKeySpecException | RuntimeException e) {
                throw new MalformedKeyException("Invalid SubjectPublicKeyInfo encoding", e);
            }
        }
    },
    /**
     * The {@link #DER} encoding in Base64, wrapped at 64 columns between {@code -----BEGIN PUBLIC KEY-----} and
     * {@code -----END PUBLIC KEY-----} lines. Encoded as US-ASCII bytes.
     */
    PEM {
        @Override
        public byte[] encode(P256PublicKey key) {
            var body = PEM_ENCODER.encodeToString(DER.encode(key));
            return (PEM_HEADER + "\n" + body + "\n" + PEM_FOOTER).getBytes(US_ASCII);
        }

        @Override
        public P256PublicKey decode(byte[] encoded) throws MalformedKeyException {
            var text = new String(requireNonNull(encoded, "encoded"), US_ASCII).strip();
            if (!text.startsWith(PEM_HEADER) || !text.endsWith(PEM_FOOTER)
                    || text.length() < PEM_HEADER.length() + PEM_FOOTER.length()) {
                throw new MalformedKeyException("Missing PEM PUBLIC KEY header or footer");
            }
            var body = text.substring(PEM_HEADER.length(), text.length() - PEM_FOOTER.length())
                    .replaceAll("\\s+", "");
            byte[] der;
            try {
                der = Base64.getDecoder().decode(body);
            } catch (IllegalArgumentException e) {
                throw new MalformedKeyException("Invalid Base64 in PEM body", e);
            }
            return DER.decode(der);
        }
    };

    private static final byte UNCOMPRESSED_POINT = 0x04;
    private static final String PEM_HEADER = "-----BEGIN PUBLIC KEY-----";
    private static final String PEM_FOOTER = "-----END PUBLIC KEY-----";
    private static final Base64.Encoder PEM_ENCODER = Base64.getMimeEncoder(64, new byte[] { '\n' });

    /**
     * Encodes the given public key.
     *
     * @param key the key to encode.
     * @return the encoded key.
     */
    public abstract byte[] encode(P256PublicKey key);

    /**
     * Decodes and validates a public key.
     *
     * @param encoded the encoded key.
     * @return the decoded key, guaranteed to be a point on P-256.
     * @throws MalformedKeyException if the encoding is structurally invalid or the point is not on the curve.
     */
    public abstract P256PublicKey decode(byte[] encoded) throws MalformedKeyException;

    private static void checkLength(byte[] encoded, int expected) throws MalformedKeyException {
        if (requireNonNull(encoded, "encoded").length != expected) {
            throw new MalformedKeyException("Expected " + expected + " bytes, got " + encoded.length);
        }
    }

    private static P256PublicKey fromRawCoordinates(byte[] encoded, int offset) throws MalformedKeyException {
        var x = new BigInteger(1, Arrays.copyOfRange(encoded, offset, offset + COORDINATE_SIZE_BYTES));
        var y = new BigInteger(1, Arrays.copyOfRange(encoded, offset + COORDINATE_SIZE_BYTES,
                offset + 2 * COORDINATE_SIZE_BYTES));
        return P256PublicKey.fromCoordinates(x, y);
    }
}
