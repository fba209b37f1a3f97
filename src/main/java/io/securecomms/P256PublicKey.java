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

import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECFieldFp;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.security.spec.InvalidKeySpecException;
import java.util.Objects;

/**
 * A public key on the NIST P-256 curve (secp256r1). Instances are immutable and always hold a point that has been
 * checked to lie on the curve, so they can be passed freely between threads and straight into ECDH. Two instances
 * are equal if they hold the same point, regardless of which {@link PublicKeyEncoding} they were decoded from.
 */
public final class P256PublicKey {
    static final String CURVE_NAME = "secp256r1";
    static final int COORDINATE_SIZE_BYTES = 32;

    private static final ECParameterSpec PARAMETERS = loadParameters();
    private static final BigInteger P = ((ECFieldFp) PARAMETERS.getCurve().getField()).getP();

    private final BigInteger x;
    private final BigInteger y;

    private P256PublicKey(BigInteger x, BigInteger y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Creates a public key from the affine coordinates of a point.
     *
     * @param x the x coordinate.
     * @param y the y coordinate.
     * @return the public key.
     * @throws MalformedKeyException if either coordinate is outside the field or the point is not on P-256.
     */
    public static P256PublicKey fromCoordinates(BigInteger x, BigInteger y) throws MalformedKeyException {
        requireNonNull(x, "x");
        requireNonNull(y, "y");
        if (x.signum() < 0 || x.compareTo(P) >= 0 || y.signum() < 0 || y.compareTo(P) >= 0) {
            throw new MalformedKeyException("Point coordinates are outside the P-256 field");
        }
        if (!isOnCurve(x, y)) {
            throw new MalformedKeyException("Point is not on the P-256 curve");
        }
        return new P256PublicKey(x, y);
    }

    /**
     * Converts a JCA public key into a P-256 public key, checking the curve parameters and the point.
     *
     * @param key the JCA key.
     * @return the public key.
     * @throws MalformedKeyException if the key is not an EC key on P-256, or its point is invalid.
     */
    public static P256PublicKey fromJavaKey(PublicKey key) throws MalformedKeyException {
        if (!(requireNonNull(key, "key") instanceof ECPublicKey)) {
            throw new MalformedKeyException("Not an EC public key: " + key.getAlgorithm());
        }
        var ecKey = (ECPublicKey) key;
        if (!isP256(ecKey.getParams())) {
            throw new MalformedKeyException("EC public key is not on the P-256 curve");
        }
        var point = ecKey.getW();
        if (ECPoint.POINT_INFINITY.equals(point)) {
            throw new MalformedKeyException("Point at infinity is not a valid public key");
        }
        return fromCoordinates(point.getAffineX(), point.getAffineY());
    }

    /**
     * Decodes a public key. Equivalent to {@link PublicKeyEncoding#decode(byte[])}.
     */
    public static P256PublicKey decode(byte[] encoded, PublicKeyEncoding encoding) throws MalformedKeyException {
        return requireNonNull(encoding, "encoding").decode(encoded);
    }

    /**
     * Encodes this public key. Equivalent to {@link PublicKeyEncoding#encode(P256PublicKey)}.
     */
    public byte[] encode(PublicKeyEncoding encoding) {
        return requireNonNull(encoding, "encoding").encode(this);
    }

    public ECPoint getPoint() {
        return new ECPoint(x, y);
    }

    /**
     * Returns this key as a JCA {@link ECPublicKey}, for use with {@link javax.crypto.KeyAgreement} or other JCA
     * APIs.
     */
    public ECPublicKey toJavaKey() {
        try {
            var keyFactory = KeyFactory.getInstance("EC");
            return (ECPublicKey) keyFactory.generatePublic(new ECPublicKeySpec(getPoint(), PARAMETERS));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("JVM doesn't support EC keys", e);
        } catch (InvalidKeySpecException e) {
            // The point was validated on construction
            throw new IllegalStateException(e);
        }
    }

    byte[] rawCoordinates() {
        return Utils.concat(
                Utils.toUnsignedBigEndian(x, COORDINATE_SIZE_BYTES),
                Utils.toUnsignedBigEndian(y, COORDINATE_SIZE_BYTES));
    }

    static ECParameterSpec parameters() {
        return PARAMETERS;
    }

    static boolean isP256(ECParameterSpec params) {
        return params != null
                && PARAMETERS.getCurve().equals(params.getCurve())
                && PARAMETERS.getGenerator().equals(params.getGenerator())
                && PARAMETERS.getOrder().equals(params.getOrder())
                && PARAMETERS.getCofactor() == params.getCofactor();
    }

    private static boolean isOnCurve(BigInteger x, BigInteger y) {
        var curve = PARAMETERS.getCurve();
        // y^2 = x^3 + ax + b (mod p)
        var lhs = y.multiply(y).mod(P);
        var rhs = x.pow(3).add(curve.getA().multiply(x)).add(curve.getB()).mod(P);
        return lhs.equals(rhs);
    }

    private static ECParameterSpec loadParameters() {
        try {
            var params = AlgorithmParameters.getInstance("EC");
            params.init(new ECGenParameterSpec(CURVE_NAME));
            return params.getParameterSpec(ECParameterSpec.class);
        } catch (GeneralSecurityException e) {
            throw new AssertionError("JVM doesn't support the P-256 curve", e);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof P256PublicKey)) { return false; }
        P256PublicKey that = (P256PublicKey) other;
        return x.equals(that.x) && y.equals(that.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        var hex = Utils.hex(Utils.toUnsignedBigEndian(x, COORDINATE_SIZE_BYTES));
        return "P256PublicKey{x=" + hex.substring(0, 16) + "...}";
    }
}
