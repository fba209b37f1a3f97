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

import java.math.BigInteger;
import java.util.Arrays;

final class Utils {
    static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Encodes a non-negative integer as exactly {@code length} big-endian bytes, left-padding with zeroes and
     * stripping the sign byte that {@link BigInteger#toByteArray()} may add.
     */
    static byte[] toUnsignedBigEndian(BigInteger value, int length) {
        require(value.signum() >= 0, "Value must be non-negative");
        var bytes = value.toByteArray();
        if (bytes.length > length && bytes[0] == 0) {
            // Remove sign byte
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        require(bytes.length <= length, "Value too large for " + length + " bytes");
        var result = new byte[length];
        System.arraycopy(bytes, 0, result, length - bytes.length, bytes.length);
        return result;
    }

    static byte[] concat(byte[]... elements) {
        int totalSize = Arrays.stream(elements).mapToInt(b -> b.length).reduce(0, Math::addExact);
        byte[] result = new byte[totalSize];
        int offset = 0;
        for (var element : elements) {
            System.arraycopy(element, 0, result, offset, element.length);
            offset += element.length;
        }
        return result;
    }

    static String hex(byte[] data) {
        var i = new BigInteger(1, data);
        return String.format("%0" + (data.length << 1) + "x", i);
    }

    static boolean allZero(byte[] data) {
        byte sum = 0;
        for (byte datum : data) {
            sum |= datum;
        }
        return sum == 0;
    }

    /**
     * Attempts to wipe any sensitive data from memory by writing zero bytes over the array contents. This is a
     * best-effort attempt to remove data from memory, because Java's garbage collector may already have copied the
     * data in the heap.
     *
     * @param sensitiveData the sensitive data to wipe. Each non-null byte array argument is overwritten with zero
     *                      bytes. Null arguments are ignored.
     */
    static void wipe(byte[]... sensitiveData) {
        for (var data : sensitiveData) {
            if (data != null) {
                Arrays.fill(data, (byte) 0);
            }
        }
    }

    private Utils() {}
}
