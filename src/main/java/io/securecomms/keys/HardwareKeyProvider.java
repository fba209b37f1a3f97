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

package io.securecomms.keys;

import io.securecomms.HardwareUnavailableException;
import io.securecomms.P256PublicKey;
import io.securecomms.StorageFailureException;

/**
 * Generates and uses P-256 private keys bound to a hardware root of trust, such as a secure enclave or an HSM.
 * Private keys are only ever referred to through a {@link KeyHandle}.
 */
public interface HardwareKeyProvider {

    /**
     * Indicates whether the root of trust is present. Every other method fails with
     * {@link HardwareUnavailableException} when this returns false.
     */
    boolean isAvailable();

    KeyHandle generate() throws HardwareUnavailableException;

    /**
     * Recovers a handle from its {@linkplain KeyHandle#persistentReference() persistent reference}.
     *
     * @throws StorageFailureException if the reference is corrupt or does not belong to this provider.
     */
    KeyHandle load(byte[] persistentReference) throws HardwareUnavailableException, StorageFailureException;

    P256PublicKey publicKeyOf(KeyHandle handle) throws HardwareUnavailableException;

    /**
     * Performs ECDH between the private key behind the handle and the given peer public key.
     *
     * @return the x coordinate of the shared point, 32 bytes. The caller should wipe it after use.
     */
    byte[] deriveSharedSecret(KeyHandle handle, P256PublicKey peerPublicKey) throws HardwareUnavailableException;
}
