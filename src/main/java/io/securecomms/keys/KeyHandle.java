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

/**
 * An opaque capability referring to a private key held by a {@link HardwareKeyProvider}. The private key itself may
 * never leave the provider.
 */
public interface KeyHandle {

    /**
     * Returns a blob from which {@link HardwareKeyProvider#load(byte[])} can recover this handle. For a hardware
     * provider this is a wrapped reference that is useless outside that hardware. For a software provider it may
     * contain the private key itself.
     */
    byte[] persistentReference();
}
