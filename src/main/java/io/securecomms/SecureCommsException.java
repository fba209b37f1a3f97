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

import java.security.GeneralSecurityException;

/**
 * Base class of all checked failures reported by this library. Each subclass identifies one failure kind so that
 * callers can tell a missing key apart from a forged message without parsing messages.
 */
public abstract class SecureCommsException extends GeneralSecurityException {

    protected SecureCommsException(String message) {
        super(message);
    }

    protected SecureCommsException(String message, Throwable cause) {
        super(message, cause);
    }
}
