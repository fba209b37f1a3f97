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

import java.security.Key;
import java.util.Arrays;
import java.util.Objects;

import io.securecomms.keys.KeyHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around an slf4j logger that redacts certain types of arguments to prevent them being leaked in log
 * files. Key handles are never printed. Byte arrays and {@link Key} objects are reduced to a short fingerprint of
 * their first and last bytes, or to {@code <redacted>} when they are too short for that to be safe.
 */
final class RedactedLogger {
    private final Logger realLogger;

    private RedactedLogger(Logger realLogger) {
        this.realLogger = Objects.requireNonNull(realLogger);
    }

    static RedactedLogger getLogger(Class<?> forClass) {
        return new RedactedLogger(LoggerFactory.getLogger(forClass));
    }

    void trace(String format, Object... args) {
        if (realLogger.isTraceEnabled()) {
            realLogger.trace(format, redactAll(args));
        }
    }

    void debug(String format, Object... args) {
        if (realLogger.isDebugEnabled()) {
            realLogger.debug(format, redactAll(args));
        }
    }

    void info(String format, Object... args) {
        if (realLogger.isInfoEnabled()) {
            realLogger.info(format, redactAll(args));
        }
    }

    private static Object redact(Object arg) {
        if (arg instanceof byte[]) {
            return maskForLog((byte[]) arg);
        } else if (arg instanceof Key) {
            var key = (Key) arg;
            if (key instanceof SymmetricKey && ((SymmetricKey) key).isDestroyed()) {
                return "<destroyed>";
            }
            return maskForLog(key.getEncoded());
        } else if (arg instanceof KeyHandle) {
            return "<key handle>";
        } else {
            return arg;
        }
    }

    private static Object[] redactAll(Object[] args) {
        // A trailing Throwable is passed through untouched so slf4j still prints the stack trace
        return Arrays.stream(args).map(RedactedLogger::redact).toArray();
    }

    static String maskForLog(byte[] secret) {
        return secret == null
                ? "null"
                : secret.length < 16
                ? "<redacted>"
                : Utils.hex(Arrays.copyOf(secret, 3)) + "..." +
                Utils.hex(Arrays.copyOfRange(secret, secret.length-3, secret.length));
    }
}
