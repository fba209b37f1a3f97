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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.SoftAssertions.assertSoftly;

import java.util.Arrays;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import software.pando.crypto.nacl.Bytes;

public class AeadCipherTest {

    private SymmetricKey key;

    @BeforeMethod
    public void createKey() {
        var keyData = new byte[32];
        Arrays.fill(keyData, (byte) 42);
        key = SymmetricKey.of(keyData);
    }

    @DataProvider
    public Object[][] ciphers() {
        return new Object[][] {
                { AeadCipher.AES_GCM },
                { AeadCipher.CHACHA20_POLY1305 }
        };
    }

    @DataProvider
    public Object[][] ciphersAndSizes() {
        int[] sizes = { 0, 1, 15, 16, 17, 64, 1000 };
        var result = new Object[sizes.length * 2][];
        int i = 0;
        for (var size : sizes) {
            result[i++] = new Object[] { AeadCipher.AES_GCM, size };
            result[i++] = new Object[] { AeadCipher.CHACHA20_POLY1305, size };
        }
        return result;
    }

    @Test
    public void shouldHaveCorrectIdentifiers() {
        assertThat(AeadCipher.AES_GCM.getIdentifier()).isEqualTo("AES-GCM");
        assertThat(AeadCipher.CHACHA20_POLY1305.getIdentifier()).isEqualTo("ChaCha20-Poly1305");
        assertThat(AeadCipher.valueOf("AES-GCM")).isSameAs(AeadCipher.AES_GCM);
        assertThat(AeadCipher.valueOf("ChaCha20-Poly1305")).isSameAs(AeadCipher.CHACHA20_POLY1305);
        assertThat(AeadCipher.values()).contains(AeadCipher.AES_GCM, AeadCipher.CHACHA20_POLY1305);
        assertThatIllegalArgumentException().isThrownBy(() -> AeadCipher.valueOf("DES"));
    }

    @Test(dataProvider = "ciphersAndSizes")
    public void shouldRoundTrip(AeadCipher cipher, int size) throws Exception {
        var plaintext = Bytes.secureRandom(size);

        var sealed = cipher.seal(plaintext, key);

        assertThat(sealed).hasSize(cipher.nonceSizeBytes() + size + cipher.tagSizeBytes());
        assertThat(cipher.open(sealed, key)).isEqualTo(plaintext);
    }

    @Test(dataProvider = "ciphers")
    public void shouldUseTwelveByteNoncesAndSixteenByteTags(AeadCipher cipher) {
        assertThat(cipher.nonceSizeBytes()).isEqualTo(12);
        assertThat(cipher.tagSizeBytes()).isEqualTo(16);
    }

    @Test(dataProvider = "ciphers")
    public void shouldUseFreshNonceForEverySeal(AeadCipher cipher) {
        var plaintext = "hello".getBytes(UTF_8);

        var first = cipher.seal(plaintext, key);
        var second = cipher.seal(plaintext, key);

        assertThat(Arrays.copyOf(first, 12)).isNotEqualTo(Arrays.copyOf(second, 12));
        assertThat(first).isNotEqualTo(second);
    }

    @Test(dataProvider = "ciphers")
    public void shouldNotLeavePlaintextInCiphertext(AeadCipher cipher) {
        var plaintext = "a secret message that must not appear".getBytes(UTF_8);
        var sealed = cipher.seal(plaintext, key);
        var ciphertext = Arrays.copyOfRange(sealed, 12, 12 + plaintext.length);

        assertThat(ciphertext).isNotEqualTo(plaintext);
    }

    @Test(dataProvider = "ciphers")
    public void shouldDetectEverySingleBitFlip(AeadCipher cipher) {
        var sealed = cipher.seal("tamper evident".getBytes(UTF_8), key);

        assertSoftly(softly -> {
            for (int bit = 0; bit < sealed.length * 8; bit++) {
                var tampered = sealed.clone();
                tampered[bit / 8] ^= (byte) (1 << (bit % 8));
                softly.assertThatThrownBy(() -> cipher.open(tampered, key))
                        .as("bit %d", bit)
                        .isInstanceOf(AuthenticationFailedException.class);
            }
        });
    }

    @Test(dataProvider = "ciphers")
    public void shouldRejectWrongKey(AeadCipher cipher) {
        var sealed = cipher.seal("hello".getBytes(UTF_8), key);
        var otherKeyData = new byte[32];
        Arrays.fill(otherKeyData, (byte) 43);

        assertThatThrownBy(() -> cipher.open(sealed, SymmetricKey.of(otherKeyData)))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test(dataProvider = "ciphers")
    public void shouldRejectTruncatedMessages(AeadCipher cipher) {
        var sealed = cipher.seal("hello".getBytes(UTF_8), key);

        for (int length : new int[] { 0, 1, 12, 27, sealed.length - 1 }) {
            assertThatThrownBy(() -> cipher.open(Arrays.copyOf(sealed, length), key))
                    .as("length %d", length)
                    .isInstanceOf(AuthenticationFailedException.class);
        }
    }

    @Test(dataProvider = "ciphers")
    public void shouldRejectExtendedMessages(AeadCipher cipher) {
        var sealed = cipher.seal("hello".getBytes(UTF_8), key);

        assertThatThrownBy(() -> cipher.open(Arrays.copyOf(sealed, sealed.length + 1), key))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    public void shouldNotOpenMessagesSealedWithTheOtherAlgorithm() {
        var sealed = AeadCipher.AES_GCM.seal("hello".getBytes(UTF_8), key);

        assertThatThrownBy(() -> AeadCipher.CHACHA20_POLY1305.open(sealed, key))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test(dataProvider = "ciphers")
    public void shouldRejectDestroyedKeys(AeadCipher cipher) {
        key.destroy();

        assertThatIllegalArgumentException().isThrownBy(() -> cipher.seal(new byte[1], key))
                .withMessage("Key has been destroyed");
    }

    @Test(dataProvider = "ciphers")
    public void shouldNotDestroyCallersKey(AeadCipher cipher) throws Exception {
        var sealed = cipher.seal("hello".getBytes(UTF_8), key);
        cipher.open(sealed, key);

        assertThat(key.isDestroyed()).isFalse();
    }
}
