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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;
import java.util.UUID;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import io.securecomms.keys.InMemoryKeyStorage;
import io.securecomms.keys.SoftwareKeyProvider;

public class SecureChannelTest {

    private static final String SALT = "unit-test-salt";
    private static final String MESSAGE = "hello";

    private KeyAgreement alice;
    private KeyAgreement bob;

    @BeforeMethod
    public void setUp() {
        var tag = "channel." + UUID.randomUUID();
        alice = KeyAgreement.builder(new SoftwareKeyProvider(), new InMemoryKeyStorage()).tag(tag).build();
        bob = KeyAgreement.builder(new SoftwareKeyProvider(), new InMemoryKeyStorage()).tag(tag).build();
    }

    @DataProvider
    public Object[][] ciphers() {
        return new Object[][] {
                { AeadCipher.AES_GCM },
                { AeadCipher.CHACHA20_POLY1305 }
        };
    }

    @Test(dataProvider = "ciphers")
    public void shouldExchangeMessageBetweenTwoParties(AeadCipher cipher) throws Exception {
        var salt = SALT.getBytes(UTF_8);
        var message = MESSAGE.getBytes(UTF_8);

        try (var aliceKey = alice.deriveSymmetricKey(bob.localPublicKey(), salt);
             var bobKey = bob.deriveSymmetricKey(alice.localPublicKey(), salt)) {
            assertThat(aliceKey).isEqualTo(bobKey);

            var sealed = cipher.seal(message, aliceKey);
            assertThat(cipher.open(sealed, bobKey)).asString(UTF_8).isEqualTo(MESSAGE);

            var authenticator = new MessageAuthenticator();
            var code = authenticator.computeCode(message, aliceKey);
            assertThat(authenticator.verifyCode(code, message, bobKey)).isTrue();
            assertThat(authenticator.verifyCode(code, "hell".getBytes(UTF_8), bobKey)).isFalse();
        }
    }

    @Test(dataProvider = "ciphers")
    public void shouldSealForRecipientAndOpenFromSender(AeadCipher cipher) throws Exception {
        var aliceChannel = new SecureChannel(alice, cipher);
        var bobChannel = new SecureChannel(bob, cipher);
        var salt = SALT.getBytes(UTF_8);

        var sealed = aliceChannel.seal(MESSAGE.getBytes(UTF_8), bob.localPublicKey(), salt);

        assertThat(bobChannel.open(sealed, alice.localPublicKey(), salt)).asString(UTF_8).isEqualTo(MESSAGE);
        assertThat(aliceChannel.getCipher()).isSameAs(cipher);
    }

    @Test
    public void shouldNotOpenWithWrongSalt() throws Exception {
        var aliceChannel = new SecureChannel(alice, AeadCipher.AES_GCM);
        var bobChannel = new SecureChannel(bob, AeadCipher.AES_GCM);

        var sealed = aliceChannel.seal(MESSAGE.getBytes(UTF_8), bob.localPublicKey(), SALT.getBytes(UTF_8));

        assertThatThrownBy(() -> bobChannel.open(sealed, alice.localPublicKey(), "other-salt".getBytes(UTF_8)))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    public void shouldNotOpenAfterRecipientKeyIsDeleted() throws Exception {
        var aliceChannel = new SecureChannel(alice, AeadCipher.CHACHA20_POLY1305);
        var bobChannel = new SecureChannel(bob, AeadCipher.CHACHA20_POLY1305);
        var sealed = aliceChannel.seal(MESSAGE.getBytes(UTF_8), bob.localPublicKey(), SALT.getBytes(UTF_8));

        bob.deleteLocalKey();

        assertThatThrownBy(() -> bobChannel.open(sealed, alice.localPublicKey(), SALT.getBytes(UTF_8)))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    public void shouldComputeAndVerifyCodes() throws Exception {
        var aliceChannel = new SecureChannel(alice, AeadCipher.AES_GCM);
        var bobChannel = new SecureChannel(bob, AeadCipher.AES_GCM);
        var salt = SALT.getBytes(UTF_8);

        var code = aliceChannel.computeCode(MESSAGE.getBytes(UTF_8), bob.localPublicKey(), salt);

        assertThat(bobChannel.verifyCode(code, MESSAGE.getBytes(UTF_8), alice.localPublicKey(), salt)).isTrue();
        assertThat(bobChannel.verifyCode(code, "hell".getBytes(UTF_8), alice.localPublicKey(), salt)).isFalse();
        assertThat(bobChannel.verifyCode(new byte[0], MESSAGE.getBytes(UTF_8), alice.localPublicKey(), salt))
                .isFalse();
    }

    @Test(dataProvider = "ciphers")
    public void shouldExchangeTextMessages(AeadCipher cipher) throws Exception {
        var aliceChannel = new SecureChannel(alice, cipher);
        var bobChannel = new SecureChannel(bob, cipher);
        var text = "Grüße, 世界";

        var sealed = aliceChannel.sealText(text, bob.localPublicKey(), SALT);

        assertThat(Base64.getDecoder().decode(sealed)).hasSize(12 + text.getBytes(UTF_8).length + 16);
        assertThat(bobChannel.openText(sealed, alice.localPublicKey(), SALT)).isEqualTo(text);
    }

    @Test
    public void shouldComputeAndVerifyTextCodes() throws Exception {
        var aliceChannel = new SecureChannel(alice, AeadCipher.AES_GCM);
        var bobChannel = new SecureChannel(bob, AeadCipher.AES_GCM);

        var code = aliceChannel.computeTextCode(MESSAGE, bob.localPublicKey(), SALT);

        assertThat(bobChannel.verifyTextCode(code, MESSAGE, alice.localPublicKey(), SALT)).isTrue();
        assertThat(bobChannel.verifyTextCode(code, "hell", alice.localPublicKey(), SALT)).isFalse();
        assertThat(bobChannel.verifyTextCode("", MESSAGE, alice.localPublicKey(), SALT)).isFalse();
        assertThat(bobChannel.verifyTextCode("not base64!", MESSAGE, alice.localPublicKey(), SALT)).isFalse();
    }

    @Test
    public void shouldReportInvalidBase64AsEncodingFailure() throws Exception {
        var bobChannel = new SecureChannel(bob, AeadCipher.AES_GCM);

        assertThatThrownBy(() -> bobChannel.openText("%%%", alice.localPublicKey(), SALT))
                .isInstanceOf(EncodingFailureException.class);
    }

    @Test
    public void shouldReportTamperingAsAuthenticationFailureNotEncodingFailure() throws Exception {
        var aliceChannel = new SecureChannel(alice, AeadCipher.AES_GCM);
        var bobChannel = new SecureChannel(bob, AeadCipher.AES_GCM);
        var sealed = Base64.getDecoder().decode(aliceChannel.sealText(MESSAGE, bob.localPublicKey(), SALT));
        sealed[sealed.length - 1] ^= 1;
        var tampered = Base64.getEncoder().encodeToString(sealed);

        assertThatThrownBy(() -> bobChannel.openText(tampered, alice.localPublicKey(), SALT))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    public void shouldReportNonUtf8PlaintextAsEncodingFailure() throws Exception {
        var aliceChannel = new SecureChannel(alice, AeadCipher.AES_GCM);
        var bobChannel = new SecureChannel(bob, AeadCipher.AES_GCM);
        var sealed = aliceChannel.seal(new byte[] { (byte) 0xC3, (byte) 0x28 }, bob.localPublicKey(),
                SALT.getBytes(UTF_8));

        assertThatThrownBy(() -> bobChannel.openText(Base64.getEncoder().encodeToString(sealed),
                alice.localPublicKey(), SALT))
                .isInstanceOf(EncodingFailureException.class);
    }
}
