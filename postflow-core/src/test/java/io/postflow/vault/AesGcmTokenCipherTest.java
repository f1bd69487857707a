package io.postflow.vault;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AesGcmTokenCipherTest {

    private final AesGcmTokenCipher cipher = AesGcmTokenCipher.fromSecret("correct horse battery staple", "postflow");

    @Test
    void decryptsWhatItEncrypted() {
        String ciphertext = cipher.encrypt("ya29.a0AfH6SM");

        assertNotEquals("ya29.a0AfH6SM", ciphertext);
        assertEquals("ya29.a0AfH6SM", cipher.decrypt(ciphertext));
    }

    @Test
    void usesFreshIvPerEncryption() {
        assertNotEquals(cipher.encrypt("same"), cipher.encrypt("same"));
    }

    @Test
    void sameSecretAndSaltDeriveSameKey() {
        AesGcmTokenCipher other = AesGcmTokenCipher.fromSecret("correct horse battery staple", "postflow");

        assertEquals("token", other.decrypt(cipher.encrypt("token")));
    }

    @Test
    void rejectsCiphertextFromAnotherKey() {
        AesGcmTokenCipher other = AesGcmTokenCipher.fromSecret("another secret", "postflow");
        String ciphertext = cipher.encrypt("token");

        assertThrows(IllegalStateException.class, () -> other.decrypt(ciphertext));
    }

    @Test
    void rejectsTamperedOrMalformedInput() {
        assertThrows(IllegalStateException.class, () -> cipher.decrypt("not base64 !!"));
        assertThrows(IllegalStateException.class, () -> cipher.decrypt("AAAA"));
    }

    @Test
    void rejectsWrongKeyLength() {
        assertThrows(IllegalArgumentException.class, () -> new AesGcmTokenCipher(new byte[16]));
        assertThrows(IllegalArgumentException.class, () -> AesGcmTokenCipher.fromSecret("", "salt"));
    }
}
