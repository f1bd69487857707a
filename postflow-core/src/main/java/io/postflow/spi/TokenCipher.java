package io.postflow.spi;

/**
 * Symmetric encryption for tokens at rest.
 */
public interface TokenCipher {

    String encrypt(String plaintext);

    /**
     * @throws IllegalStateException if the ciphertext is corrupt or was encrypted with another key
     */
    String decrypt(String ciphertext);
}
