package warehouse.bridge.session;

import io.smallrye.jwt.algorithm.SignatureAlgorithm;
import io.smallrye.jwt.build.Jwt;
import warehouse.bridge.config.ConfigurationException;

import javax.crypto.Cipher;
import javax.crypto.EncryptedPrivateKeyInfo;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.util.Base64;
import java.util.Locale;

/**
 * RSA key pair used for key-pair authentication: handed to the JDBC driver as a
 * {@link PrivateKey} and used to sign the JWTs sent to the Cortex REST endpoints.
 */
public final class KeyPairCredentials {

    private static final long JWT_LIFETIME_SECONDS = 3540;

    private final PrivateKey privateKey;
    private final PublicKey publicKey;

    private KeyPairCredentials(PrivateKey privateKey, PublicKey publicKey) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
    }

    /**
     * Load a PKCS#8 PEM key, encrypted or not.
     * @throws ConfigurationException if the file cannot be read or decrypted
     */
    public static KeyPairCredentials load(String path, String passphrase) {
        String pem;
        try {
            pem = Files.readString(Path.of(path), StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read private key file '" + path + "': " + e.getMessage(), e);
        }
        try {
            PKCS8EncodedKeySpec keySpec;
            if (pem.contains("BEGIN ENCRYPTED PRIVATE KEY")) {
                if (passphrase == null) {
                    throw new ConfigurationException("Private key '" + path + "' is encrypted but no passphrase is configured");
                }
                EncryptedPrivateKeyInfo info = new EncryptedPrivateKeyInfo(decodePem(pem, "ENCRYPTED PRIVATE KEY"));
                // PBES2 keys report their concrete algorithm through the parameters
                String algorithm = info.getAlgParameters() != null ? info.getAlgParameters().toString() : info.getAlgName();
                SecretKeyFactory factory = SecretKeyFactory.getInstance(algorithm);
                Cipher cipher = Cipher.getInstance(algorithm);
                cipher.init(Cipher.DECRYPT_MODE, factory.generateSecret(new PBEKeySpec(passphrase.toCharArray())),
                    info.getAlgParameters());
                keySpec = info.getKeySpec(cipher);
            } else if (pem.contains("BEGIN PRIVATE KEY")) {
                keySpec = new PKCS8EncodedKeySpec(decodePem(pem, "PRIVATE KEY"));
            } else {
                throw new ConfigurationException("Private key '" + path + "' must be a PKCS#8 PEM file");
            }
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            PrivateKey privateKey = keyFactory.generatePrivate(keySpec);
            if (!(privateKey instanceof RSAPrivateCrtKey)) {
                throw new ConfigurationException("Private key '" + path + "' is not an RSA key");
            }
            RSAPrivateCrtKey crt = (RSAPrivateCrtKey) privateKey;
            PublicKey publicKey = keyFactory.generatePublic(new RSAPublicKeySpec(crt.getModulus(), crt.getPublicExponent()));
            return new KeyPairCredentials(privateKey, publicKey);
        } catch (IOException | GeneralSecurityException e) {
            throw new ConfigurationException("Cannot load private key '" + path + "': " + e.getMessage(), e);
        }
    }

    public static KeyPairCredentials of(PrivateKey privateKey, PublicKey publicKey) {
        return new KeyPairCredentials(privateKey, publicKey);
    }

    private static byte[] decodePem(String pem, String label) {
        String begin = "-----BEGIN " + label + "-----";
        String end = "-----END " + label + "-----";
        int start = pem.indexOf(begin);
        int stop = pem.indexOf(end);
        if (start < 0 || stop < start) {
            throw new ConfigurationException("Malformed PEM block: " + label);
        }
        String body = pem.substring(start + begin.length(), stop).replaceAll("\\s", "");
        return Base64.getDecoder().decode(body);
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    /**
     * SHA-256 fingerprint of the public key in the form Snowflake registers it.
     */
    public String publicKeyFingerprint() {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(publicKey.getEncoded());
            return "SHA256:" + Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Signed key-pair JWT for the REST API.
     * @param account account identifier; any region suffix after the first '.' is dropped
     */
    public String createJwt(String account, String user, long nowEpochSeconds) {
        String accountName = account.split("\\.")[0].toUpperCase(Locale.ROOT);
        String qualifiedUser = accountName + "." + user.toUpperCase(Locale.ROOT);

        return Jwt.issuer(qualifiedUser + "." + publicKeyFingerprint())
            .subject(qualifiedUser)
            .issuedAt(nowEpochSeconds)
            .expiresAt(nowEpochSeconds + JWT_LIFETIME_SECONDS)
            .jws()
            .algorithm(SignatureAlgorithm.RS256)
            .sign(privateKey);
    }
}
