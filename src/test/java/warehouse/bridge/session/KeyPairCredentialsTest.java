package warehouse.bridge.session;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import warehouse.bridge.config.ConfigurationException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.Signature;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class KeyPairCredentialsTest {

    private static KeyPair keyPair;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void generateKey() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        keyPair = generator.generateKeyPair();
    }

    private Path writePem(String label, byte[] der) throws Exception {
        String pem = "-----BEGIN " + label + "-----\n"
            + Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der)
            + "\n-----END " + label + "-----\n";
        Path file = tempDir.resolve("rsa_key.p8");
        Files.writeString(file, pem, StandardCharsets.US_ASCII);
        return file;
    }

    @Test
    void testLoadUnencryptedKeyAndFingerprint() throws Exception {
        Path file = writePem("PRIVATE KEY", keyPair.getPrivate().getEncoded());

        KeyPairCredentials credentials = KeyPairCredentials.load(file.toString(), null);

        String expected = "SHA256:" + Base64.getEncoder().encodeToString(
            MessageDigest.getInstance("SHA-256").digest(keyPair.getPublic().getEncoded()));
        assertEquals(expected, credentials.publicKeyFingerprint());
        assertArrayEquals(keyPair.getPrivate().getEncoded(), credentials.getPrivateKey().getEncoded());
    }

    @Test
    void testJwtClaimsAndSignature() throws Exception {
        KeyPairCredentials credentials = KeyPairCredentials.of(keyPair.getPrivate(), keyPair.getPublic());

        String jwt = credentials.createJwt("xy12345.us-east-1", "bridge_user", 1_700_000_000L);

        String[] parts = jwt.split("\\.");
        assertEquals(3, parts.length);
        Base64.Decoder decoder = Base64.getUrlDecoder();
        JsonObject header = new JsonObject(new String(decoder.decode(parts[0]), StandardCharsets.UTF_8));
        JsonObject claims = new JsonObject(new String(decoder.decode(parts[1]), StandardCharsets.UTF_8));

        assertEquals("RS256", header.getString("alg"));
        assertEquals("XY12345.BRIDGE_USER", claims.getString("sub"));
        assertEquals("XY12345.BRIDGE_USER." + credentials.publicKeyFingerprint(), claims.getString("iss"));
        assertEquals(1_700_000_000L, claims.getLong("iat"));
        assertTrue(claims.getLong("exp") > claims.getLong("iat"));
        assertTrue(claims.getLong("exp") - claims.getLong("iat") <= 3600);

        Signature verifier = Signature.getInstance("SHA256withRSA");
        verifier.initVerify(keyPair.getPublic());
        verifier.update((parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII));
        assertTrue(verifier.verify(decoder.decode(parts[2])));
    }

    @Test
    void testEncryptedKeyWithoutPassphrase() throws Exception {
        Path file = writePem("ENCRYPTED PRIVATE KEY", new byte[]{0x30, 0x00});

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> KeyPairCredentials.load(file.toString(), null));
        assertTrue(e.getMessage().contains("no passphrase"));
    }

    @Test
    void testRejectsNonPkcs8Files() throws Exception {
        Path file = writePem("RSA PRIVATE KEY", keyPair.getPrivate().getEncoded());

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> KeyPairCredentials.load(file.toString(), null));
        assertTrue(e.getMessage().contains("PKCS#8"));
    }

    @Test
    void testMissingFile() {
        assertThrows(ConfigurationException.class,
            () -> KeyPairCredentials.load(tempDir.resolve("absent.p8").toString(), null));
    }
}
