package tech.grantwell.engine.token;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RSA key pair used to sign JWT access tokens and id_tokens.
 *
 * @param keyId stable id derived from the public key, published as {@code kid}
 */
public record SigningKeys(RSAPrivateKey privateKey, RSAPublicKey publicKey, String keyId) {

    public static final String ALGORITHM = "RS256";
    private static final int KEY_SIZE = 2048;

    public static SigningKeys generate() {
        try {
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
            keyGen.initialize(KEY_SIZE, new SecureRandom());
            KeyPair keyPair = keyGen.generateKeyPair();
            return of((RSAPrivateKey) keyPair.getPrivate(), (RSAPublicKey) keyPair.getPublic());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA not available", e);
        }
    }

    public static SigningKeys of(RSAPrivateKey privateKey, RSAPublicKey publicKey) {
        return new SigningKeys(privateKey, publicKey, keyIdFor(publicKey));
    }

    /**
     * Load a PKCS#8 private key and an X.509 public key, DER encoded.
     */
    public static SigningKeys fromDer(byte[] privateKeyBytes, byte[] publicKeyBytes) {
        try {
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            RSAPrivateKey privateKey = (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(privateKeyBytes));
            RSAPublicKey publicKey = (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(publicKeyBytes));
            return of(privateKey, publicKey);
        } catch (GeneralSecurityException | ClassCastException e) {
            throw new IllegalArgumentException("Invalid RSA key material", e);
        }
    }

    /**
     * Load keys from PEM text ({@code PRIVATE KEY} and {@code PUBLIC KEY} blocks).
     */
    public static SigningKeys fromPem(String privateKeyPem, String publicKeyPem) {
        return fromDer(parsePem(privateKeyPem, "PRIVATE KEY"), parsePem(publicKeyPem, "PUBLIC KEY"));
    }

    private static byte[] parsePem(String pem, String type) {
        String base64 = pem
                .replace("-----BEGIN " + type + "-----", "")
                .replace("-----END " + type + "-----", "")
                .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    private static String keyIdFor(RSAPublicKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getEncoded());
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * The public key as a JWK.
     */
    public Map<String, Object> toJwk() {
        Map<String, Object> jwk = new LinkedHashMap<>();
        jwk.put("kty", "RSA");
        jwk.put("alg", ALGORITHM);
        jwk.put("use", "sig");
        jwk.put("kid", keyId);
        jwk.put("n", base64UrlUnsigned(publicKey.getModulus().toByteArray()));
        jwk.put("e", base64UrlUnsigned(publicKey.getPublicExponent().toByteArray()));
        return jwk;
    }

    /**
     * JWK set document for {@code /.well-known/jwks.json}.
     */
    public Map<String, Object> toJwks() {
        return Map.of("keys", List.of(toJwk()));
    }

    // BigInteger.toByteArray() may carry a leading sign byte
    private static String base64UrlUnsigned(byte[] bytes) {
        if (bytes.length > 1 && bytes[0] == 0) {
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    @Override
    public String toString() {
        return "SigningKeys[keyId=" + keyId + "]";
    }
}
