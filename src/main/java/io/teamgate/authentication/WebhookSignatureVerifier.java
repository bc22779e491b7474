package io.teamgate.authentication;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Checks the <code>X-Hub-Signature</code> of a webhook delivery: an HMAC-SHA1 of the raw
 * body keyed with the webhook secret, hex encoded and prefixed with <code>sha1=</code>.
 */
public class WebhookSignatureVerifier {

    public static final String PREFIX = "sha1=";
    private static final String ALGORITHM = "HmacSHA1";

    private final SecretKeySpec key;

    public WebhookSignatureVerifier(String webhookSecret) {
        Objects.requireNonNull(webhookSecret, "Must provide a webhook secret to verify signatures");
        this.key = new SecretKeySpec(webhookSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    /**
     * Compares <code>signature</code> with the MAC of <code>payload</code> in constant time
     * @param signature Value of the signature header
     * @param payload Raw request body
     * @return true if the signature is well-formed and matches
     * @throws GateAuthenticationException if the MAC can't be computed
     */
    public boolean verify(String signature, byte[] payload) throws GateAuthenticationException {
        Objects.requireNonNull(payload, "Must provide a payload to verify");
        if (signature == null || !signature.startsWith(PREFIX)) { return false; }
        byte[] expected = sign(payload).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.substring(PREFIX.length()).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    /**
     * Computes the hex encoded MAC of <code>payload</code>
     * @param payload Raw request body
     * @return lower-case hex MAC, without prefix
     * @throws GateAuthenticationException if the MAC can't be computed
     */
    public String sign(byte[] payload) throws GateAuthenticationException {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(this.key);
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
            throw new GateAuthenticationException("Failed to compute webhook signature", ex);
        }
    }

}
