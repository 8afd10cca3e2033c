package arcpay.guard.testutil;

import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import arcpay.guard.dto.SignedIntent;
import arcpay.guard.service.intent.X402IntentVerifier;

/**
 * Produces real EIP-712 signatures for intents in tests.
 */
public final class IntentSigner {

    public static final Credentials AGENT = Credentials.create(
        "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318");
    public static final Credentials OTHER = Credentials.create(
        "0x8da4ef21b864d2cc526dbdb2a120bd2874c36c9d0a1fb7f8c63d7f7a8b41de8f");

    private IntentSigner() {
    }

    public static String sign(X402IntentVerifier verifier, SignedIntent intent, Credentials credentials) {
        byte[] digest = verifier.buildIntentDigest(intent);
        Sign.SignatureData sig = Sign.signMessage(digest, credentials.getEcKeyPair(), false);
        byte[] out = new byte[65];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        out[64] = sig.getV()[0];
        return Numeric.toHexString(out);
    }

    public static SignedIntent signed(X402IntentVerifier verifier, SignedIntent intent, Credentials credentials) {
        return intent.toBuilder().signature(sign(verifier, intent, credentials)).build();
    }
}
