package arcpay.guard.service.intent;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.springframework.stereotype.Component;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import arcpay.guard.config.X402Properties;
import arcpay.guard.dto.SignedIntent;
import arcpay.guard.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Recovers the signer of an x402 intent from its EIP-712 signature.
 */
@Component
@Slf4j
public class X402IntentVerifier {

    private static final String EIP712_DOMAIN_TYPE = "EIP712Domain(string name,string version,uint256 chainId)";
    private static final String X402_INTENT_TYPE =
        "X402Intent(string intentId,string fromAgent,address to,string amount,string currency,uint256 expiresAt,string nonce)";

    private static final byte[] EIP712_DOMAIN_TYPEHASH = keccak256(EIP712_DOMAIN_TYPE);
    private static final byte[] X402_INTENT_TYPEHASH = keccak256(X402_INTENT_TYPE);

    private final String expectedSigner;
    private final byte[] domainSeparator;

    public X402IntentVerifier(X402Properties properties) {
        String signer = properties.getExpectedSigner();
        this.expectedSigner = signer == null ? "" : signer.trim().toLowerCase(Locale.ROOT);
        X402Properties.Domain domain = properties.getDomain();
        this.domainSeparator = buildDomainSeparator(domain.getName(), domain.getVersion(), domain.getChainId());
        if (expectedSigner.isBlank()) {
            log.warn("x402.expected-signer is not set: intents signed by any key will be accepted");
        }
    }

    public VerificationResult verify(SignedIntent intent) {
        if (intent == null || intent.signature() == null || intent.signature().isBlank()) {
            return new VerificationResult(false, null, "missing_signature");
        }
        try {
            byte[] digest = buildIntentDigest(intent);
            Sign.SignatureData sigData = signatureToData(intent.signature());
            BigInteger publicKey = Sign.signedMessageHashToKey(digest, sigData);
            String checksum = Keys.toChecksumAddress("0x" + Keys.getAddress(publicKey));

            if (!expectedSigner.isBlank() && !checksum.equalsIgnoreCase(expectedSigner)) {
                return new VerificationResult(false, checksum, "signer_mismatch");
            }
            return new VerificationResult(true, checksum, null);
        } catch (Exception ex) {
            log.warn("Failed to verify EIP-712 intent {}: {}",
                LogSanitizer.sanitize(intent.intentId()), LogSanitizer.sanitize(ex.getMessage()));
            return new VerificationResult(false, null, "malformed_signature");
        }
    }

    /**
     * keccak256(0x19 0x01 || domainSeparator || hashStruct(intent)).
     */
    public byte[] buildIntentDigest(SignedIntent intent) {
        byte[] structHash = hashIntent(intent);

        byte[] digestInput = new byte[2 + domainSeparator.length + structHash.length];
        digestInput[0] = 0x19;
        digestInput[1] = 0x01;
        System.arraycopy(domainSeparator, 0, digestInput, 2, domainSeparator.length);
        System.arraycopy(structHash, 0, digestInput, 2 + domainSeparator.length, structHash.length);
        return Hash.sha3(digestInput);
    }

    private byte[] hashIntent(SignedIntent intent) {
        String encodedHex = encodeTypes(
            new Bytes32(X402_INTENT_TYPEHASH),
            new Bytes32(keccakString(intent.intentId())),
            new Bytes32(keccakString(intent.fromAgent())),
            new Address(normalizeAddress(intent.to())),
            new Bytes32(keccakString(intent.amount())),
            new Bytes32(keccakString(intent.currency())),
            new Uint256(nullSafe(intent.expiresAt())),
            new Bytes32(keccakString(intent.nonce()))
        );
        return Hash.sha3(Numeric.hexStringToByteArray(encodedHex));
    }

    private static byte[] buildDomainSeparator(String name, String version, long chainId) {
        String encodedHex = encodeTypes(
            new Bytes32(EIP712_DOMAIN_TYPEHASH),
            new Bytes32(keccak256(name)),
            new Bytes32(keccak256(version)),
            new Uint256(BigInteger.valueOf(chainId))
        );
        return Hash.sha3(Numeric.hexStringToByteArray(encodedHex));
    }

    @SuppressWarnings("rawtypes")
    private static String encodeTypes(Type... types) {
        StringBuilder sb = new StringBuilder();
        for (Type type : types) {
            sb.append(TypeEncoder.encode(type));
        }
        return sb.toString();
    }

    private Sign.SignatureData signatureToData(String signatureHex) {
        byte[] signatureBytes = Numeric.hexStringToByteArray(signatureHex.trim());
        if (signatureBytes.length != 65) {
            throw new IllegalArgumentException("Invalid signature length: " + signatureBytes.length);
        }
        byte v = signatureBytes[64];
        // Some wallets emit recovery id 0/1 instead of 27/28
        if (v < 27) {
            v = (byte) (v + 27);
        }
        byte[] r = new byte[32];
        byte[] s = new byte[32];
        System.arraycopy(signatureBytes, 0, r, 0, 32);
        System.arraycopy(signatureBytes, 32, s, 0, 32);
        return new Sign.SignatureData(v, r, s);
    }

    private static byte[] keccak256(String value) {
        return Hash.sha3(value.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] keccakString(String value) {
        String safe = value == null ? "" : value;
        return Hash.sha3(safe.getBytes(StandardCharsets.UTF_8));
    }

    private static String normalizeAddress(String address) {
        String safe = (address == null || address.isBlank()) ? "0x0" : address.trim();
        return "0x" + Numeric.cleanHexPrefix(safe);
    }

    private static BigInteger nullSafe(Long value) {
        return value == null ? BigInteger.ZERO : BigInteger.valueOf(value);
    }

    public record VerificationResult(boolean valid, String recoveredAddress, String error) { }
}
