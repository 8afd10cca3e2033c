package arcpay.guard.service.intent;

/**
 * Progress of one signed intent through the pipeline. Any failure is terminal.
 */
public enum IntentStage {
    RECEIVED,
    SIGNATURE_VERIFIED,
    EXPIRY_OK,
    NONCE_REGISTERED,
    EXECUTING,
    SUCCEEDED,
    FAILED
}
