package io.utxoledger.core.mempool;

/** Reasons a transaction is rejected outright. A rejection never touches the ledger. */
public enum ValidationError {
    EMPTY_INPUTS("no inputs"),
    EMPTY_OUTPUTS("no outputs"),
    DUPLICATE_INPUT("each input must only be used once"),
    DUPLICATE_OUTPUT("each output must only be used once"),
    INVALID_SIGNATURE("signature must be valid"),
    ZERO_VALUE_OUTPUT("output value must be nonzero"),
    OUTPUT_COLLISION("output already exists"),
    INSUFFICIENT_INPUT_VALUE("output value must not exceed input value"),
    INPUT_OVERFLOW("input value overflow"),
    OUTPUT_OVERFLOW("output value overflow"),
    REWARD_UNDERFLOW("reward underflow"),
    INDEX_OVERFLOW("output index overflow");

    private final String message;

    ValidationError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
