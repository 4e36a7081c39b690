package com.vidnyan.swivel.domain.exception;

/**
 * A correction rule produced an unusable patch.
 */
public class CorrectionRuleException extends SwivelException {

    private final String ruleId;

    public CorrectionRuleException(String ruleId, String message) {
        super(ruleId + ": " + message);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
