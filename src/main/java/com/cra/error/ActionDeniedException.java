package com.cra.error;

/**
 * Thrown when an agent asks to execute an action that policy, or the
 * resolution it cites, does not allow.
 */
public class ActionDeniedException extends CraException {

    private final String actionId;
    private final String policyId;

    public ActionDeniedException(String actionId, String policyId, String reason) {
        super(ErrorCode.ACTION_DENIED, "action " + actionId + " denied: " + reason);
        this.actionId = actionId;
        this.policyId = policyId;
    }

    public String getActionId() {
        return actionId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
