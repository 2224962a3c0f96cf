package com.campaign.canon.correction;

import com.campaign.canon.core.CanonException;
import com.campaign.canon.core.ErrorCode;

/**
 * Thrown when approving or rejecting a correction that is no longer pending.
 */
public class AlreadyDecidedException extends CanonException {

    public AlreadyDecidedException(String message) {
        super(ErrorCode.ALREADY_DECIDED, message);
    }
}
