package com.campaign.canon.correction;

import com.campaign.canon.core.CanonException;
import com.campaign.canon.core.ErrorCode;

/**
 * Thrown when an actor without the required role attempts a gated ledger action.
 */
public class NotAuthorizedException extends CanonException {

    public NotAuthorizedException(String message) {
        super(ErrorCode.NOT_AUTHORIZED, message);
    }
}
