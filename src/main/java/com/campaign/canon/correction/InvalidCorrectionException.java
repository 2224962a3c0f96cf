package com.campaign.canon.correction;

import com.campaign.canon.core.CanonException;
import com.campaign.canon.core.ErrorCode;

/**
 * Thrown when a correction is malformed or cannot apply to the current canonical state,
 * for example removing an entity's active canonical name from its aliases.
 */
public class InvalidCorrectionException extends CanonException {

    public InvalidCorrectionException(String message) {
        super(ErrorCode.INVALID_CORRECTION, message);
    }
}
