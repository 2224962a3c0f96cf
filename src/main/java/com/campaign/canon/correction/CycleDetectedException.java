package com.campaign.canon.correction;

import com.campaign.canon.core.CanonException;
import com.campaign.canon.core.ErrorCode;

/**
 * Thrown when a merge would make a merge chain loop back on itself.
 */
public class CycleDetectedException extends CanonException {

    public CycleDetectedException(String message) {
        super(ErrorCode.CYCLE_DETECTED, message);
    }
}
