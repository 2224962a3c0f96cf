package com.campaign.canon.evidence;

import com.campaign.canon.core.CanonException;
import com.campaign.canon.core.ErrorCode;

/**
 * Thrown when displayed text is not an exact substring of the cited utterance, or a
 * summary quotes something outside the quote bank.
 */
public class EvidenceIntegrityViolationException extends CanonException {

    public EvidenceIntegrityViolationException(String message) {
        super(ErrorCode.EVIDENCE_INTEGRITY_VIOLATION, message);
    }
}
