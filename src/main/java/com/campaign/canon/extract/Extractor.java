package com.campaign.canon.extract;

/**
 * Inference provider turning a session transcript into structured facts. External
 * to this library; implementations may call a model and parse its JSON output with
 * {@link SessionFactsParser}.
 */
public interface Extractor {

    /**
     * Extracts session facts. Exceptions propagate to the run controller, which
     * retries the stage.
     */
    SessionFacts extract(ExtractionRequest request);
}
