package com.guitar.registry.review;

import com.guitar.registry.api.SubmissionResult;
import com.guitar.registry.pipeline.ResolutionOverride;

import java.util.List;
import java.util.Map;

/**
 * Re-ingests a stored submission with reviewer rulings applied.
 */
@FunctionalInterface
public interface SubmissionReplayer {

    SubmissionResult replay(Map<String, Object> submission, List<ResolutionOverride> overrides);
}
