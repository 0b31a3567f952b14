package com.lead.discovery.matching;

import com.lead.discovery.core.model.Lead;

/**
 * A lead resembling a reference lead. Similarity is in [0,100].
 */
public record SimilarLead(Lead lead, int similarity) {
}
