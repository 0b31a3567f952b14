package com.lead.discovery.identity;

import com.lead.discovery.core.model.Identifier;

/**
 * Outcome of recording one observation.
 *
 * @param identifier the identifier after the observation was applied
 * @param created    true when this observation created the record
 */
public record ObservationResult(Identifier identifier, boolean created) {
}
