package com.vidnyan.doclinks.domain.check;

import com.vidnyan.doclinks.domain.model.LinksIndex;

/**
 * The re-checked links index together with the report of the pass that produced it.
 */
public record CheckOutcome(LinksIndex links, CheckReport report) {
}
