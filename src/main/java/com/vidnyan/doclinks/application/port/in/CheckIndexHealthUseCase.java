package com.vidnyan.doclinks.application.port.in;

import com.vidnyan.doclinks.domain.health.HealthReport;

import java.nio.file.Path;

/**
 * Grade the catalog artifacts by size and load cost.
 */
public interface CheckIndexHealthUseCase {

    HealthReport health(Path root);
}
