package com.vidnyan.doclinks.application.port.out;

import com.vidnyan.doclinks.domain.health.HealthReport;

import java.nio.file.Path;

/**
 * Port for measuring the size and load cost of catalog artifacts.
 */
public interface IndexHealthProbe {

    HealthReport probe(Path indexDir);
}
