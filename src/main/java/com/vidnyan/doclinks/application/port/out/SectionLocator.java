package com.vidnyan.doclinks.application.port.out;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Port for locating the document section a line belongs to.
 */
public interface SectionLocator {

    /**
     * Text of the closest heading at or above {@code line}; empty when none precedes it.
     */
    Optional<String> sectionFor(Path docFile, int line);
}
