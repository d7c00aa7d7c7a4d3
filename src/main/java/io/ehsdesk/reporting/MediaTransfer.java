package io.ehsdesk.reporting;

import java.nio.file.Path;
import java.time.Duration;

/** Moves a worker's media artifact into the uploads area. The slow, failure-prone step of a report. */
public interface MediaTransfer {
    /**
     * Copies {@code source} to {@code target}, replacing any previous file, within {@code timeout}.
     * On failure no partial file is left at {@code target}.
     *
     * @throws io.ehsdesk.error.TransferException when the source cannot be read, an I/O error occurs,
     *                                            the deadline passes or the thread is interrupted
     */
    void transfer(Path source, Path target, Duration timeout);
}
