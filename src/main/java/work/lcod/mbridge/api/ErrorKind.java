package work.lcod.mbridge.api;

/**
 * Where a failure originated.
 */
public enum ErrorKind {
    /** Rejected before any engine call: bad names, malformed packed strings, oversized references. */
    ENCODING,
    /** Non-zero status returned by the engine. */
    ENGINE,
    /** Buffer ceilings, gate or worker pool failures. */
    RESOURCE,
    /** Interrupt trapped by the engine while the call was executing. */
    INTERRUPT
}
