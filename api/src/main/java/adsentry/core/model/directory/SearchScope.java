package adsentry.core.model.directory;

/**
 * Depth of a directory search relative to its base DN.
 */
public enum SearchScope {
    /** Only the base entry itself. */
    BASE,
    /** Immediate children of the base entry. */
    ONE,
    /** The base entry and its whole subtree. */
    SUB
}
