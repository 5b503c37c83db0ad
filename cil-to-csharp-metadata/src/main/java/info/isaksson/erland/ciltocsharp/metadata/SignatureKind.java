package info.isaksson.erland.ciltocsharp.metadata;

/**
 * Encoding layers of a compiled type signature.
 *
 * <p>Wrapper kinds carry an element (or declaring) signature; {@link #NAMED} and
 * {@link #GENERIC_PARAMETER} are terminal.</p>
 */
public enum SignatureKind {
    /** {@code modopt(...)} wrapper. */
    OPTIONAL_MODIFIER,
    /** {@code modreq(...)} wrapper. */
    REQUIRED_MODIFIER,
    BY_REFERENCE,
    POINTER,
    ARRAY,
    GENERIC_INSTANCE,
    GENERIC_PARAMETER,
    NESTED,
    NAMED
}
