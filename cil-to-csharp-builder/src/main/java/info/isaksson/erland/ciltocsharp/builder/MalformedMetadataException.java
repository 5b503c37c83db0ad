package info.isaksson.erland.ciltocsharp.builder;

/**
 * The metadata provider handed over a structure the translator cannot represent, such as a type
 * or member without a name. Aborts the whole module translation; no partial tree is produced.
 */
public class MalformedMetadataException extends IllegalStateException {

    public MalformedMetadataException(String message) {
        super(message);
    }

    static String requireName(String name, String what, Object owner) {
        if (name == null) {
            throw new MalformedMetadataException(what + " name returned null. " + what + ": " + owner);
        }
        return name;
    }
}
