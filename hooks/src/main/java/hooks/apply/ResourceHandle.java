package hooks.apply;

/**
 * Opaque reference to a submitted resource, returned by
 * {@link ApplyMechanism#submit(hooks.manifest.Manifest)} and passed back to
 * {@link ApplyMechanism#poll(ResourceHandle)}.
 *
 * @param kind resource kind
 * @param name resource name
 * @param token implementation-specific identifier (e.g. a UID); may be null
 */
public record ResourceHandle(String kind, String name, String token) {
}
