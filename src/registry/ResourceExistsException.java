package registry;

/** Thrown by {@link Registry#register} when the key is already taken. */
public class ResourceExistsException extends IllegalStateException {
    private final String key;

    public ResourceExistsException(String key) {
        super("resource already registered: " + key);
        this.key = key;
    }

    public String key() { return key; }
}
