package in.warmguard.application.port.output;

/**
 * One isolated automation context (cookie jar, storage, pages) bound to an account.
 */
public interface AutomationContext extends AutoCloseable {

    /**
     * Export the context's storage state as a JSON document.
     */
    String storageState();

    /**
     * Whether the site still treats this context as logged in. Engines that cannot tell
     * report {@code true}; failures surface as unchecked exceptions.
     */
    default boolean isLoggedIn() {
        return true;
    }

    @Override
    void close();
}
