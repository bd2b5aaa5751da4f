package in.warmguard.domain.session;

/**
 * Parameters for opening a fresh automation context.
 *
 * @param accountId    account the context belongs to
 * @param proxy        optional proxy, null for a direct connection
 * @param storageState previously persisted storage state document, null for a clean profile
 */
public record ContextOptions(long accountId, ProxyConfig proxy, String storageState) {

    public boolean restoresState() {
        return storageState != null;
    }
}
