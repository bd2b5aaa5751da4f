package in.warmguard.application.port.output;

import in.warmguard.domain.session.ContextOptions;

/**
 * Browser-automation runtime the session pool opens contexts on.
 *
 * The pool starts the engine lazily before the first context and shuts it down
 * when the last session is released.
 */
public interface AutomationEngine {

    void start();

    boolean isRunning();

    /**
     * Open an isolated context. Failures surface as unchecked exceptions.
     */
    AutomationContext newContext(ContextOptions options);

    void shutdown();
}
