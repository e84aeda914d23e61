package fr.lapetina.thesis.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Process-wide holder for one shared {@link ClientContext}.
 *
 * Library code should receive a context explicitly; this holder only serves entry points
 * that cannot pass one along.
 */
public final class ClientRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClientRegistry.class);

    private static final Object LOCK = new Object();
    private static volatile ClientContext instance;

    private ClientRegistry() {
    }

    /**
     * Returns the shared context, creating it from the default configuration on first use.
     */
    public static ClientContext getOrCreate() {
        return getOrCreate(ClientContext::create);
    }

    /**
     * Returns the shared context, creating it with {@code factory} on first use.
     * Later calls return the same instance and ignore their factory.
     */
    public static ClientContext getOrCreate(Supplier<? extends ClientContext> factory) {
        ClientContext current = instance;
        if (current != null) {
            return current;
        }
        synchronized (LOCK) {
            if (instance == null) {
                instance = factory.get();
                log.info("Shared ClientContext created");
            }
            return instance;
        }
    }

    /**
     * Closes and forgets the shared context. The next {@link #getOrCreate} builds a new one.
     */
    public static void reset() {
        ClientContext previous;
        synchronized (LOCK) {
            previous = instance;
            instance = null;
        }
        if (previous != null) {
            previous.close();
            log.info("Shared ClientContext reset");
        }
    }
}
