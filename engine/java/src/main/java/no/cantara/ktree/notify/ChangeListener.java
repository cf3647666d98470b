package no.cantara.ktree.notify;

/**
 * A subscriber registered with a {@link ListenerRegistry}.
 */
public interface ChangeListener {

    /**
     * Delivers one event. Throwing, or not returning within the registry's delivery timeout,
     * marks the listener as dead and it is removed.
     */
    void onChange(ChangeEvent event) throws Exception;

    /** A closed listener is skipped and pruned on the next broadcast. */
    default boolean isOpen() {
        return true;
    }
}
