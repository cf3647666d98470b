package no.cantara.ktree.notify;

/**
 * Sink for change events. Implementations must not throw; the engine treats delivery as
 * fire-and-forget.
 */
@FunctionalInterface
public interface ChangeNotifier {

    ChangeNotifier NONE = event -> {};

    void notify(ChangeEvent event);
}
