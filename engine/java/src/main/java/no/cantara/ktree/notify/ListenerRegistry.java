package no.cantara.ktree.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The set of connected change listeners, passed into the engine as its {@link ChangeNotifier}.
 * Broadcasting never fails: closed, failing and slow listeners are pruned.
 *
 * <p>{@link #notify(ChangeEvent)} hands the event to a dispatcher thread and returns at once.
 * Each listener gets {@code deliveryTimeout} to accept an event; a listener that takes longer
 * is interrupted and dropped.
 */
public class ListenerRegistry implements ChangeNotifier, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ListenerRegistry.class);

    public static final Duration DEFAULT_DELIVERY_TIMEOUT = Duration.ofSeconds(1);

    private final Set<ChangeListener> listeners = new CopyOnWriteArraySet<>();
    private final Duration deliveryTimeout;
    private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(daemon("knowledge-tree-dispatch"));
    private final ExecutorService delivery = Executors.newCachedThreadPool(daemon("knowledge-tree-listener"));

    public ListenerRegistry() {
        this(DEFAULT_DELIVERY_TIMEOUT);
    }

    public ListenerRegistry(Duration deliveryTimeout) {
        if (deliveryTimeout.isNegative() || deliveryTimeout.isZero()) {
            throw new IllegalArgumentException("deliveryTimeout must be positive, got " + deliveryTimeout);
        }
        this.deliveryTimeout = deliveryTimeout;
    }

    public void add(ChangeListener listener) {
        listeners.add(listener);
    }

    public boolean remove(ChangeListener listener) {
        return listeners.remove(listener);
    }

    public int size() {
        return listeners.size();
    }

    @Override
    public void notify(ChangeEvent event) {
        try {
            dispatcher.execute(() -> broadcast(event));
        } catch (RejectedExecutionException e) {
            log.debug("Registry closed, dropping {} for {}", event.type().value(), event.path());
        }
    }

    /**
     * Delivers {@code event} to every open listener and waits for each in turn, at most
     * {@code deliveryTimeout} per listener.
     *
     * @return number of listeners that received the event
     */
    public int broadcast(ChangeEvent event) {
        int delivered = 0;
        for (ChangeListener listener : listeners) {
            if (!listener.isOpen()) {
                listeners.remove(listener);
                log.debug("Pruned closed listener {}", listener);
                continue;
            }
            Future<?> pending;
            try {
                pending = delivery.submit(() -> {
                    listener.onChange(event);
                    return null;
                });
            } catch (RejectedExecutionException e) {
                log.debug("Registry closed, dropping {} for {}", event.type().value(), event.path());
                return delivered;
            }
            try {
                pending.get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
                delivered++;
            } catch (TimeoutException e) {
                pending.cancel(true);
                listeners.remove(listener);
                log.warn("Dropping listener {}: no response to {} for {} within {} ms",
                        listener, event.type().value(), event.path(), deliveryTimeout.toMillis());
            } catch (ExecutionException e) {
                listeners.remove(listener);
                log.warn("Dropping listener {} after failed delivery of {} for {}: {}",
                        listener, event.type().value(), event.path(), e.getCause().toString());
            } catch (InterruptedException e) {
                pending.cancel(true);
                Thread.currentThread().interrupt();
                return delivered;
            }
        }
        return delivered;
    }

    /** Stops delivery; events notified afterwards are dropped. */
    @Override
    public void close() {
        dispatcher.shutdown();
        delivery.shutdownNow();
        try {
            if (!dispatcher.awaitTermination(deliveryTimeout.toMillis() * 2, TimeUnit.MILLISECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemon(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
