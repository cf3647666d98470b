package no.cantara.ktree.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes every change event to the log. */
public class LoggingChangeListener implements ChangeListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingChangeListener.class);

    @Override
    public void onChange(ChangeEvent event) {
        if (event.oldPath() != null) {
            log.info("{}: {} -> {}", event.type().value(), event.oldPath(), event.path());
        } else {
            log.info("{}: {}", event.type().value(), event.path());
        }
    }
}
