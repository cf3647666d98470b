package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.store.EntryStore;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Delegating store that fails reads or writes of chosen keys. */
class FaultyEntryStore implements EntryStore {

    private final EntryStore delegate;
    private final Set<String> failingReads = new HashSet<>();
    private final Set<String> failingWrites = new HashSet<>();
    private boolean failListing;

    FaultyEntryStore(EntryStore delegate) {
        this.delegate = delegate;
    }

    FaultyEntryStore failReadsOf(String key) {
        failingReads.add(key);
        return this;
    }

    FaultyEntryStore failWritesTo(String key) {
        failingWrites.add(key);
        return this;
    }

    FaultyEntryStore failListing() {
        failListing = true;
        return this;
    }

    @Override
    public boolean exists(String key) throws IOException {
        return delegate.exists(key);
    }

    @Override
    public KnowledgeEntry read(String key) throws IOException {
        if (failingReads.contains(key)) throw new IOException("simulated read failure: " + key);
        return delegate.read(key);
    }

    @Override
    public void write(String key, KnowledgeEntry entry) throws IOException {
        if (failingWrites.contains(key)) throw new IOException("simulated write failure: " + key);
        delegate.write(key, entry);
    }

    @Override
    public void delete(String key) throws IOException {
        delegate.delete(key);
    }

    @Override
    public List<String> listAll() throws IOException {
        if (failListing) throw new IOException("simulated listing failure");
        return delegate.listAll();
    }
}
