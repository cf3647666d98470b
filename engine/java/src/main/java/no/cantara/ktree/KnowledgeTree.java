package no.cantara.ktree;

import no.cantara.ktree.model.EntryPatch;
import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.Relation;
import no.cantara.ktree.model.RelationshipType;
import no.cantara.ktree.notify.ChangeEvent;
import no.cantara.ktree.notify.ChangeNotifier;
import no.cantara.ktree.store.EntryPaths;
import no.cantara.ktree.store.EntryStore;
import no.cantara.ktree.store.FileEntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The entry graph engine: create, update, delete, move and link entries while keeping mirror
 * links and incoming references consistent, and read entries with their neighborhood.
 *
 * <p>There is no transaction across files. Each operation validates and aborts before writing
 * its primary target when something is wrong. Once the primary write succeeded, the operation
 * succeeds; mirror sync and reference rewriting on other entries are best-effort and reported
 * in the {@link MutationResult}.
 *
 * <p>No locking: concurrent updates of the same entry are last-writer-wins.
 */
public class KnowledgeTree {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeTree.class);

    public static final int DEFAULT_MAX_MOVE_ATTEMPTS = 16;

    private final EntryStore store;
    private final ChangeNotifier notifier;
    private final Clock clock;
    private final int maxMoveAttempts;
    private final LinkSynchronizer links;
    private final ReferenceRewriter references;
    private final TreeTraversal traversal;
    private final StoreValidator validator;
    private final TreeOverview overview;

    public KnowledgeTree(EntryStore store, ChangeNotifier notifier) {
        this(store, notifier, Clock.systemUTC(), DEFAULT_MAX_MOVE_ATTEMPTS);
    }

    public KnowledgeTree(EntryStore store, ChangeNotifier notifier, Clock clock, int maxMoveAttempts) {
        if (maxMoveAttempts < 1) {
            throw new IllegalArgumentException("maxMoveAttempts must be positive, got " + maxMoveAttempts);
        }
        this.store = store;
        this.notifier = notifier != null ? notifier : ChangeNotifier.NONE;
        this.clock = clock;
        this.maxMoveAttempts = maxMoveAttempts;
        this.links = new LinkSynchronizer(store);
        this.references = new ReferenceRewriter(store);
        this.traversal = new TreeTraversal(store);
        this.validator = new StoreValidator(store, links);
        this.overview = new TreeOverview(store, clock);
    }

    /** Opens a file-backed tree rooted at the configured knowledge directory. */
    public static KnowledgeTree open(KnowledgeTreeConfig config, ChangeNotifier notifier) {
        return new KnowledgeTree(new FileEntryStore(config.knowledgeRoot()), notifier,
                Clock.systemUTC(), config.maxMoveAttempts());
    }

    public EntryStore store() {
        return store;
    }

    // ── Create ────────────────────────────────────────────────────────────────────

    /**
     * Stores a new entry at {@code path} and mirrors its symmetric relations.
     *
     * @throws EntryConflictException   if an entry already exists at {@code path}
     * @throws EntryValidationException with every violated field and every missing target
     */
    public MutationResult create(String path, KnowledgeEntry entry) throws IOException {
        String key = key(path);
        if (store.exists(key)) {
            throw new EntryConflictException(key, "Entry already exists at " + key + ". Use update to modify it.");
        }
        List<String> errors = EntryValidator.validateNew(key, entry, store);
        if (!errors.isEmpty()) {
            throw new EntryValidationException(errors);
        }

        KnowledgeEntry.Builder stamped = entry.toBuilder();
        if (entry.createdAt() == null) stamped.createdAt(clock.instant());
        if (entry.updatedAt() == null) stamped.updatedAt(clock.instant());
        KnowledgeEntry created = stamped.build();

        store.write(key, created);
        SideEffectReport mirrors = links.sync(key, created);
        log.info("Created {}", key);
        publish(ChangeEvent.added(key, created));
        return new MutationResult(MutationResult.Operation.CREATE, key, null, created, List.of(), mirrors);
    }

    // ── Update ────────────────────────────────────────────────────────────────────

    public MutationResult update(String path, EntryPatch patch) throws IOException {
        return update(path, patch, null);
    }

    /**
     * Applies {@code patch} to the entry at {@code path}. When {@code newPath} names a different
     * key, the patched entry is moved there (see {@link #move(String, String)}).
     *
     * @throws EntryNotFoundException   if there is no entry at {@code path}
     * @throws EntryValidationException with every problem in the patched fields
     */
    public MutationResult update(String path, EntryPatch patch, String newPath) throws IOException {
        String key = key(path);
        String target = newPath != null ? key(newPath) : null;
        if (!store.exists(key)) {
            throw new EntryNotFoundException(key);
        }
        KnowledgeEntry current = store.read(key);
        List<String> errors = EntryValidator.validatePatch(key, patch, store);
        if (!errors.isEmpty()) {
            throw new EntryValidationException(errors);
        }
        KnowledgeEntry updated = patch.applyTo(current, clock.instant());
        List<String> moveWarnings = new ArrayList<>();
        String destination = null;
        if (target != null && !target.equals(key)) {
            destination = resolveDestination(target, moveWarnings);
        }

        SideEffectReport effects = SideEffectReport.EMPTY;
        List<Relation> added = List.of();
        if (patch.replacesRelations()) {
            List<Relation> removed = difference(current.relatedTo(), updated.relatedTo());
            added = difference(updated.relatedTo(), current.relatedTo());
            effects = links.removeMirrors(key, removed);
        }

        if (destination != null) {
            MutationResult moved = relocate(key, destination, updated, moveWarnings);
            effects = effects.merge(moved.sideEffects()).merge(links.addMirrors(moved.path(), added));
            log.info("Updated {} ({}) and moved it to {}", key, patch.fieldNames(), moved.path());
            publish(ChangeEvent.updated(moved.path(), updated));
            return new MutationResult(MutationResult.Operation.UPDATE, moved.path(), key, updated,
                    moved.warnings(), effects);
        }

        store.write(key, updated);
        effects = effects.merge(links.addMirrors(key, added));
        log.info("Updated {} ({})", key, patch.fieldNames());
        publish(ChangeEvent.updated(key, updated));
        return new MutationResult(MutationResult.Operation.UPDATE, key, null, updated, List.of(), effects);
    }

    // ── Delete ────────────────────────────────────────────────────────────────────

    public MutationResult delete(String path) throws IOException {
        return delete(path, true);
    }

    /**
     * Deletes the entry at {@code path}. With {@code cleanupLinks}, relations targeting it are
     * stripped from every other entry; that cleanup never fails the deletion.
     *
     * @throws EntryNotFoundException if there is no entry at {@code path}
     */
    public MutationResult delete(String path, boolean cleanupLinks) throws IOException {
        String key = key(path);
        if (!store.exists(key)) {
            throw new EntryNotFoundException(key);
        }
        List<String> warnings = new ArrayList<>();
        KnowledgeEntry previous = null;
        try {
            previous = store.read(key);
        } catch (IOException | KnowledgeTreeException e) {
            warnings.add("Entry content could not be read before deletion: " + e.getMessage());
        }

        store.delete(key);

        SideEffectReport cleanup = SideEffectReport.EMPTY;
        if (cleanupLinks) {
            cleanup = stripReferences(key);
        }
        log.info("Deleted {} ({} outgoing relations, cleaned {} referencing entries)", key,
                previous != null ? previous.relatedTo().size() : "unknown", cleanup.modifiedCount());
        publish(ChangeEvent.deleted(key));
        return new MutationResult(MutationResult.Operation.DELETE, key, null, null, warnings, cleanup);
    }

    // ── Move ──────────────────────────────────────────────────────────────────────

    /**
     * Moves the entry at {@code oldPath} to {@code newPath} and points every incoming relation
     * at the new key. When {@code newPath} is taken, the entry lands on a derived free key
     * instead and the result carries a warning; the existing entry is not touched.
     *
     * @throws EntryNotFoundException if there is no entry at {@code oldPath}
     */
    public MutationResult move(String oldPath, String newPath) throws IOException {
        String from = key(oldPath);
        String to = key(newPath);
        if (from.equals(to)) {
            throw new EntryValidationException("Source and destination are the same: " + from);
        }
        if (!store.exists(from)) {
            throw new EntryNotFoundException(from, "Source entry not found: " + from);
        }
        List<String> warnings = new ArrayList<>();
        String destination = resolveDestination(to, warnings);
        return relocate(from, destination, null, warnings);
    }

    /**
     * Executes and announces a move to an already resolved free key. {@code content} replaces
     * the stored content at the destination when given.
     */
    private MutationResult relocate(String from, String to, KnowledgeEntry content, List<String> warnings)
            throws IOException {
        try {
            int incoming = references.countIncoming(from);
            if (incoming > 0) {
                warnings.add("Entry has " + incoming + " incoming reference(s) that will be updated");
            }
        } catch (IOException e) {
            log.warn("Could not count incoming references to {}: {}", from, e.getMessage());
            warnings.add("Could not check for incoming references: " + e.getMessage());
        }

        KnowledgeEntry entry = content != null ? content : store.read(from);
        store.write(to, entry);
        SideEffectReport rewritten = rewriteReferences(from, to);
        store.delete(from);

        log.info("Moved {} -> {} ({} references updated)", from, to, rewritten.modifiedCount());
        publish(ChangeEvent.moved(from, to, entry));
        return new MutationResult(MutationResult.Operation.MOVE, to, from, entry, warnings, rewritten);
    }

    /** {@code requested} when free, else the first free derived key; aborts before any write. */
    private String resolveDestination(String requested, List<String> warnings) throws IOException {
        if (!store.exists(requested)) {
            return requested;
        }
        long stamp = clock.millis();
        for (int attempt = 0; attempt < maxMoveAttempts; attempt++) {
            String candidate = EntryPaths.disambiguate(requested, stamp, attempt);
            if (!store.exists(candidate)) {
                warnings.add("Target path already exists: " + requested + " (moved to " + candidate + ")");
                return candidate;
            }
        }
        throw new EntryConflictException(requested,
                "No free path derived from " + requested + " after " + maxMoveAttempts + " attempts");
    }

    // ── Link / unlink ─────────────────────────────────────────────────────────────

    /**
     * Adds a relation from {@code from} to {@code to}, or changes the kind of an existing one.
     * Symmetric kinds are mirrored on the target.
     */
    public MutationResult link(String from, String to, RelationshipType relationship, String description)
            throws IOException {
        String source = key(from);
        String target = key(to);
        if (source.equals(target)) {
            throw new EntryValidationException("An entry cannot be related to itself: " + source);
        }
        if (!store.exists(source)) {
            throw new EntryNotFoundException(source, "Source entry does not exist: " + source);
        }
        if (!store.exists(target)) {
            throw new EntryNotFoundException(target, "Target entry does not exist: " + target);
        }
        KnowledgeEntry entry = store.read(source);

        List<Relation> relations = new ArrayList<>();
        Relation previous = null;
        Relation stored = null;
        for (Relation r : entry.relatedTo()) {
            if (r.targets(target) && stored == null) {
                previous = r;
                stored = new Relation(target, relationship, description != null ? description : r.description());
                relations.add(stored);
            } else {
                relations.add(r);
            }
        }
        if (stored == null) {
            stored = new Relation(target, relationship, description);
            relations.add(stored);
        }

        SideEffectReport effects = SideEffectReport.EMPTY;
        if (previous != null && previous.relationship() != relationship) {
            effects = links.removeMirrors(source, List.of(previous));
        }
        KnowledgeEntry updated = entry.toBuilder().relatedTo(relations).updatedAt(clock.instant()).build();
        store.write(source, updated);
        effects = effects.merge(links.addMirrors(source, List.of(stored)));

        log.info("Linked {} {} {}", source, relationship, target);
        publish(ChangeEvent.updated(source, updated));
        return new MutationResult(MutationResult.Operation.LINK, source, null, updated, List.of(), effects);
    }

    /**
     * Removes the relations from {@code from} to {@code to}, and the mirror for symmetric kinds.
     *
     * @throws EntryNotFoundException if the source is missing or has no relation to the target
     */
    public MutationResult unlink(String from, String to) throws IOException {
        String source = key(from);
        String target = key(to);
        if (!store.exists(source)) {
            throw new EntryNotFoundException(source, "Source entry does not exist: " + source);
        }
        KnowledgeEntry entry = store.read(source);
        List<Relation> removed = entry.relatedTo().stream().filter(r -> r.targets(target)).toList();
        if (removed.isEmpty()) {
            throw new EntryNotFoundException(target, "No relation from " + source + " to " + target);
        }
        SideEffectReport effects = links.removeMirrors(source, removed);
        KnowledgeEntry updated = entry.withoutRelationsTo(target).toBuilder().updatedAt(clock.instant()).build();
        store.write(source, updated);

        log.info("Unlinked {} -> {}", source, target);
        publish(ChangeEvent.updated(source, updated));
        return new MutationResult(MutationResult.Operation.UNLINK, source, null, updated, List.of(), effects);
    }

    // ── Reads ─────────────────────────────────────────────────────────────────────

    public KnowledgeEntry read(String path) throws IOException {
        return store.read(key(path));
    }

    public TraversalNode readWithDepth(String path, int depth) throws IOException {
        return readWithDepth(path, depth, Set.of());
    }

    /**
     * Reads the entry at {@code path} and embeds its neighbors up to {@code depth} hops.
     *
     * @param visited paths treated as already on the branch; they come back as circular markers
     * @throws EntryNotFoundException  if the entry at {@code path} does not exist
     * @throws MalformedEntryException if it cannot be decoded
     */
    public TraversalNode readWithDepth(String path, int depth, Set<String> visited) throws IOException {
        return traversal.readWithDepth(key(path), depth, visited);
    }

    public List<String> listAll() throws IOException {
        return store.listAll();
    }

    public int countIncoming(String path) throws IOException {
        return references.countIncoming(key(path));
    }

    /**
     * Entries with neither outgoing nor incoming relations. Unreadable entries are skipped.
     */
    public List<String> findOrphans() throws IOException {
        List<String> keys = store.listAll();
        Set<String> linked = new HashSet<>();
        Set<String> unreadable = new HashSet<>();
        for (String key : keys) {
            try {
                KnowledgeEntry entry = store.read(key);
                if (!entry.relatedTo().isEmpty()) {
                    linked.add(key);
                    entry.relatedTo().forEach(r -> linked.add(r.path()));
                }
            } catch (IOException | KnowledgeTreeException e) {
                unreadable.add(key);
            }
        }
        return keys.stream().filter(k -> !linked.contains(k) && !unreadable.contains(k)).sorted().toList();
    }

    /**
     * Entries added or modified within the last {@code days} days, newest first.
     *
     * @throws EntryValidationException if {@code days} or {@code limit} is not positive
     */
    public RecentChanges recent(int days, RecentChanges.Filter filter, int limit) throws IOException {
        List<String> errors = new ArrayList<>();
        if (days < 1) errors.add("days must be at least 1, got " + days);
        if (limit < 1) errors.add("limit must be at least 1, got " + limit);
        if (!errors.isEmpty()) {
            throw new EntryValidationException(errors);
        }
        return overview.recent(days, filter != null ? filter : RecentChanges.Filter.ALL, limit);
    }

    /**
     * Overview of the first {@code maxEntries} entries in key order, with store statistics.
     *
     * @throws EntryValidationException if {@code maxEntries} is not positive
     */
    public EntryIndex index(int maxEntries) throws IOException {
        if (maxEntries < 1) {
            throw new EntryValidationException("max_entries must be at least 1, got " + maxEntries);
        }
        return overview.index(maxEntries);
    }

    // ── Validation ────────────────────────────────────────────────────────────────

    /**
     * Checks one entry, or the whole store when {@code path} is {@code null}. With {@code fix},
     * missing mirror links are added.
     */
    public ValidationReport validate(String path, boolean fix) throws IOException {
        List<String> keys = path != null ? List.of(key(path)) : store.listAll();
        return validator.validate(keys, fix);
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    private SideEffectReport rewriteReferences(String from, String to) {
        try {
            return references.rewrite(from, to);
        } catch (IOException e) {
            log.warn("Could not scan the store to rewrite references {} -> {}: {}", from, to, e.getMessage());
            return new SideEffectReport(List.of(), List.of(
                    new SideEffectFailure(from, SideEffectFailure.Stage.REFERENCE_REWRITE, e.getMessage())));
        }
    }

    private SideEffectReport stripReferences(String key) {
        try {
            return references.strip(key);
        } catch (IOException e) {
            log.warn("Could not scan the store to strip references to {}: {}", key, e.getMessage());
            return new SideEffectReport(List.of(), List.of(
                    new SideEffectFailure(key, SideEffectFailure.Stage.REFERENCE_STRIP, e.getMessage())));
        }
    }

    private void publish(ChangeEvent event) {
        try {
            notifier.notify(event);
        } catch (RuntimeException e) {
            log.warn("Change notification {} for {} failed: {}", event.type().value(), event.path(), e.toString());
        }
    }

    private static String key(String path) {
        try {
            return EntryPaths.normalize(path);
        } catch (IllegalArgumentException e) {
            throw new EntryValidationException(e.getMessage());
        }
    }

    /** Relations in {@code a} with no counterpart of the same target and kind in {@code b}. */
    private static List<Relation> difference(List<Relation> a, List<Relation> b) {
        return a.stream()
                .filter(r -> b.stream().noneMatch(o -> o.targets(r.path()) && o.relationship() == r.relationship()))
                .toList();
    }
}
