package no.cantara.ktree.mcp;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import no.cantara.ktree.EntryValidationException;
import no.cantara.ktree.KnowledgeTree;
import no.cantara.ktree.KnowledgeTreeConfig;
import no.cantara.ktree.KnowledgeTreeException;
import no.cantara.ktree.RecentChanges;
import no.cantara.ktree.model.EntryPatch;
import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.notify.ListenerRegistry;
import no.cantara.ktree.notify.LoggingChangeListener;
import no.cantara.ktree.store.EntryCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

import static no.cantara.ktree.mcp.KnowledgeTreeMapper.*;

/**
 * Builds and returns a configured MCP server exposing a knowledge tree as tools.
 */
public final class KnowledgeTreeServer {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeTreeServer.class);

    static final int RECENT_DAYS = 7;
    static final int RECENT_LIMIT = 20;
    static final int INDEX_MAX_ENTRIES = 100;

    private KnowledgeTreeServer() {}

    // ── Internal helpers (package-private for tests) ──────────────────────────────

    /**
     * Tool definitions and their call handlers, keyed by tool name.
     * Package-private so tests can invoke handlers directly without a transport.
     */
    record ToolSet(
        List<McpSchema.Tool> tools,
        Map<String, ToolHandler> handlers
    ) {
        McpSchema.CallToolResult call(String name, Map<String, Object> args) {
            ToolHandler handler = handlers.get(name);
            if (handler == null) {
                return error("Unknown tool: " + name);
            }
            return handler.handle(args != null ? args : Map.of());
        }
    }

    @FunctionalInterface
    interface ToolHandler {
        McpSchema.CallToolResult handle(Map<String, Object> args);
    }

    @FunctionalInterface
    private interface Operation {
        Object run(Map<String, Object> args) throws IOException;
    }

    /**
     * Engine failures become error results; anything else is a bug and is logged with its trace.
     */
    private static ToolHandler guarded(String name, Operation op) {
        return args -> {
            try {
                return success(op.run(args));
            } catch (KnowledgeTreeException e) {
                log.debug("{} rejected: {}", name, e.getMessage());
                return failure(e);
            } catch (IOException e) {
                log.warn("{} failed on storage: {}", name, e.getMessage());
                return error("Storage error: " + e.getMessage());
            } catch (RuntimeException e) {
                log.error("{} failed", name, e);
                return error("Internal error: " + e);
            }
        };
    }

    /**
     * Builds every tool against {@code tree}. Defaults for depth and link cleanup come
     * from {@code config}.
     */
    static ToolSet buildTools(KnowledgeTree tree, KnowledgeTreeConfig config) {
        List<McpSchema.Tool>     tools    = new ArrayList<>();
        Map<String, ToolHandler> handlers = new LinkedHashMap<>();

        // ── add_knowledge ─────────────────────────────────────────────────────────
        tools.add(tool("add_knowledge",
            "Create a knowledge entry at a path. related/conflicts_with relations are mirrored on their targets.",
            Map.of(
                "path",  stringProperty("Entry path, e.g. backend/redis/cache-stampede"),
                "entry", entryProperty("Entry content", true)),
            List.of("path", "entry")));
        handlers.put("add_knowledge", guarded("add_knowledge", args -> {
            String path = requireString(args, "path");
            KnowledgeEntry entry = EntryCodec.inputFromMap(requireObject(args, "entry"));
            return mutationToMap(tree.create(path, entry));
        }));

        // ── update_knowledge ──────────────────────────────────────────────────────
        tools.add(tool("update_knowledge",
            "Update fields of an entry. Only given fields change; related_to replaces the whole list. "
                + "new_path also moves the entry and rewrites references to it.",
            Map.of(
                "path",     stringProperty("Path of the entry to update"),
                "updates",  entryProperty("Fields to overwrite", false),
                "new_path", stringProperty("Optional new path")),
            List.of("path", "updates")));
        handlers.put("update_knowledge", guarded("update_knowledge", args -> {
            String path = requireString(args, "path");
            EntryPatch patch = EntryCodec.patchFromMap(requireObject(args, "updates"));
            return mutationToMap(tree.update(path, patch, optionalString(args, "new_path")));
        }));

        // ── delete_knowledge ──────────────────────────────────────────────────────
        tools.add(tool("delete_knowledge",
            "Delete an entry. By default relations pointing at it are removed from every other entry.",
            Map.of(
                "path",          stringProperty("Path of the entry to delete"),
                "cleanup_links", booleanProperty("Strip relations to the deleted entry (default "
                    + config.cleanupLinks() + ")")),
            List.of("path")));
        handlers.put("delete_knowledge", guarded("delete_knowledge", args ->
            mutationToMap(tree.delete(requireString(args, "path"),
                optionalBoolean(args, "cleanup_links", config.cleanupLinks())))));

        // ── move_knowledge ────────────────────────────────────────────────────────
        tools.add(tool("move_knowledge",
            "Move an entry to a new path and rewrite every relation pointing at it. "
                + "If the target path is taken, the entry lands on a derived free path.",
            Map.of(
                "from", stringProperty("Current path"),
                "to",   stringProperty("New path")),
            List.of("from", "to")));
        handlers.put("move_knowledge", guarded("move_knowledge", args ->
            mutationToMap(tree.move(requireString(args, "from"), requireString(args, "to")))));

        // ── link_knowledge ────────────────────────────────────────────────────────
        tools.add(tool("link_knowledge",
            "Add a relation between two existing entries, or change the kind of an existing one.",
            Map.of(
                "from",         stringProperty("Source entry path"),
                "to",           stringProperty("Target entry path"),
                "relationship", relationshipProperty(),
                "description",  stringProperty("Optional note on the relation")),
            List.of("from", "to", "relationship")));
        handlers.put("link_knowledge", guarded("link_knowledge", args ->
            mutationToMap(tree.link(
                requireString(args, "from"),
                requireString(args, "to"),
                requireRelationship(args, "relationship"),
                optionalString(args, "description")))));

        // ── unlink_knowledge ──────────────────────────────────────────────────────
        tools.add(tool("unlink_knowledge",
            "Remove the relation from one entry to another, and its mirror.",
            Map.of(
                "from", stringProperty("Source entry path"),
                "to",   stringProperty("Target entry path")),
            List.of("from", "to")));
        handlers.put("unlink_knowledge", guarded("unlink_knowledge", args ->
            mutationToMap(tree.unlink(requireString(args, "from"), requireString(args, "to")))));

        // ── get_knowledge ─────────────────────────────────────────────────────────
        tools.add(tool("get_knowledge",
            "Read an entry. depth > 1 embeds linked entries that many hops out; cycles end in a circular_reference marker.",
            Map.of(
                "path",  stringProperty("Entry path"),
                "depth", integerProperty("Hops to expand (default " + config.defaultDepth() + ")", 1)),
            List.of("path")));
        handlers.put("get_knowledge", guarded("get_knowledge", args -> {
            int depth = optionalInt(args, "depth", config.defaultDepth());
            if (depth < 1) {
                throw new EntryValidationException("'depth' must be at least 1");
            }
            return tree.readWithDepth(requireString(args, "path"), depth).toMap();
        }));

        // ── list_knowledge ────────────────────────────────────────────────────────
        tools.add(tool("list_knowledge",
            "List entry paths. orphans_only limits the list to entries with no relations in or out.",
            Map.of("orphans_only", booleanProperty("Only entries with no relations (default false)")),
            List.of()));
        handlers.put("list_knowledge", guarded("list_knowledge", args -> {
            boolean orphans = optionalBoolean(args, "orphans_only", false);
            List<String> paths = orphans ? tree.findOrphans() : tree.listAll().stream().sorted().toList();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("count", paths.size());
            body.put("entries", paths);
            return body;
        }));

        // ── recent_knowledge ──────────────────────────────────────────────────────
        tools.add(tool("recent_knowledge",
            "List entries added or modified in the last N days, newest first.",
            Map.of(
                "days",  integerProperty("Size of the window in days (default " + RECENT_DAYS + ")", 1),
                "limit", integerProperty("Maximum entries returned (default " + RECENT_LIMIT + ")", 1),
                "type",  choiceProperty("Which changes to include (default all)", choices(RecentChanges.Filter.class))),
            List.of()));
        handlers.put("recent_knowledge", guarded("recent_knowledge", args ->
            recentToMap(tree.recent(
                optionalInt(args, "days", RECENT_DAYS),
                optionalChoice(args, "type", RecentChanges.Filter.class, RecentChanges.Filter.ALL),
                optionalInt(args, "limit", RECENT_LIMIT)))));

        // ── index_knowledge ───────────────────────────────────────────────────────
        tools.add(tool("index_knowledge",
            "Overview of all entries as a directory tree, a flat list, per-entry summaries or per-category "
                + "groups, with counts by priority and category.",
            Map.of(
                "format",          choiceProperty("Shape of the overview (default tree)", choices(IndexFormat.class)),
                "include_content", booleanProperty("Include full problems and solution previews (default false)"),
                "max_entries",     integerProperty("Maximum entries indexed (default " + INDEX_MAX_ENTRIES + ")", 1)),
            List.of()));
        handlers.put("index_knowledge", guarded("index_knowledge", args -> {
            IndexFormat format = optionalChoice(args, "format", IndexFormat.class, IndexFormat.TREE);
            boolean includeContent = optionalBoolean(args, "include_content", false);
            return indexToMap(tree.index(optionalInt(args, "max_entries", INDEX_MAX_ENTRIES)), format, includeContent);
        }));

        // ── validate_knowledge ────────────────────────────────────────────────────
        tools.add(tool("validate_knowledge",
            "Check one entry or the whole tree for missing fields, broken links and missing mirror links. "
                + "fix adds missing mirrors.",
            Map.of(
                "path", stringProperty("Entry to check; omit for the whole tree"),
                "fix",  booleanProperty("Add missing mirror links (default false)")),
            List.of()));
        handlers.put("validate_knowledge", guarded("validate_knowledge", args ->
            validationToMap(tree.validate(optionalString(args, "path"),
                optionalBoolean(args, "fix", false)))));

        return new ToolSet(tools, handlers);
    }

    // ── Public factory ────────────────────────────────────────────────────────────

    /**
     * Opens the knowledge tree described by {@code config} and returns a configured
     * MCP sync server ready to accept connections. Changes are logged through a
     * {@link LoggingChangeListener}.
     *
     * @param config    knowledge root and server settings
     * @param transport MCP transport provider (e.g. StdioServerTransportProvider)
     */
    public static McpSyncServer createServer(KnowledgeTreeConfig config, McpServerTransportProvider transport) {
        ListenerRegistry listeners = new ListenerRegistry();
        listeners.add(new LoggingChangeListener());
        KnowledgeTree tree = KnowledgeTree.open(config, listeners);
        ToolSet ts = buildTools(tree, config);

        log.info("Serving '{}' from {} with {} tools", config.serverName(), config.knowledgeRoot(), ts.tools().size());

        List<McpServerFeatures.SyncToolSpecification> specs = new ArrayList<>();
        for (McpSchema.Tool tool : ts.tools()) {
            ToolHandler handler = ts.handlers().get(tool.name());
            specs.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(tool)
                .callHandler((exchange, request) -> handler.handle(
                    request.arguments() != null ? request.arguments() : Map.of()))
                .build());
        }

        return McpServer.sync(transport)
            .serverInfo(config.serverName(), config.serverVersion())
            .capabilities(McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build())
            .tools(specs)
            .build();
    }
}
