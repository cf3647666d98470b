package no.cantara.ktree.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import no.cantara.ktree.KnowledgeTreeConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * CLI entry point for knowledge-tree-mcp.
 *
 * <pre>
 * Usage: knowledge-tree-mcp [knowledge-tree.yaml | knowledge-root]
 * </pre>
 *
 * A directory argument is served with default settings.
 */
public class KnowledgeTreeMcpCli {

    public static void main(String[] args) {
        Path target = Path.of(args.length > 0 ? args[0] : KnowledgeTreeConfig.DEFAULT_FILE);

        if (!Files.exists(target)) {
            System.err.println("[knowledge-tree-mcp] Error: not found: " + target);
            System.exit(1);
        }

        McpSyncServer server;
        try {
            KnowledgeTreeConfig config = Files.isDirectory(target)
                ? KnowledgeTreeConfig.defaults(target)
                : KnowledgeTreeConfig.load(target);
            Files.createDirectories(config.knowledgeRoot());
            StdioServerTransportProvider transport =
                new StdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));
            server = KnowledgeTreeServer.createServer(config, transport);
        } catch (Exception e) {
            System.err.println("[knowledge-tree-mcp] Startup error: " + e.getMessage());
            System.exit(1);
            return;
        }

        // Transport handles I/O on daemon threads; the process exits when stdin closes.
        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            latch.countDown();
        }));
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
