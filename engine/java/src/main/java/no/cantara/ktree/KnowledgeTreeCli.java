package no.cantara.ktree;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line validation of a knowledge tree.
 * Usage: java -jar knowledge-tree-engine.jar &lt;knowledge-root | knowledge-tree.yaml&gt; [--fix]
 */
public class KnowledgeTreeCli {

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: java -jar knowledge-tree-engine.jar <knowledge-root|knowledge-tree.yaml> [--fix]");
            System.exit(1);
        }

        Path target = Path.of(args[0]);
        boolean fix = args.length > 1 && args[1].equals("--fix");
        if (!Files.exists(target)) {
            System.err.println("Error: not found: " + target);
            System.exit(1);
        }

        KnowledgeTreeConfig config;
        ValidationReport report;
        try {
            config = Files.isDirectory(target)
                    ? KnowledgeTreeConfig.defaults(target)
                    : KnowledgeTreeConfig.load(target);
            report = KnowledgeTree.open(config, null).validate(null, fix);
        } catch (Exception e) {
            System.err.println("Validation error: " + e.getMessage());
            System.exit(1);
            return;
        }

        if (fix && report.fixed() > 0) {
            System.err.println("  Fixed " + report.fixed() + " missing mirror link(s)");
        }
        if (!report.isValid()) {
            System.err.println("Validation failed: " + report.issues().size() + " issue(s):");
            report.issues().forEach(i -> System.err.println("  • " + i));
            System.exit(1);
        }

        System.out.printf("✓ %s is valid — %d entr%s checked%n",
                config.knowledgeRoot(), report.checked(), report.checked() == 1 ? "y" : "ies");
    }
}
