package com.ofx.tagtree.tools;

import com.ofx.tagtree.Version;
import com.ofx.tagtree.aggregate.AggregateRegistry;
import com.ofx.tagtree.aggregate.DefaultAggregates;
import com.ofx.tagtree.convert.AggregateConverter;
import com.ofx.tagtree.convert.ConvertedAggregate;
import com.ofx.tagtree.convert.ExtensionElement;
import com.ofx.tagtree.loader.OfxDocument;
import com.ofx.tagtree.loader.OfxLoader;
import com.ofx.tagtree.loader.OfxParseException;
import com.ofx.tagtree.loader.OfxParserOptions;
import com.ofx.tagtree.loader.ast.TagNode;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prints the aggregates of an OFX file. With no tags given, every registered aggregate found in the
 * document is converted, outermost first.
 */
public final class OfxDumpCli {

    private static final String USAGE = "Usage: OfxDumpCli <file.ofx> [--lax] [TAG ...]";

    private OfxDumpCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path file = null;
        boolean strict = true;
        Set<String> tags = new LinkedHashSet<>();
        for (String arg : args) {
            if ("--lax".equals(arg)) {
                strict = false;
            } else if ("--version".equals(arg)) {
                out.println("OfxDumpCli " + Version.RUNTIME);
                return 0;
            } else if (file == null) {
                file = Path.of(arg).toAbsolutePath().normalize();
            } else {
                tags.add(arg);
            }
        }
        if (file == null) {
            err.println(USAGE);
            return 1;
        }
        if (!Files.isReadable(file)) {
            err.println("OFX file not found or not readable: " + file);
            return 1;
        }

        AggregateRegistry registry = DefaultAggregates.registry();
        OfxParserOptions options = OfxParserOptions.fromSystem();
        try {
            OfxDocument document = new OfxLoader(options).load(file);
            out.println(file.getFileName() + ": OFX " + document.getHeader().getVersion());
            if (tags.isEmpty()) {
                tags.addAll(registry.getTags());
            }
            AggregateConverter converter = new AggregateConverter(registry, options);
            for (TagNode node : selectNodes(document.getRoot(), tags)) {
                print(out, converter.convert(node, strict), "");
            }
            return 0;
        } catch (IOException ex) {
            err.println("Failed to read " + file + ": " + ex.getMessage());
            return 1;
        } catch (OfxParseException ex) {
            err.println("Rejected " + file.getFileName() + ": " + ex.getMessage());
            return 1;
        }
    }

    // Outermost matches only; a matched aggregate's descendants are converted as part of it.
    private static List<TagNode> selectNodes(TagNode root, Set<String> tags) {
        List<TagNode> selected = new ArrayList<>();
        collect(root, tags, selected);
        return selected;
    }

    private static void collect(TagNode node, Set<String> tags, List<TagNode> out) {
        if (tags.contains(node.getTag()) && !node.isLeaf()) {
            out.add(node);
            return;
        }
        for (TagNode child : node.getChildren()) {
            collect(child, tags, out);
        }
    }

    private static void print(PrintStream out, ConvertedAggregate converted, String indent) {
        out.println(indent + "<" + converted.getTag() + ">");
        for (Map.Entry<String, Object> value : converted.getAggregate().getValues().entrySet()) {
            out.println(indent + "  " + value.getKey() + " = " + value.getValue());
        }
        for (ExtensionElement extension : converted.getExtensions()) {
            out.println(indent + "  (extension) " + extension.tag() + " = " + extension.text());
        }
        for (Map.Entry<String, List<ConvertedAggregate>> list : converted.getLists().entrySet()) {
            out.println(indent + "  " + list.getKey() + " [" + list.getValue().size() + "]");
            for (ConvertedAggregate item : list.getValue()) {
                print(out, item, indent + "    ");
            }
        }
    }
}
