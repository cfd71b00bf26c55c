package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.SourceLocation;
import com.ofx.tagtree.loader.ast.TagNode;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Entry point for reading OFX files: validates and strips the header, then builds the tag tree. */
public final class OfxLoader {
    private static final Logger LOGGER = Logger.getLogger(OfxLoader.class.getName());

    private final OfxTreeBuilder treeBuilder;

    public OfxLoader() {
        this(OfxParserOptions.fromSystem());
    }

    public OfxLoader(OfxParserOptions options) {
        this.treeBuilder = new OfxTreeBuilder(Objects.requireNonNull(options, "options"));
    }

    public OfxDocument load(Path path) throws IOException, OfxParseException {
        byte[] bytes = Files.readAllBytes(path);
        // Headers are ASCII, so a Latin-1 pass is enough to find the declared charset.
        OfxHeader header = OfxHeader.parse(new String(bytes, StandardCharsets.ISO_8859_1));
        Charset charset = header.getCharset();
        if (!StandardCharsets.ISO_8859_1.equals(charset)) {
            header = OfxHeader.parse(new String(bytes, charset));
        }
        LOGGER.log(
                Level.FINE,
                "Loading {0}: OFX {1}, charset {2}",
                new Object[] {path.getFileName(), header.getVersion(), charset});
        String sourceName = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        return new OfxDocument(header, treeBuilder.build(bodyOrigin(sourceName, header), header.getBody()));
    }

    /** Parses a complete document, header included, that is already in memory. */
    public OfxDocument parse(String sourceName, String text) throws OfxParseException {
        OfxHeader header = OfxHeader.parse(text);
        TagNode root = treeBuilder.build(bodyOrigin(sourceName, header), header.getBody());
        return new OfxDocument(header, root);
    }

    private static SourceLocation bodyOrigin(String sourceName, OfxHeader header) {
        return new SourceLocation(sourceName, header.getBodyLine(), header.getBodyColumn());
    }
}
