package com.ofx.tagtree.loader;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Header block that precedes the tagged body of an OFX document.
 *
 * <p>OFXv1 uses {@code KEY:VALUE} lines ({@code OFXHEADER:100}, {@code DATA:OFXSGML}, ...). OFXv2
 * uses an optional XML declaration followed by an {@code <?OFX ...?>} processing instruction.
 */
public final class OfxHeader {
    private static final Logger LOGGER = Logger.getLogger(OfxHeader.class.getName());

    private static final Set<String> V1_VERSIONS = Set.of("102", "103", "151", "160");
    private static final Set<String> V2_VERSIONS = Set.of("200", "201", "202", "203", "210", "211", "220");

    private static final Pattern V1_LINE = Pattern.compile("([A-Z]+):(.*)");
    private static final Pattern XML_DECLARATION = Pattern.compile("\\A\\s*<\\?xml\\s+([^?]*)\\?>");
    private static final Pattern OFX_INSTRUCTION = Pattern.compile("\\A\\s*<\\?OFX\\s+([^?]*)\\?>");
    private static final Pattern PI_ATTRIBUTE = Pattern.compile("([A-Za-z]+)\\s*=\\s*\"([^\"]*)\"");

    private final int majorVersion;
    private final String version;
    private final Map<String, String> fields;
    private final String xmlEncoding;
    private final String body;
    private final int bodyLine;
    private final int bodyColumn;

    private OfxHeader(
            int majorVersion,
            String version,
            Map<String, String> fields,
            String xmlEncoding,
            String raw,
            int bodyOffset) {
        this.majorVersion = majorVersion;
        this.version = version;
        this.fields = Collections.unmodifiableMap(fields);
        this.xmlEncoding = xmlEncoding;
        this.body = raw.substring(bodyOffset);
        String prefix = raw.substring(0, bodyOffset);
        int lineBreaks = 0;
        for (int i = 0; i < prefix.length(); i++) {
            if (prefix.charAt(i) == '\n') {
                lineBreaks++;
            }
        }
        this.bodyLine = 1 + lineBreaks;
        this.bodyColumn = prefix.length() - prefix.lastIndexOf('\n');
    }

    public static OfxHeader parse(String raw) throws OfxHeaderException {
        String text = raw.startsWith("\uFEFF") ? raw.substring(1) : raw;
        String stripped = text.stripLeading();
        int start = raw.length() - stripped.length();
        if (stripped.startsWith("OFXHEADER:")) {
            return parseV1(raw, start);
        }
        if (stripped.startsWith("<?")) {
            return parseV2(raw, start);
        }
        throw new OfxHeaderException("Document does not start with an OFX header");
    }

    private static OfxHeader parseV1(String raw, int start) throws OfxHeaderException {
        int bodyStart = raw.indexOf('<', start);
        if (bodyStart < 0) {
            throw new OfxHeaderException("OFXv1 header is not followed by a tagged body");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (String line : raw.substring(start, bodyStart).split("\\r?\\n|\\r")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher matcher = V1_LINE.matcher(trimmed);
            if (!matcher.matches()) {
                throw new OfxHeaderException("Malformed OFXv1 header line: '" + trimmed + "'");
            }
            if (fields.putIfAbsent(matcher.group(1), matcher.group(2).trim()) != null) {
                throw new OfxHeaderException("Duplicate OFXv1 header field " + matcher.group(1));
            }
        }
        require(fields, "OFXHEADER", "100");
        require(fields, "DATA", "OFXSGML");
        String version = fields.get("VERSION");
        if (version == null || !V1_VERSIONS.contains(version)) {
            throw new OfxHeaderException("Unsupported OFXv1 VERSION: " + version);
        }
        return new OfxHeader(1, version, fields, null, raw, bodyStart);
    }

    private static OfxHeader parseV2(String raw, int start) throws OfxHeaderException {
        int position = start;
        String encoding = null;
        Matcher declaration = XML_DECLARATION.matcher(raw).region(position, raw.length());
        if (declaration.find()) {
            encoding = attributes(declaration.group(1)).get("encoding");
            position = declaration.end();
        }
        Matcher instruction = OFX_INSTRUCTION.matcher(raw).region(position, raw.length());
        if (!instruction.find()) {
            throw new OfxHeaderException("OFXv2 document is missing the <?OFX ...?> header");
        }
        Map<String, String> fields = attributes(instruction.group(1));
        require(fields, "OFXHEADER", "200");
        String version = fields.get("VERSION");
        if (version == null || !V2_VERSIONS.contains(version)) {
            throw new OfxHeaderException("Unsupported OFXv2 VERSION: " + version);
        }
        return new OfxHeader(2, version, fields, encoding, raw, instruction.end());
    }

    private static Map<String, String> attributes(String source) {
        Map<String, String> values = new LinkedHashMap<>();
        Matcher matcher = PI_ATTRIBUTE.matcher(source);
        while (matcher.find()) {
            values.put(matcher.group(1), matcher.group(2));
        }
        return values;
    }

    private static void require(Map<String, String> fields, String key, String expected)
            throws OfxHeaderException {
        String actual = fields.get(key);
        if (!expected.equals(actual)) {
            throw new OfxHeaderException(
                    "Header field " + key + " must be " + expected + " but was " + actual);
        }
    }

    /** 1 for SGML headers, 2 for XML headers. */
    public int getMajorVersion() {
        return majorVersion;
    }

    public String getVersion() {
        return version;
    }

    public String getField(String key) {
        return fields.get(key);
    }

    public Map<String, String> getFields() {
        return fields;
    }

    /** The tagged body that follows the header, starting at its first tag. */
    public String getBody() {
        return body;
    }

    /** File line of the first body character, counting header lines from 1. */
    public int getBodyLine() {
        return bodyLine;
    }

    public int getBodyColumn() {
        return bodyColumn;
    }

    /** Charset the body was written in, as declared by the header. */
    public Charset getCharset() {
        if (majorVersion == 2) {
            return xmlEncoding == null ? StandardCharsets.UTF_8 : lookup(xmlEncoding, StandardCharsets.UTF_8);
        }
        String encoding = fields.getOrDefault("ENCODING", "").toUpperCase(Locale.ROOT);
        if ("UTF-8".equals(encoding)) {
            return StandardCharsets.UTF_8;
        }
        String charset = fields.getOrDefault("CHARSET", "").toUpperCase(Locale.ROOT);
        if ("1252".equals(charset)) {
            return lookup("windows-1252", StandardCharsets.ISO_8859_1);
        }
        return StandardCharsets.ISO_8859_1;
    }

    private static Charset lookup(String name, Charset fallback) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            LOGGER.log(Level.WARNING, "Unsupported charset {0}; decoding as {1}", new Object[] {name, fallback});
            return fallback;
        }
    }
}
